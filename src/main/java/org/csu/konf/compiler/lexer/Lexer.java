package org.csu.konf.compiler.lexer;

import org.csu.konf.common.exception.LexException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将 konf 源文本分解为一系列的 Token。
 * 空白和以 '#' 开头直到行尾的注释会被跳过，不产生 Token。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表，区分大小写
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("set", TokenType.SET);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     * @throws LexException 遇到无法识别的字符时
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespaceAndComments();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        if (isLetter(currentChar)) {
            return readNameOrKeyword();
        }

        // 数字：123、.5 (没有整数部分)
        if (isDigit(currentChar) || (currentChar == '.' && isDigit(peekNext()))) {
            return readNumber();
        }

        switch (currentChar) {
            case '-':
                if (peekNext() == '>') {
                    int startCol = column;
                    advance();
                    advance();
                    return new Token(TokenType.ARROW, "->", line, startCol);
                }
                // 负数字面量：-5、-.5
                if (isDigit(peekNext()) || (peekNext() == '.' && isDigit(peekAt(2)))) {
                    return readNumber();
                }
                throw new LexException("'-' must start '->' or a negative number", line, column);
            case '$':
                if (peekNext() == '[') {
                    int startCol = column;
                    advance();
                    advance();
                    return new Token(TokenType.REF_OPEN, "$[", line, startCol);
                }
                throw new LexException("'$' must be followed by '['", line, column);
            case '=':
                return consumeAndReturn(TokenType.EQUAL, "=");
            case '.':
                return consumeAndReturn(TokenType.DOT, ".");
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            case ']':
                return consumeAndReturn(TokenType.RBRACKET, "]");
            default:
                throw new LexException("Unexpected character '" + currentChar + "'", line, column);
        }
    }

    private Token readNameOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.NAME);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        if (peek() == '-') {
            advance();
        }
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        // 只有小数点后面还有数字时才是小数部分，否则它是记录条目的终结符 "10."
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        // 指数部分贪婪读取，缺少数字的 "5e" 留给 AstNormalizer 报 NumberFormat 错误
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER, number, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (ch == '#') {
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (position + offset >= input.length()) return '\0';
        return input.charAt(position + offset);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    // 只接受 ASCII 字母，不含下划线
    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
