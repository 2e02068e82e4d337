package org.csu.konf.compiler.parser;

import org.csu.konf.common.exception.ParseException;
import org.csu.konf.compiler.lexer.Token;
import org.csu.konf.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为与文法同构的语法分析树。
 *
 * <pre>
 * start      := value+
 * value      := NUMBER | record | const-decl | reference
 * record     := '{' (assign '.')+ '}'
 * assign     := NAME '->' value
 * const-decl := 'set' NAME '=' value
 * reference  := '$[' NAME ']'
 * </pre>
 * 各候选分支的首 Token 互不相同，因此只需向前看一个 Token。
 */
public class Parser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int position = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(List<Token> tokens, int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1, got " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * @return 根节点为 START 的语法分析树
     * @throws ParseException Token 序列不符合文法时
     */
    public ParseNode parse() {
        List<ParseNode> values = new ArrayList<>();
        // value+ : 至少一个值
        values.add(parseValue());
        while (!isAtEnd()) {
            values.add(parseValue());
        }
        return ParseNode.branch(GrammarRule.START, values);
    }

    private ParseNode parseValue() {
        enter();
        ParseNode inner;
        if (check(TokenType.NUMBER)) {
            inner = ParseNode.leaf(advance());
        } else if (check(TokenType.LBRACE)) {
            inner = parseRecord();
        } else if (check(TokenType.SET)) {
            inner = parseConstDecl();
        } else if (check(TokenType.REF_OPEN)) {
            inner = parseReference();
        } else {
            throw new ParseException(peek(), "a value (a number, '{', 'set' or '$[')");
        }
        depth--;
        return ParseNode.branch(GrammarRule.VALUE, List.of(inner));
    }

    private ParseNode parseRecord() {
        List<ParseNode> children = new ArrayList<>();
        children.add(ParseNode.leaf(consume(TokenType.LBRACE, "'{'")));
        // (assign '.')+ : 空记录 {} 是语法错误
        do {
            children.add(parseAssign());
            children.add(ParseNode.leaf(consume(TokenType.DOT, "'.' after record entry")));
        } while (!check(TokenType.RBRACE));
        children.add(ParseNode.leaf(consume(TokenType.RBRACE, "'}'")));
        return ParseNode.branch(GrammarRule.RECORD, children);
    }

    private ParseNode parseAssign() {
        Token name = consume(TokenType.NAME, "record key name");
        Token arrow = consume(TokenType.ARROW, "'->' after record key");
        ParseNode value = parseValue();
        return ParseNode.branch(GrammarRule.ASSIGN, List.of(ParseNode.leaf(name), ParseNode.leaf(arrow), value));
    }

    private ParseNode parseConstDecl() {
        Token set = consume(TokenType.SET, "'set' keyword");
        Token name = consume(TokenType.NAME, "constant name after 'set'");
        Token equal = consume(TokenType.EQUAL, "'=' after constant name");
        ParseNode value = parseValue();
        return ParseNode.branch(GrammarRule.CONST_DECL,
                List.of(ParseNode.leaf(set), ParseNode.leaf(name), ParseNode.leaf(equal), value));
    }

    private ParseNode parseReference() {
        Token open = consume(TokenType.REF_OPEN, "'$['");
        Token name = consume(TokenType.NAME, "constant name in reference");
        Token close = consume(TokenType.RBRACKET, "']' after reference name");
        return ParseNode.branch(GrammarRule.REFERENCE,
                List.of(ParseNode.leaf(open), ParseNode.leaf(name), ParseNode.leaf(close)));
    }

    // 每进入一层 value 深度加一，防止过深的嵌套在后续递归阶段撑爆调用栈
    private void enter() {
        if (++depth > maxNestingDepth) {
            throw new ParseException("Nesting depth exceeds the limit of " + maxNestingDepth, peek());
        }
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
