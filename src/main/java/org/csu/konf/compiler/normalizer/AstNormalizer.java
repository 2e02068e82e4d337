package org.csu.konf.compiler.normalizer;

import org.csu.konf.common.exception.MalformedNumberException;
import org.csu.konf.compiler.lexer.Token;
import org.csu.konf.compiler.lexer.TokenType;
import org.csu.konf.compiler.parser.GrammarRule;
import org.csu.konf.compiler.parser.ParseNode;
import org.csu.konf.compiler.parser.ast.ConfigNode;
import org.csu.konf.compiler.parser.ast.ConstDeclNode;
import org.csu.konf.compiler.parser.ast.NumberNode;
import org.csu.konf.compiler.parser.ast.Program;
import org.csu.konf.compiler.parser.ast.RecordEntry;
import org.csu.konf.compiler.parser.ast.RecordNode;
import org.csu.konf.compiler.parser.ast.ReferenceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: AST 规范化
 *
 * 把语法分析树转换为只有四种节点的语义树，去掉标点符号叶子，
 * 并把数值字面量解析为 double。这一阶段不做任何求值和名字解析。
 */
public class AstNormalizer {

    public Program normalize(ParseNode start) {
        expect(start, GrammarRule.START);
        List<ConfigNode> values = new ArrayList<>();
        for (ParseNode child : start.children()) {
            values.add(normalizeValue(child));
        }
        return new Program(values);
    }

    private ConfigNode normalizeValue(ParseNode node) {
        expect(node, GrammarRule.VALUE);
        // value 只有一个子节点，直接展开
        ParseNode inner = node.children().get(0);
        switch (inner.rule()) {
            case TOKEN:
                return toNumber(inner.token());
            case RECORD:
                return normalizeRecord(inner);
            case CONST_DECL:
                return normalizeConstDecl(inner);
            case REFERENCE:
                return normalizeReference(inner);
            default:
                throw new IllegalStateException("Unexpected parse node under value: " + inner.rule());
        }
    }

    private RecordNode normalizeRecord(ParseNode node) {
        List<RecordEntry> entries = new ArrayList<>();
        for (ParseNode child : node.children()) {
            if (child.rule() == GrammarRule.ASSIGN) {
                // NAME '->' value
                String key = child.children().get(0).token().lexeme();
                entries.add(new RecordEntry(key, normalizeValue(child.children().get(2))));
            }
        }
        return new RecordNode(entries);
    }

    private ConstDeclNode normalizeConstDecl(ParseNode node) {
        // 'set' NAME '=' value
        Token setToken = node.children().get(0).token();
        String name = node.children().get(1).token().lexeme();
        ConfigNode value = normalizeValue(node.children().get(3));
        return new ConstDeclNode(name, value, setToken.line(), setToken.column());
    }

    private ReferenceNode normalizeReference(ParseNode node) {
        // '$[' NAME ']'
        Token open = node.children().get(0).token();
        String name = node.children().get(1).token().lexeme();
        return new ReferenceNode(name, open.line(), open.column());
    }

    private NumberNode toNumber(Token token) {
        if (token.type() != TokenType.NUMBER) {
            throw new IllegalStateException("Expected a NUMBER token under value, found " + token);
        }
        double value;
        try {
            value = Double.parseDouble(token.lexeme());
        } catch (NumberFormatException e) {
            throw new MalformedNumberException(token.lexeme(), token.line(), token.column(), e);
        }
        // 1e999 之类溢出为无穷大，不能表示为有限的 64 位浮点数
        if (Double.isInfinite(value)) {
            throw new MalformedNumberException(token.lexeme(), token.line(), token.column());
        }
        return new NumberNode(value);
    }

    private void expect(ParseNode node, GrammarRule rule) {
        if (node.rule() != rule) {
            throw new IllegalStateException("Expected parse node '" + rule + "', found '" + node.rule() + "'");
        }
    }
}
