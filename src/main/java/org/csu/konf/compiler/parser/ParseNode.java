package org.csu.konf.compiler.parser;

import org.csu.konf.compiler.lexer.Token;

import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析树 (具体语法树) 的节点
 *
 * 形状与文法一一对应，标点符号也作为 TOKEN 叶子保留，
 * 由 AstNormalizer 负责去除。只在 parse -> normalize 之间存在。
 *
 * @param rule     对应的文法规则
 * @param token    叶子节点的 Token，非叶子节点为 null
 * @param children 子节点，叶子节点为空列表
 */
public record ParseNode(GrammarRule rule, Token token, List<ParseNode> children) {

    public static ParseNode leaf(Token token) {
        return new ParseNode(GrammarRule.TOKEN, token, List.of());
    }

    public static ParseNode branch(GrammarRule rule, List<ParseNode> children) {
        return new ParseNode(rule, null, List.copyOf(children));
    }

    public boolean isLeaf() {
        return rule == GrammarRule.TOKEN;
    }

    /**
     * 生成缩进格式的树形文本，用于调试输出。
     */
    public String toTreeString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, 0);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth));
        if (isLeaf()) {
            sb.append(token.type()).append(" '").append(token.lexeme()).append("'\n");
            return;
        }
        sb.append(rule.name().toLowerCase()).append('\n');
        for (ParseNode child : children) {
            child.appendTo(sb, depth + 1);
        }
    }
}
