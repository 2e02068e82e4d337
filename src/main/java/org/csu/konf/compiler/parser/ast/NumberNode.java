package org.csu.konf.compiler.parser.ast;

/**
 * AST 节点: 数值字面量
 */
public record NumberNode(double value) implements ConfigNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
