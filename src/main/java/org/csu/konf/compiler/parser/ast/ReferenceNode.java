package org.csu.konf.compiler.parser.ast;

/**
 * AST 节点: 引用 {@code $[name]}，在求值时到环境中查找。
 */
public record ReferenceNode(String name, int line, int column) implements ConfigNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReference(this);
    }
}
