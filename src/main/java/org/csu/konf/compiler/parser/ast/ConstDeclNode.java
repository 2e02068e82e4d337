package org.csu.konf.compiler.parser.ast;

/**
 * AST 节点: 常量声明 {@code set name = value}
 *
 * 作用域是全局的：求值之后，后续所有引用都能看到它，与嵌套层次无关。
 *
 * @param name   常量名
 * @param value  绑定的值
 * @param line   'set' 关键字所在行
 * @param column 'set' 关键字所在列
 */
public record ConstDeclNode(String name, ConfigNode value, int line, int column) implements ConfigNode {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConstDecl(this);
    }
}
