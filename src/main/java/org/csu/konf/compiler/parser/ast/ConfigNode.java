package org.csu.konf.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 语义树 (AST) 节点
 *
 * 只有四种节点：数值、记录、常量声明、引用。
 * 使用 sealed 接口，新增节点种类时 {@link NodeVisitor} 的所有实现都必须跟着补齐。
 */
public sealed interface ConfigNode permits NumberNode, RecordNode, ConstDeclNode, ReferenceNode {

    <R> R accept(NodeVisitor<R> visitor);
}
