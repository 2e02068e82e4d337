package org.csu.konf.compiler.parser.ast;

/**
 * 按节点种类分派的访问者。
 *
 * @param <R> 访问结果类型
 */
public interface NodeVisitor<R> {

    R visitNumber(NumberNode node);

    R visitRecord(RecordNode node);

    R visitConstDecl(ConstDeclNode node);

    R visitReference(ReferenceNode node);
}
