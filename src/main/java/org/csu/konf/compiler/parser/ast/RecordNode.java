package org.csu.konf.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 记录 {@code { A -> 1. B -> 2. }}
 *
 * @param entries 按源码顺序排列的条目，重复的键在这一阶段不合并
 */
public record RecordNode(List<RecordEntry> entries) implements ConfigNode {

    public RecordNode {
        entries = List.copyOf(entries);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRecord(this);
    }
}
