package org.csu.konf.compiler.parser.ast;

import java.util.List;

/**
 * 一个完整的程序：顶层值的有序序列。
 */
public record Program(List<ConfigNode> values) {

    public Program {
        values = List.copyOf(values);
    }
}
