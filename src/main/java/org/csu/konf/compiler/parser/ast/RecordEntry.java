package org.csu.konf.compiler.parser.ast;

/**
 * 记录中的一个条目 {@code key -> value}。
 */
public record RecordEntry(String key, ConfigNode value) {
}
