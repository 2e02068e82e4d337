package org.csu.konf.common.model;

/**
 * 求值后的值：数值、记录或常量声明的结果。
 */
public sealed interface ConfigValue permits NumberValue, RecordValue, DeclarationValue {
}
