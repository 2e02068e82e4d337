package org.csu.konf.common.exception;

/**
 * 错误种类，对应流水线中出错的阶段。
 */
public enum ErrorKind {
    LEX,            // 词法分析
    SYNTAX,         // 语法分析
    NUMBER_FORMAT,  // 数值字面量无法转换为 double
    UNBOUND_NAME    // 引用了尚未声明的常量
}
