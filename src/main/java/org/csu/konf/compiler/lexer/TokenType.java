package org.csu.konf.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * konf 语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    SET,        // "set"

    // ---- 标识符 (Identifier) ----
    NAME,       // 记录键名、常量名

    // ---- 常量 (Constants) ----
    NUMBER,     // 数值常量, e.g., 5, -1.5, .5, 2e10

    // ---- 符号 (Symbols) ----
    ARROW,      // ->
    EQUAL,      // =
    DOT,        // . 记录条目的终结符
    LBRACE,     // {
    RBRACE,     // }
    REF_OPEN,   // $[
    RBRACKET,   // ]

    // ---- 特殊 Token ----
    EOF         // End-Of-File，表示输入流结束
}
