package org.csu.konf.compiler.parser;

/**
 * 语法规则，每个 {@link ParseNode} 对应一条规则的一次实例。
 */
public enum GrammarRule {
    START,       // start      := value+
    VALUE,       // value      := NUMBER | record | const-decl | reference
    RECORD,      // record     := '{' (assign '.')+ '}'
    ASSIGN,      // assign     := NAME '->' value
    CONST_DECL,  // const-decl := 'set' NAME '=' value
    REFERENCE,   // reference  := '$[' NAME ']'
    TOKEN        // 叶子节点，包装一个 Token (包括标点)
}
