package org.csu.konf.common.exception;

/**
 * 词法分析阶段的异常：输入中的字符无法匹配任何 Token。
 */
public class LexException extends KonfException {

    public LexException(String message, int line, int column) {
        super(ErrorKind.LEX, String.format("Lexical Error at line %d, column %d: %s", line, column, message),
                line, column);
    }
}
