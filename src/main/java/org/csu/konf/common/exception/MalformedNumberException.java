package org.csu.konf.common.exception;

/**
 * 数值字面量无法表示为有限的 64 位浮点数，例如 "5e" 或 "1e999"。
 */
public class MalformedNumberException extends KonfException {

    public MalformedNumberException(String literal, int line, int column, Throwable cause) {
        super(ErrorKind.NUMBER_FORMAT,
                String.format("Number Format Error at line %d, column %d: '%s' is not a valid number", line, column, literal),
                line, column, cause);
    }

    public MalformedNumberException(String literal, int line, int column) {
        super(ErrorKind.NUMBER_FORMAT,
                String.format("Number Format Error at line %d, column %d: '%s' is out of range", line, column, literal),
                line, column);
    }
}
