package org.csu.konf.common.exception;

import org.csu.konf.compiler.lexer.Token;

/**
 * @author hidyouth
 */
public class ParseException extends KonfException {

    public ParseException(Token token, String expected) {
        super(ErrorKind.SYNTAX, String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                        token.line(),
                        token.column(),
                        expected,
                        token.lexeme(),
                        token.type()),
                token.line(), token.column());
    }

    public ParseException(String message, Token token) {
        super(ErrorKind.SYNTAX, String.format("Syntax Error at line %d, column %d: %s",
                        token.line(), token.column(), message),
                token.line(), token.column());
    }
}
