package org.shadowlang.compiler.frontend.parser;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.frontend.lexer.Token;

/**
 * A critical parse error: the parser has consumed tokens it cannot give back and the
 * remaining input does not continue the production. Aborts parsing.
 */
public class ParseException extends RuntimeException {

    private final CompilerErrorCode code;
    private final Token token;

    /**
     * @param code The error code.
     * @param message The message, naming what was expected and what was found.
     * @param token The offending token.
     */
    public ParseException(CompilerErrorCode code, String message, Token token) {
        super(message);
        this.code = code;
        this.token = token;
    }

    /**
     * @return The error code.
     */
    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The token at which parsing failed.
     */
    public Token getToken() {
        return token;
    }
}
