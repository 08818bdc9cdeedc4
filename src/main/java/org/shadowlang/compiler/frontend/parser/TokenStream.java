package org.shadowlang.compiler.frontend.parser;

import org.shadowlang.compiler.frontend.lexer.Token;
import org.shadowlang.compiler.frontend.lexer.TokenSource;
import org.shadowlang.compiler.frontend.lexer.TokenType;

/**
 * The parser's view of the token sequence: a pull interface with a one-token pushback buffer.
 * The grammar never needs more than one token of lookahead after a failed match.
 */
public class TokenStream {

    private final TokenSource source;
    private Token pushedBack;
    private Token endOfFile;

    /**
     * Creates a stream over the given source.
     * @param source The lexer, or the consumer end of a token pipeline.
     */
    public TokenStream(TokenSource source) {
        this.source = source;
    }

    /**
     * Returns the pushed-back token if there is one, otherwise pulls the next token from the source.
     * An exhausted stream yields {@link TokenType#END_OF_FILE} on every call.
     * @return The next token.
     */
    public Token next() {
        if (pushedBack != null) {
            Token token = pushedBack;
            pushedBack = null;
            return token;
        }
        if (endOfFile != null) {
            return endOfFile;
        }
        Token token = source.nextToken();
        if (token.type() == TokenType.END_OF_FILE) {
            endOfFile = token;
        }
        return token;
    }

    /**
     * Stores a token to be returned by the next call to {@link #next()}.
     * @param token The token to replay.
     * @throws IllegalStateException if a token is already buffered.
     */
    public void pushBack(Token token) {
        if (pushedBack != null) {
            throw new IllegalStateException("Cannot push back '" + token.text()
                    + "': token '" + pushedBack.text() + "' is already buffered.");
        }
        pushedBack = token;
    }

    /**
     * Looks at the next token without consuming it.
     * @return The next token.
     */
    public Token peek() {
        Token token = next();
        pushBack(token);
        return token;
    }

    /**
     * Consumes the next token if it has the given type and text.
     * @param type The expected type.
     * @param text The expected text.
     * @return true if the token matched and was consumed.
     */
    public boolean match(TokenType type, String text) {
        Token token = next();
        if (token.is(type, text)) {
            return true;
        }
        pushBack(token);
        return false;
    }

    /**
     * Consumes the next token if it has the given type.
     * @param type The expected type.
     * @return true if the token matched and was consumed.
     */
    public boolean match(TokenType type) {
        Token token = next();
        if (token.type() == type) {
            return true;
        }
        pushBack(token);
        return false;
    }
}
