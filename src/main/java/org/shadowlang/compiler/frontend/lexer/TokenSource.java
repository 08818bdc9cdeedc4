package org.shadowlang.compiler.frontend.lexer;

/**
 * Anything that hands out tokens one at a time: the {@link Lexer} itself when the parser pulls
 * on demand, or the consumer end of a {@link TokenPipeline}.
 */
@FunctionalInterface
public interface TokenSource {
    /**
     * @return The next token; {@link TokenType#END_OF_FILE} once exhausted, never {@code null}.
     */
    Token nextToken();
}
