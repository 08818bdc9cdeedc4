package org.shadowlang.compiler.frontend.lexer;

import org.shadowlang.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, operator).
 * @param text The exact text of the token from the source code.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token as a {@link SourceInfo}.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * Checks type and text at once.
     * @param expectedType The expected token type.
     * @param expectedText The expected token text.
     * @return true if both match.
     */
    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    /**
     * @return A short, user-facing description used in "found ..." parts of error messages.
     */
    public String describe() {
        return type == TokenType.END_OF_FILE ? "end of input" : "'" + text + "'";
    }
}
