package org.shadowlang.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Names and literals.
    /** An identifier, such as a variable name. */
    IDENTIFIER,
    /** A reserved word: if, else, for, shadow. */
    KEYWORD,
    /** A numeric, string or boolean literal. */
    CONSTANT,

    // Operators and punctuation.
    /** An arithmetic, comparison or logical operator, including the unary '!' and '-'. */
    OPERATOR,
    /** The ',' separating list elements. */
    SEPARATOR,
    /** The single '=' of an assignment. */
    ASSIGNMENT,
    /** The ';' separating the parts of a loop header. */
    SEMICOLON,
    /** The '(' character. */
    PAREN_OPEN,
    /** The ')' character. */
    PAREN_CLOSE,
    /** The '{' character. */
    CURLY_OPEN,
    /** The '}' character. */
    CURLY_CLOSE,

    // Miscellaneous.
    /** Represents the end of the input. Returned repeatedly once the input is exhausted. */
    END_OF_FILE
}
