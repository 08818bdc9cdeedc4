package org.shadowlang.compiler.frontend.parser.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * All binary and unary operators of the language.
 */
public enum Operator {
    PLUS("+", Category.ARITHMETIC),
    MINUS("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    EQUAL("==", Category.COMPARISON),
    NOT_EQUAL("!=", Category.COMPARISON),
    LESS_EQUAL("<=", Category.COMPARISON),
    GREATER_EQUAL(">=", Category.COMPARISON),
    LESS("<", Category.COMPARISON),
    GREATER(">", Category.COMPARISON),
    AND("&&", Category.LOGICAL),
    OR("||", Category.LOGICAL),
    NEGATE("-", Category.UNARY),
    NOT("!", Category.UNARY);

    /**
     * Groups operators by the typing rule that applies to them.
     */
    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL,
        UNARY
    }

    private final String symbol;
    private final Category category;

    Operator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    /**
     * @return The operator as written in source code.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return The category of this operator.
     */
    public Category category() {
        return category;
    }

    /**
     * @return true for all operators that take two operands.
     */
    public boolean isBinary() {
        return category != Category.UNARY;
    }

    /**
     * Looks up a binary operator by its source text.
     * @param symbol The operator text, e.g. "&&".
     * @return The operator, or empty if the text is not a binary operator.
     */
    public static Optional<Operator> fromBinarySymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.isBinary() && op.symbol.equals(symbol))
                .findFirst();
    }

    /**
     * Looks up a unary operator by its source text.
     * @param symbol The operator text, "-" or "!".
     * @return The operator, or empty if the text is not a unary operator.
     */
    public static Optional<Operator> fromUnarySymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> !op.isBinary() && op.symbol.equals(symbol))
                .findFirst();
    }
}
