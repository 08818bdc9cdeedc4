package org.shadowlang.compiler.frontend.parser.ast;

/**
 * The value types of the language. {@link #UNKNOWN} marks a type that is not resolved yet,
 * or could not be resolved because of an earlier error.
 */
public enum Type {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOL("bool"),
    UNKNOWN("?");

    private final String displayName;

    Type(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name used in error messages.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @return true for INT and FLOAT.
     */
    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
