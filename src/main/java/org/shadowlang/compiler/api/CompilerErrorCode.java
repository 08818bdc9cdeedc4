package org.shadowlang.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that starts no token. */
    UNRECOGNIZED_CHARACTER(ErrorCategory.LEXICAL),
    /** A string literal that is not closed on the same line. */
    UNTERMINATED_STRING(ErrorCategory.LEXICAL),
    // endregion

    // region Parser Errors
    /** The token sequence violates the grammar. */
    UNEXPECTED_TOKEN(ErrorCategory.PARSE),
    /** An assignment has a different number of targets and values. */
    ASSIGNMENT_ARITY_MISMATCH(ErrorCategory.PARSE),
    // endregion

    // region Semantic Analysis Errors
    /** A name was declared twice in the same scope or the same assignment. */
    REDECLARATION(ErrorCategory.SCOPE),
    /** A name was read before any binding for it exists. */
    UNRESOLVED_IDENTIFIER(ErrorCategory.SCOPE),
    /** A value of one type was assigned to a variable bound to another type. */
    ASSIGNMENT_TYPE_MISMATCH(ErrorCategory.TYPE),
    /** The operand types do not fit the operator. */
    OPERAND_TYPE_MISMATCH(ErrorCategory.TYPE),
    /** A literal whose shape matches no type. */
    INVALID_LITERAL(ErrorCategory.TYPE),
    /** The test of an if or for is not a bool. */
    CONDITION_NOT_BOOL(ErrorCategory.TYPE),
    /** The tree violates an invariant the parser guarantees. */
    MALFORMED_TREE(ErrorCategory.TYPE),
    // endregion

    // region Toolchain Errors
    /** The assembler or linker executable could not be found. */
    TOOL_NOT_FOUND(ErrorCategory.TOOLCHAIN),
    /** The assembler rejected the generated assembly. */
    ASSEMBLY_FAILED(ErrorCategory.TOOLCHAIN),
    /** The linker failed to produce the executable. */
    LINK_FAILED(ErrorCategory.TOOLCHAIN),
    // endregion

    // region General Errors
    /** An I/O error occurred while reading or writing a file. */
    IO_ERROR(ErrorCategory.TOOLCHAIN);
    // endregion

    private final ErrorCategory category;

    CompilerErrorCode(ErrorCategory category) {
        this.category = category;
    }

    /**
     * @return The category of the error taxonomy this code belongs to.
     */
    public ErrorCategory category() {
        return category;
    }
}
