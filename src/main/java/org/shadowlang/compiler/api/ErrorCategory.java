package org.shadowlang.compiler.api;

/**
 * The top-level error taxonomy. Each {@link CompilerErrorCode} belongs to exactly one category.
 */
public enum ErrorCategory {
    /** Unrecognized input characters. */
    LEXICAL,
    /** Token sequences that violate the grammar. */
    PARSE,
    /** Redeclarations and unresolved identifiers. */
    SCOPE,
    /** Operator, assignment and literal type errors. */
    TYPE,
    /** Failures of the external assembler or linker. */
    TOOLCHAIN
}
