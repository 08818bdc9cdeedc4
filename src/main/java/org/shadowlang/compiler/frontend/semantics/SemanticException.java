package org.shadowlang.compiler.frontend.semantics;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.SourceInfo;

/**
 * Stops semantic analysis immediately. Thrown for critical errors, where the tree breaks an
 * invariant the parser guarantees, and for the first error when analysis runs fail-fast.
 */
public class SemanticException extends RuntimeException {

    private final CompilerErrorCode code;
    private final SourceInfo source;

    /**
     * @param code The error code.
     * @param message The error message.
     * @param source The position of the error.
     */
    public SemanticException(CompilerErrorCode code, String message, SourceInfo source) {
        super(message);
        this.code = code;
        this.source = source;
    }

    /**
     * @return The error code.
     */
    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The position of the error.
     */
    public SourceInfo getSource() {
        return source;
    }
}
