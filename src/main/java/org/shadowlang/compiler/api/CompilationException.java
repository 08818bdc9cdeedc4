package org.shadowlang.compiler.api;

import org.shadowlang.compiler.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The diagnostics that led to the failure are kept so callers can inspect error codes
 * without parsing the message.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, Collections.emptyList());
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = Collections.emptyList();
    }

    /**
     * Constructs a new compilation exception carrying the diagnostics that caused it.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The diagnostics collected up to the failing phase.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused this exception; empty if none were attached.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
