package org.shadowlang.compiler.diagnostics;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * It is not thread-safe; only the compiler's calling thread reports into it.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param source  The position of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, source));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  The position of the warning.
     */
    public void reportWarning(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message, source));
    }

    /**
     * Adds an already built diagnostic, e.g. one handed over from the lexer thread.
     *
     * @param diagnostic The diagnostic to add.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of errors reported so far.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * @return The first reported error, if any.
     */
    Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * Removes all errors of the given category, keeping warnings and other errors.
     * Used when a lexical error makes the parse errors it caused meaningless.
     *
     * @param codes The codes whose diagnostics should be dropped.
     */
    public void discardErrors(List<CompilerErrorCode> codes) {
        diagnostics.removeIf(d -> d.type() == Diagnostic.Type.ERROR && codes.contains(d.code()));
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
