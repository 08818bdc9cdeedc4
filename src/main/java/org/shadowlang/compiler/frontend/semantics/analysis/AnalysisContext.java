package org.shadowlang.compiler.frontend.semantics.analysis;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.diagnostics.DiagnosticsEngine;
import org.shadowlang.compiler.frontend.semantics.SemanticException;
import org.shadowlang.compiler.frontend.semantics.SymbolTable;

/**
 * Shared state of one analysis run: the symbol table and the error policy.
 */
public class AnalysisContext {

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final boolean failFast;

    /**
     * @param symbolTable The table receiving all scopes and bindings.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param failFast If true, the first error stops analysis.
     */
    public AnalysisContext(SymbolTable symbolTable, DiagnosticsEngine diagnostics, boolean failFast) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.failFast = failFast;
    }

    /**
     * @return The symbol table.
     */
    public SymbolTable symbols() {
        return symbolTable;
    }

    /**
     * Reports an error after which analysis of sibling nodes continues.
     * @param code The error code.
     * @param message The error message.
     * @param source The position of the error.
     * @throws SemanticException in fail-fast mode.
     */
    public void error(CompilerErrorCode code, String message, SourceInfo source) {
        if (failFast) {
            throw new SemanticException(code, message, source);
        }
        diagnostics.reportError(code, message, source);
    }

    /**
     * Reports an error the analysis cannot continue from.
     * @param code The error code.
     * @param message The error message.
     * @param source The position of the error.
     * @return The exception for the caller to throw.
     */
    public SemanticException critical(CompilerErrorCode code, String message, SourceInfo source) {
        return new SemanticException(code, message, source);
    }

    /**
     * @param message The warning message.
     * @param source The position the warning refers to.
     */
    public void warning(String message, SourceInfo source) {
        diagnostics.reportWarning(message, source);
    }
}
