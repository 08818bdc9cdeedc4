package org.shadowlang.cli.commands;

import org.shadowlang.cli.CommandLineInterface;
import org.shadowlang.compiler.CompilerOptions;
import org.shadowlang.compiler.api.CompilationException;
import org.shadowlang.compiler.diagnostics.Diagnostic;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Common part of the subcommands that take a single source file.
 */
abstract class AbstractSourceCommand {

    @Parameters(index = "0", paramLabel = "SOURCE", description = "The source file to compile.")
    protected Path source;

    @ParentCommand
    protected CommandLineInterface parent;

    @Spec
    protected CommandSpec spec;

    /**
     * @return The options from the configuration, before command-specific overrides.
     */
    protected CompilerOptions loadOptions() {
        return CompilerOptions.fromConfig(parent.getConfig());
    }

    /**
     * Prints the diagnostics of a failed compilation to the error stream.
     * @param e The failure.
     */
    protected void printFailure(CompilationException e) {
        PrintWriter err = spec.commandLine().getErr();
        if (e.getDiagnostics().isEmpty()) {
            err.println("Compilation failed: " + e.getMessage());
        } else {
            e.getDiagnostics().forEach(err::println);
        }
        err.flush();
    }

    /**
     * Prints the warnings of a successful compilation to the error stream.
     * @param diagnostics All diagnostics of the compilation.
     */
    protected void printWarnings(List<Diagnostic> diagnostics) {
        PrintWriter err = spec.commandLine().getErr();
        diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .forEach(err::println);
        err.flush();
    }

    /**
     * Prints an I/O failure while reading the source.
     * @param e The failure.
     */
    protected void printUnreadable(IOException e) {
        spec.commandLine().getErr().println("Cannot read source file " + source + ": " + e.getMessage());
        spec.commandLine().getErr().flush();
    }
}
