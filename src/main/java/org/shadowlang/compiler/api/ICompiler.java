package org.shadowlang.compiler.api;

import org.shadowlang.compiler.frontend.parser.ast.Ast;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the shadowc compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code to an assembly document.
     *
     * @param source The complete source text.
     * @param programName A name for the program, used in diagnostics.
     * @return The assembly document.
     * @throws CompilationException if errors occur during the compilation process.
     */
    AssemblyDocument compile(String source, String programName) throws CompilationException;

    /**
     * Runs lexing, parsing and semantic analysis only.
     *
     * @param source The complete source text.
     * @param programName A name for the program, used in diagnostics.
     * @return The typed AST.
     * @throws CompilationException if errors occur.
     */
    Ast check(String source, String programName) throws CompilationException;

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @return The assembly document.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default AssemblyDocument compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
