package org.shadowlang.compiler;

import org.shadowlang.compiler.api.AssemblyDocument;
import org.shadowlang.compiler.api.CompilationException;
import org.shadowlang.compiler.api.ICompiler;
import org.shadowlang.compiler.backend.link.Toolchain;
import org.shadowlang.compiler.backend.link.ToolchainException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Helper to compile a source file and hand the result to the toolchain.
 */
public final class CompilerRunner {

    private CompilerRunner() {}

    /**
     * Compiles {@code source} and builds {@code executable} from it. If any step fails, no
     * executable is left behind.
     *
     * @param compiler The compiler.
     * @param toolchain The assembler and linker.
     * @param source The source file.
     * @param assemblyFile Where the assembly is written.
     * @param executable The executable to produce.
     * @return The assembly document the executable was built from.
     * @throws CompilationException if the source does not compile.
     * @throws ToolchainException if assembling or linking fails.
     * @throws IOException if the source cannot be read.
     */
    public static AssemblyDocument build(ICompiler compiler, Toolchain toolchain, Path source,
                                         Path assemblyFile, Path executable)
            throws CompilationException, ToolchainException, IOException {
        AssemblyDocument document;
        try {
            document = compiler.compile(source);
        } catch (CompilationException e) {
            Files.deleteIfExists(executable);
            throw e;
        }
        toolchain.build(document, assemblyFile, executable);
        return document;
    }
}
