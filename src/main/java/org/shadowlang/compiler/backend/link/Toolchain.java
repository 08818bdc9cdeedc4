package org.shadowlang.compiler.backend.link;

import org.shadowlang.compiler.api.AssemblyDocument;

import java.nio.file.Path;

/**
 * Turns an assembly document into an executable.
 */
public interface Toolchain {

    /**
     * Writes the document, assembles it and links the object into an executable.
     * On failure, no executable is left at {@code executable}.
     *
     * @param document The generated assembly.
     * @param assemblyFile Where the assembly source is written.
     * @param executable The executable to produce.
     * @throws ToolchainException if any step fails.
     */
    void build(AssemblyDocument document, Path assemblyFile, Path executable) throws ToolchainException;
}
