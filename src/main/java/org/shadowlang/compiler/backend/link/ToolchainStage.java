package org.shadowlang.compiler.backend.link;

import org.shadowlang.compiler.api.CompilerErrorCode;

/**
 * The step of the external build that failed.
 */
public enum ToolchainStage {
    /** The assembly file or an intermediate file could not be written. */
    WRITE_FAILED(CompilerErrorCode.IO_ERROR),
    /** The assembler or linker executable could not be started. */
    TOOL_NOT_FOUND(CompilerErrorCode.TOOL_NOT_FOUND),
    /** The assembler exited with a non-zero status. */
    ASSEMBLY_FAILED(CompilerErrorCode.ASSEMBLY_FAILED),
    /** The linker exited with a non-zero status. */
    LINK_FAILED(CompilerErrorCode.LINK_FAILED);

    private final CompilerErrorCode code;

    ToolchainStage(CompilerErrorCode code) {
        this.code = code;
    }

    /**
     * @return The error code reported for this stage.
     */
    public CompilerErrorCode code() {
        return code;
    }
}
