package org.shadowlang.compiler.backend.link;

/**
 * Thrown when the external assembler or linker could not turn the assembly into an executable.
 */
public class ToolchainException extends Exception {

    private final ToolchainStage stage;
    private final String toolOutput;

    /**
     * @param stage The failing step.
     * @param message The error message.
     * @param toolOutput Everything the tool printed, or an empty string.
     */
    public ToolchainException(ToolchainStage stage, String message, String toolOutput) {
        super(message);
        this.stage = stage;
        this.toolOutput = toolOutput;
    }

    /**
     * @param stage The failing step.
     * @param message The error message.
     * @param cause The cause.
     */
    public ToolchainException(ToolchainStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.toolOutput = "";
    }

    /**
     * @return The failing step.
     */
    public ToolchainStage getStage() {
        return stage;
    }

    /**
     * @return The combined stdout and stderr of the failing tool.
     */
    public String getToolOutput() {
        return toolOutput;
    }
}
