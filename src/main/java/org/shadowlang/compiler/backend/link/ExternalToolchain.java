package org.shadowlang.compiler.backend.link;

import org.shadowlang.compiler.api.AssemblyDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the assembler and the linker as external processes.
 * The object file is written next to the executable and removed afterwards.
 */
public class ExternalToolchain implements Toolchain {

    private static final Logger log = LoggerFactory.getLogger(ExternalToolchain.class);

    private final ToolchainSettings settings;

    /**
     * @param settings The commands to run.
     */
    public ExternalToolchain(ToolchainSettings settings) {
        this.settings = settings;
    }

    @Override
    public void build(AssemblyDocument document, Path assemblyFile, Path executable) throws ToolchainException {
        Path objectFile = executable.resolveSibling(executable.getFileName() + ".o");
        try {
            write(document, assemblyFile);

            List<String> assemble = new ArrayList<>();
            assemble.add(settings.assembler());
            assemble.addAll(settings.assemblerArgs());
            assemble.add(assemblyFile.toString());
            assemble.add("-o");
            assemble.add(objectFile.toString());
            run(assemble, ToolchainStage.ASSEMBLY_FAILED);

            List<String> link = new ArrayList<>();
            link.add(settings.linker());
            link.addAll(settings.linkerArgs());
            link.add("-o");
            link.add(executable.toString());
            link.add(objectFile.toString());
            link.addAll(settings.libraries());
            run(link, ToolchainStage.LINK_FAILED);
            log.info("Linked executable {}", executable);
        } catch (ToolchainException e) {
            deleteQuietly(executable);
            throw e;
        } finally {
            deleteQuietly(objectFile);
        }
    }

    private void write(AssemblyDocument document, Path assemblyFile) throws ToolchainException {
        try {
            Path parent = assemblyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(assemblyFile, document.render(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolchainException(ToolchainStage.WRITE_FAILED,
                    "Failed to write assembly file " + assemblyFile + ": " + e.getMessage(), e);
        }
    }

    private void run(List<String> command, ToolchainStage failureStage) throws ToolchainException {
        log.debug("Running {}", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolchainException(ToolchainStage.TOOL_NOT_FOUND,
                    "Failed to start '" + command.get(0) + "'. Please ensure it is installed and in your PATH.", e);
        }

        String output;
        int exitCode;
        try (InputStream stream = process.getInputStream()) {
            output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            exitCode = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ToolchainException(failureStage,
                    "Failed to read the output of '" + command.get(0) + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolchainException(failureStage, "Interrupted while running '" + command.get(0) + "'.", e);
        }

        if (exitCode != 0) {
            throw new ToolchainException(failureStage,
                    String.format("'%s' exited with status %d.", command.get(0), exitCode), output.strip());
        }
        if (!output.isBlank()) {
            log.debug("[{}] {}", command.get(0), output.strip());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
