package org.shadowlang.cli.commands;

import org.shadowlang.cli.CommandLineInterface;
import org.shadowlang.compiler.Compiler;
import org.shadowlang.compiler.CompilerOptions;
import org.shadowlang.compiler.CompilerRunner;
import org.shadowlang.compiler.api.CompilationException;
import org.shadowlang.compiler.backend.link.ExternalToolchain;
import org.shadowlang.compiler.backend.link.Toolchain;
import org.shadowlang.compiler.backend.link.ToolchainException;
import org.shadowlang.compiler.backend.link.ToolchainSettings;
import org.shadowlang.compiler.backend.link.ToolchainStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
    name = "compile",
    description = "Compiles a source file to a native executable.",
    exitCodeOnInvalidInput = CommandLineInterface.EXIT_COMPILATION_FAILED
)
public class CompileCommand extends AbstractSourceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Option(names = {"-o", "--output"}, paramLabel = "EXE",
            description = "The executable to produce (default: the source file name without extension).")
    private Path output;

    @Option(names = "--keep-asm", paramLabel = "PATH", description = "Write the generated assembly to PATH and keep it.")
    private Path keepAsm;

    @Option(names = "--no-optimize", description = "Skip the emission rules that rewrite the generated program.")
    private boolean noOptimize;

    private final Function<ToolchainSettings, Toolchain> toolchainFactory;
    private final TemporaryFiles temporaryFiles;

    public CompileCommand() {
        this(ExternalToolchain::new);
    }

    /**
     * @param toolchainFactory Creates the toolchain from the configured settings.
     */
    public CompileCommand(Function<ToolchainSettings, Toolchain> toolchainFactory) {
        this(toolchainFactory, () -> Files.createTempFile("shadowc-", ".asm"));
    }

    CompileCommand(Function<ToolchainSettings, Toolchain> toolchainFactory, TemporaryFiles temporaryFiles) {
        this.toolchainFactory = toolchainFactory;
        this.temporaryFiles = temporaryFiles;
    }

    /**
     * Creates the file the assembly is written to when {@code --keep-asm} is not given.
     */
    @FunctionalInterface
    interface TemporaryFiles {
        Path createAssemblyFile() throws IOException;
    }

    @Override
    public Integer call() {
        CompilerOptions options = loadOptions();
        if (noOptimize) {
            options = options.withOptimize(false);
        }
        Compiler compiler = new Compiler(options);
        Toolchain toolchain = toolchainFactory.apply(options.toolchain());
        Path executable = output != null ? output : defaultExecutable(source);
        PrintWriter err = spec.commandLine().getErr();

        Path assemblyFile = null;
        try {
            assemblyFile = keepAsm != null ? keepAsm : createAssemblyFile();
            CompilerRunner.build(compiler, toolchain, source, assemblyFile, executable);
            printWarnings(compiler.getDiagnostics());
            log.info("Compiled {} to {}", source, executable);
            return CommandLineInterface.EXIT_OK;
        } catch (CompilationException e) {
            printFailure(e);
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        } catch (ToolchainException e) {
            err.println("[" + e.getStage().code() + "] " + e.getMessage());
            if (!e.getToolOutput().isBlank()) {
                err.println(e.getToolOutput());
            }
            err.flush();
            return CommandLineInterface.EXIT_TOOLCHAIN_FAILED;
        } catch (IOException e) {
            printUnreadable(e);
            return CommandLineInterface.EXIT_COMPILATION_FAILED;
        } finally {
            if (keepAsm == null && assemblyFile != null) {
                deleteTemporary(assemblyFile);
            }
        }
    }

    private Path createAssemblyFile() throws ToolchainException {
        try {
            return temporaryFiles.createAssemblyFile();
        } catch (IOException e) {
            throw new ToolchainException(ToolchainStage.WRITE_FAILED,
                    "Cannot create temporary assembly file: " + e.getMessage(), e);
        }
    }

    static Path defaultExecutable(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name + ".out";
        return source.resolveSibling(base);
    }

    private static void deleteTemporary(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary assembly file {}: {}", file, e.getMessage());
        }
    }
}
