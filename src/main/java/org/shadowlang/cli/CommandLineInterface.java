package org.shadowlang.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.shadowlang.cli.commands.CheckCommand;
import org.shadowlang.cli.commands.CompileCommand;
import org.shadowlang.cli.commands.EmitCommand;
import org.shadowlang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "shadowc",
    mixinStandardHelpOptions = true,
    version = "shadowc 1.0",
    description = "shadowc - compiler for the shadow language",
    exitCodeOnInvalidInput = CommandLineInterface.EXIT_COMPILATION_FAILED,
    subcommands = {
        CompileCommand.class,
        EmitCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The command completed. */
    public static final int EXIT_OK = 0;
    /** The source had errors, could not be read, or the invocation was invalid. */
    public static final int EXIT_COMPILATION_FAILED = 1;
    /** The assembler or linker failed. */
    public static final int EXIT_TOOLCHAIN_FAILED = 2;

    private static final String CONFIG_FILE_NAME = "shadowc.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: shadowc.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Print debug output of the compiler phases."
    )
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("shadowc");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = load(this.configFile);
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw new CommandLine.ParameterException(spec.commandLine(),
                                "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
                    }
                    logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
                    this.config = load(systemConfigFile);
                } else {
                    // 3) Then: shadowc.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = load(cwdConfigFile);
                    } else {
                        // 4) Finally: classpath defaults only
                        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = ConfigFactory.systemProperties()
                                .withFallback(ConfigFactory.systemEnvironment())
                                .withFallback(ConfigFactory.load())
                                .resolve();
                    }
                }
            }
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }

        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config load(final File file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The merged configuration.
     * @throws CommandLine.ParameterException if a named configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
