package org.shadowlang.compiler;

import com.typesafe.config.Config;
import org.shadowlang.compiler.backend.link.ToolchainSettings;

import java.util.Locale;

/**
 * Typed view of the {@code shadowc} configuration block.
 *
 * @param lexerMode Whether the lexer runs on its own thread or is pulled by the parser.
 * @param failFast If true, semantic analysis stops at the first error.
 * @param optimize If true, the default emission rules rewrite the generated program.
 * @param toolchain The external assembler and linker commands.
 */
public record CompilerOptions(
        LexerMode lexerMode,
        boolean failFast,
        boolean optimize,
        ToolchainSettings toolchain
) {

    /**
     * How tokens get from the lexer to the parser.
     */
    public enum LexerMode {
        /** The lexer runs on a producer thread, handing over one token at a time. */
        CONCURRENT,
        /** The parser pulls tokens from the lexer on the calling thread. */
        PULL
    }

    /**
     * @return Concurrent lexing, full error reporting, optimization on, default toolchain.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(LexerMode.CONCURRENT, false, true, ToolchainSettings.defaults());
    }

    /**
     * Reads the options from the {@code shadowc} block of the given configuration.
     * @param config The root configuration, usually with {@code reference.conf} as fallback.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     * @throws IllegalArgumentException if the lexer mode is unknown.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config shadowc = config.getConfig("shadowc");
        LexerMode mode = LexerMode.valueOf(shadowc.getString("lexer.mode").toUpperCase(Locale.ROOT));
        return new CompilerOptions(
                mode,
                shadowc.getBoolean("analysis.fail-fast"),
                shadowc.getBoolean("codegen.optimize"),
                ToolchainSettings.fromConfig(shadowc.getConfig("toolchain")));
    }

    /**
     * @param enabled Whether emission rules run.
     * @return A copy with the given optimization setting.
     */
    public CompilerOptions withOptimize(boolean enabled) {
        return new CompilerOptions(lexerMode, failFast, enabled, toolchain);
    }
}
