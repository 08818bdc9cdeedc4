package org.shadowlang.compiler.backend.link;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Commands of the external assembler and linker.
 *
 * @param assembler The assembler executable.
 * @param assemblerArgs Arguments placed before the source file.
 * @param linker The linker executable.
 * @param linkerArgs Arguments placed before the output option.
 * @param libraries Library options placed after the object file.
 */
public record ToolchainSettings(
        String assembler,
        List<String> assemblerArgs,
        String linker,
        List<String> linkerArgs,
        List<String> libraries
) {

    /**
     * Compact constructor making the lists immutable.
     */
    public ToolchainSettings {
        assemblerArgs = List.copyOf(assemblerArgs);
        linkerArgs = List.copyOf(linkerArgs);
        libraries = List.copyOf(libraries);
    }

    /**
     * @return yasm for elf64 with DWARF debug info, linked by ld against the C library.
     */
    public static ToolchainSettings defaults() {
        return new ToolchainSettings(
                "yasm", List.of("-Worphan-labels", "-g", "dwarf2", "-f", "elf64"),
                "ld", List.of("-dynamic-linker", "/lib64/ld-linux-x86-64.so.2"),
                List.of("-lc"));
    }

    /**
     * Reads the settings from a {@code toolchain} config block.
     * @param config The block with the keys assembler, assembler-args, linker, linker-args, libraries.
     * @return The settings.
     */
    public static ToolchainSettings fromConfig(Config config) {
        return new ToolchainSettings(
                config.getString("assembler"),
                config.getStringList("assembler-args"),
                config.getString("linker"),
                config.getStringList("linker-args"),
                config.getStringList("libraries"));
    }
}
