package com.raditha.approx.config;

import java.util.List;

/**
 * External tools used to build and run variants.
 *
 * @param compiler         cross-compiler executable
 * @param compilerFlags    flags passed on every compilation
 * @param libraries        linker arguments appended after the sources
 * @param simulatorCommand simulator command template, see {@code CommandExecuteCollaborator}
 */
public record ToolchainConfig(
        String compiler,
        List<String> compilerFlags,
        List<String> libraries,
        List<String> simulatorCommand) {

    public ToolchainConfig {
        if (compiler == null || compiler.isBlank()) {
            throw new IllegalArgumentException("compiler cannot be blank");
        }
        compilerFlags = compilerFlags == null ? List.of() : List.copyOf(compilerFlags);
        libraries = libraries == null ? List.of() : List.copyOf(libraries);
        if (simulatorCommand == null || simulatorCommand.isEmpty()) {
            throw new IllegalArgumentException("simulator command cannot be empty");
        }
        simulatorCommand = List.copyOf(simulatorCommand);
    }

    /**
     * RISC-V cross-compiler and the Spike simulator.
     */
    public static ToolchainConfig riscv() {
        return new ToolchainConfig(
                "riscv32-unknown-elf-g++",
                List.of("-march=rv32imafdc"),
                List.of("-lm"),
                List.of("spike", "--isa=RV32IMAFDC", "-l", "--log={log}", "pk",
                        "{executable}", "{input}", "{output}"));
    }
}
