package com.raditha.approx.config;

import com.raditha.approx.transform.OperatorTransformer;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One kernel and the files needed to build and run it.
 *
 * @param name              application name used on the command line
 * @param sourceFile        the annotated kernel
 * @param operators         operator to approximate call, e.g. {@code * -> FMULX}
 * @param additionalSources other translation units linked with every variant
 * @param includeDirs       include directories
 * @param optimizationLevel compiler optimisation flag, e.g. {@code -O}
 * @param inputData         argument handed to the program
 * @param outputSuffix      suffix of the program output file
 * @param exePrefix         prefix of executable names
 * @param approxHeader      header declaring the approximate calls; may be null
 * @param energyModel       energy model for the profiler; may be null
 */
public record ApplicationConfig(
        String name,
        Path sourceFile,
        Map<String, String> operators,
        List<Path> additionalSources,
        List<Path> includeDirs,
        String optimizationLevel,
        String inputData,
        String outputSuffix,
        String exePrefix,
        Path approxHeader,
        Path energyModel) {

    public ApplicationConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("application name cannot be blank");
        }
        if (sourceFile == null) {
            throw new IllegalArgumentException("source_file is required for application " + name);
        }
        if (operators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("operators are required for application " + name);
        }
        for (String operator : operators.keySet()) {
            if (!OperatorTransformer.SUPPORTED_OPERATORS.contains(operator)) {
                throw new IllegalArgumentException("Unsupported operator '" + operator + "' for application "
                        + name + ". Must be one of " + OperatorTransformer.SUPPORTED_OPERATORS);
            }
        }
        operators = Map.copyOf(operators);
        additionalSources = additionalSources == null ? List.of() : List.copyOf(additionalSources);
        includeDirs = includeDirs == null ? List.of() : List.copyOf(includeDirs);
        if (outputSuffix == null) {
            outputSuffix = ".data";
        }
        if (exePrefix == null) {
            exePrefix = "";
        }
    }

    /**
     * Compiler flags for this application.
     */
    public List<String> buildFlags() {
        return optimizationLevel == null || optimizationLevel.isBlank() ? List.of() : List.of(optimizationLevel);
    }
}
