package com.raditha.approx.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Per-application inputs of the evaluation pipeline.
 *
 * @param buildFlags       extra compiler flags, e.g. the optimisation level
 * @param inputData        argument handed to the simulated program
 * @param timeout          limit for each external invocation
 * @param energyModel      energy model used by the profiler
 * @param keepTemporaries  keep executables and instruction logs after evaluation
 */
public record PipelineOptions(
        List<String> buildFlags,
        String inputData,
        Duration timeout,
        Path energyModel,
        boolean keepTemporaries) {

    public PipelineOptions {
        buildFlags = buildFlags == null ? List.of() : List.copyOf(buildFlags);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
