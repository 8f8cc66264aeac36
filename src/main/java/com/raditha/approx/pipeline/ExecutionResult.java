package com.raditha.approx.pipeline;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param outputPath program output, kept after evaluation
 * @param logPath    simulator instruction log, deleted after profiling
 * @param wallTime   how long the simulation took
 */
public record ExecutionResult(Path outputPath, Path logPath, Duration wallTime) {
}
