package com.raditha.approx.pipeline;

import java.nio.file.Path;
import java.time.Duration;

/**
 * What build, simulation and profiling produced for one variant.
 *
 * @param outputPath program output kept for comparison
 * @param energy     energy estimate
 * @param latency    latency estimate in milliseconds
 * @param reportPath energy report
 * @param wallTime   simulation wall-clock time
 */
public record Measurement(Path outputPath, double energy, double latency, Path reportPath, Duration wallTime) {
}
