package com.raditha.approx.cache;

/**
 * Measurements kept with a successful cache entry so later runs can reuse them.
 *
 * @param error      output error against the baseline, 0..1
 * @param energy     energy estimate from the profiler
 * @param latency    latency in milliseconds
 * @param outputPath where the simulated output was written, may be null
 */
public record VariantMetrics(double error, double energy, double latency, String outputPath) {
}
