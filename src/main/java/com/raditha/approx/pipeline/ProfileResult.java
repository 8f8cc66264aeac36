package com.raditha.approx.pipeline;

import java.nio.file.Path;

/**
 * @param latency    estimated latency in milliseconds
 * @param energy     estimated energy, in the energy model's units
 * @param reportPath the energy report written by the profiler
 */
public record ProfileResult(double latency, double energy, Path reportPath) {
}
