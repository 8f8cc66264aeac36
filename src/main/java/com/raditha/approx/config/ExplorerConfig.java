package com.raditha.approx.config;

import com.raditha.approx.generation.GenerationStrategy;
import com.raditha.approx.parser.AnnotationParser;
import com.raditha.approx.search.CostHeuristic;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Run parameters shared by every application.
 *
 * @param workers            worker threads, 0 for one less than the number of CPUs
 * @param strategy           subset enumeration for brute force
 * @param variantLimit       cap on newly generated variants, 0 for none
 * @param threshold          pruning threshold on the cost
 * @param alpha              weight of the error term in the cost (0.0-1.0)
 * @param checkpointInterval completions between checkpoint saves
 * @param timeoutSeconds     limit for each compiler or simulator invocation
 * @param storageRoot        directory that holds the execution workspaces
 * @param annotationMarker   text that marks the next line as modifiable
 * @param toolchain          compiler and simulator
 */
public record ExplorerConfig(
        int workers,
        GenerationStrategy strategy,
        int variantLimit,
        double threshold,
        double alpha,
        int checkpointInterval,
        int timeoutSeconds,
        Path storageRoot,
        String annotationMarker,
        ToolchainConfig toolchain) {

    public static final int DEFAULT_CHECKPOINT_INTERVAL = 5;
    public static final int DEFAULT_TIMEOUT_SECONDS = 600;
    public static final Path DEFAULT_STORAGE_ROOT = Path.of("storage", "executions");

    /**
     * Validate configuration.
     */
    public ExplorerConfig {
        if (workers < 0) {
            throw new IllegalArgumentException("workers must be >= 0");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (variantLimit < 0) {
            throw new IllegalArgumentException("variant limit must be >= 0");
        }
        if (Double.isNaN(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be between 0.0 and 1.0");
        }
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpoint interval must be >= 1");
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeout must be >= 1 second");
        }
        if (storageRoot == null) {
            storageRoot = DEFAULT_STORAGE_ROOT;
        }
        if (annotationMarker == null || annotationMarker.isBlank()) {
            annotationMarker = AnnotationParser.DEFAULT_MARKER;
        }
        if (toolchain == null) {
            toolchain = ToolchainConfig.riscv();
        }
    }

    public static ExplorerConfig defaults() {
        return new ExplorerConfig(
                0,
                GenerationStrategy.ALL,
                0,
                CostHeuristic.DEFAULT_THRESHOLD,
                CostHeuristic.DEFAULT_ALPHA,
                DEFAULT_CHECKPOINT_INTERVAL,
                DEFAULT_TIMEOUT_SECONDS,
                DEFAULT_STORAGE_ROOT,
                AnnotationParser.DEFAULT_MARKER,
                ToolchainConfig.riscv());
    }

    /**
     * Worker count with 0 resolved to one less than the available processors, at least 1.
     */
    public int effectiveWorkers() {
        if (workers > 0) {
            return workers;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public CostHeuristic heuristic() {
        return new CostHeuristic(alpha, threshold);
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
