package com.raditha.approx.search;

import com.raditha.approx.cache.VariantMetrics;

import java.nio.file.Path;
import java.util.List;

/**
 * What one unit of work produced for one set of modified lines. Exactly one of
 * {@code metrics} and {@code failureReason} is set.
 *
 * @param modifications the node key
 * @param identityHash  hash of the variant, null if it could not be materialised
 * @param variantPath   variant file, null if it could not be materialised
 * @param metrics       measurements on success
 * @param failureReason machine-readable reason on failure
 * @param message       human-readable detail on failure
 * @param fromCache     true if taken from an earlier run rather than evaluated now
 */
public record NodeOutcome(
        List<Integer> modifications,
        String identityHash,
        Path variantPath,
        VariantMetrics metrics,
        String failureReason,
        String message,
        boolean fromCache) {

    public static final String GENERATION_FAILURE = "generation_failure";
    public static final String UNEXPECTED_FAILURE = "unexpected_failure";
    public static final String MISSING_CACHED_METRICS = "missing_cached_metrics";
    public static final String COST_ABOVE_THRESHOLD = "cost_above_threshold";
    public static final String PARENT_REJECTED = "parent_rejected";

    public NodeOutcome {
        modifications = modifications == null ? List.of() : List.copyOf(modifications);
    }

    public static NodeOutcome success(List<Integer> modifications, String identityHash, Path variantPath,
                                      VariantMetrics metrics, boolean fromCache) {
        return new NodeOutcome(modifications, identityHash, variantPath, metrics, null, null, fromCache);
    }

    public static NodeOutcome failure(List<Integer> modifications, String identityHash, Path variantPath,
                                      String reason, String message, boolean fromCache) {
        return new NodeOutcome(modifications, identityHash, variantPath, null, reason, message, fromCache);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    /**
     * The same outcome attributed to another node with an identical variant.
     */
    public NodeOutcome forNode(List<Integer> key) {
        return new NodeOutcome(key, identityHash, variantPath, metrics, failureReason, message, true);
    }
}
