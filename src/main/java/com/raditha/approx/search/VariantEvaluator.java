package com.raditha.approx.search;

import com.raditha.approx.cache.CacheEntry;
import com.raditha.approx.cache.VariantMetrics;
import com.raditha.approx.cache.VariantStatus;
import com.raditha.approx.generation.Variant;
import com.raditha.approx.pipeline.Evaluation;
import com.raditha.approx.pipeline.Measurement;
import com.raditha.approx.pipeline.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs one variant through the pipeline and records the outcome in the cache. Never
 * throws: every failure becomes a failed {@link NodeOutcome}.
 * <p>
 * Failures that are not a stage of the pipeline, and anything interrupted, are not
 * recorded, so a later run evaluates the variant again.
 */
class VariantEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(VariantEvaluator.class);

    private final SearchContext context;
    private final Measurement baseline;

    VariantEvaluator(SearchContext context, Measurement baseline) {
        this.context = context;
        this.baseline = baseline;
    }

    NodeOutcome evaluate(Variant variant, List<Integer> key) {
        String hash = variant.identityHash();
        String id = variant.shortHash();
        try {
            Evaluation evaluation = context.pipeline().evaluate(variant, baseline.outputPath());
            VariantMetrics metrics = new VariantMetrics(evaluation.error(), evaluation.energy(),
                    evaluation.latency(), evaluation.measurement().outputPath().toString());
            context.cache().recordOutcome(hash, VariantStatus.SUCCESS, null, metrics);
            recordModifiedLines(variant);
            logger.info("[{}] Evaluated lines {}: error={} energy={}", id, variant.modifiedLines(),
                    evaluation.error(), evaluation.energy());
            return NodeOutcome.success(key, hash, variant.path(), metrics, false);
        } catch (PipelineException e) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("[{}] Interrupted: {}", id, e.getMessage());
                return NodeOutcome.failure(key, hash, variant.path(), NodeOutcome.UNEXPECTED_FAILURE,
                        "interrupted", false);
            }
            logger.warn("[{}] {}: {}", id, e.getReason(), e.getMessage());
            context.cache().recordOutcome(hash, VariantStatus.FAILED, e.getReason(), null);
            recordModifiedLines(variant);
            return NodeOutcome.failure(key, hash, variant.path(), e.getReason(), e.getMessage(), false);
        } catch (RuntimeException e) {
            logger.error("[{}] Unexpected failure: {}", id, e.getMessage(), e);
            return NodeOutcome.failure(key, hash, variant.path(), NodeOutcome.UNEXPECTED_FAILURE,
                    String.valueOf(e.getMessage()), false);
        }
    }

    /**
     * Rebuild an outcome from an earlier run's cache entry.
     */
    static NodeOutcome fromCache(CacheEntry entry, Variant variant, List<Integer> key) {
        if (!entry.isSuccess()) {
            String reason = entry.reason() == null ? NodeOutcome.UNEXPECTED_FAILURE : entry.reason();
            return NodeOutcome.failure(key, variant.identityHash(), variant.path(), reason,
                    "recorded by an earlier run", true);
        }
        if (entry.metrics() == null) {
            return NodeOutcome.failure(key, variant.identityHash(), variant.path(),
                    NodeOutcome.MISSING_CACHED_METRICS, "cached entry has no measurements", true);
        }
        return NodeOutcome.success(key, variant.identityHash(), variant.path(), entry.metrics(), true);
    }

    private void recordModifiedLines(Variant variant) {
        if (context.recorder() == null) {
            return;
        }
        try {
            context.recorder().record(variant, context.source(), context.fileName());
        } catch (IOException e) {
            logger.warn("[{}] Could not record modified lines: {}", variant.shortHash(), e.getMessage());
        }
    }
}
