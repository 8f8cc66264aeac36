package com.raditha.approx.search;

import com.raditha.approx.cache.CacheEntry;
import com.raditha.approx.cache.VariantMetrics;
import com.raditha.approx.cache.VariantStatus;
import com.raditha.approx.generation.Variant;
import com.raditha.approx.hashing.CanonicalHasher;
import com.raditha.approx.pipeline.Measurement;
import com.raditha.approx.pipeline.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Provides the reference output and energy of the unmodified kernel.
 * <p>
 * A baseline recorded by an earlier run is reused while its output file still exists.
 * Otherwise the kernel is measured and the result cached with error 0.
 */
public class BaselineEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(BaselineEvaluator.class);

    public Measurement evaluate(SearchContext context) throws BaselineEvaluationException {
        String hash = CanonicalHasher.identityHash(context.source().lines(), context.source().physicalToLogical());
        String id = CanonicalHasher.shortHash(hash);

        Optional<Measurement> cached = fromCache(context.cache().get(hash));
        if (cached.isPresent()) {
            logger.info("[{}] Reusing cached baseline (energy={})", id, cached.get().energy());
            return cached.get();
        }

        logger.info("[{}] Evaluating baseline {} (content {})", id, context.sourceFile(),
                CanonicalHasher.shortHash(CanonicalHasher.contentHash(context.source().lines())));
        Measurement measurement;
        try {
            measurement = context.pipeline().measure(new Variant(context.sourceFile(), hash, List.of()));
        } catch (PipelineException e) {
            throw new BaselineEvaluationException(
                    "Baseline evaluation failed (" + e.getReason() + "): " + e.getMessage(), e);
        }
        if (!(measurement.energy() > 0)) {
            throw new BaselineEvaluationException("Baseline energy must be positive, got " + measurement.energy());
        }

        context.cache().recordOutcome(hash, VariantStatus.SUCCESS, null, new VariantMetrics(
                0.0, measurement.energy(), measurement.latency(), measurement.outputPath().toString()));
        logger.info("[{}] Baseline energy={} latency={} ms", id, measurement.energy(), measurement.latency());
        return measurement;
    }

    private static Optional<Measurement> fromCache(Optional<CacheEntry> entry) {
        if (entry.isEmpty() || !entry.get().isSuccess() || entry.get().metrics() == null) {
            return Optional.empty();
        }
        VariantMetrics metrics = entry.get().metrics();
        if (metrics.outputPath() == null || !(metrics.energy() > 0)) {
            return Optional.empty();
        }
        Path output = Path.of(metrics.outputPath());
        if (!Files.isRegularFile(output)) {
            logger.info("Cached baseline output {} is gone, measuring again", output);
            return Optional.empty();
        }
        return Optional.of(new Measurement(output, metrics.energy(), metrics.latency(), null, Duration.ZERO));
    }
}
