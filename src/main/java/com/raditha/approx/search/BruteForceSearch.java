package com.raditha.approx.search;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.checkpoint.Checkpoint;
import com.raditha.approx.checkpoint.CheckpointManager;
import com.raditha.approx.generation.GenerationResult;
import com.raditha.approx.generation.GenerationStrategy;
import com.raditha.approx.generation.Variant;
import com.raditha.approx.pipeline.Measurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Evaluates every variant the generator produces, with no pruning.
 * <p>
 * Each variant is one task on a fixed pool and results are taken in completion order.
 * Progress is checkpointed every {@code checkpointInterval} completions; a hash enters
 * the checkpoint only after its outcome is in the cache.
 */
public class BruteForceSearch implements SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(BruteForceSearch.class);

    private final GenerationStrategy strategy;
    private final int limit;
    private final CostHeuristic heuristic;
    private final CheckpointManager checkpointManager;
    private final int checkpointInterval;
    private final boolean resume;
    private final BaselineEvaluator baselineEvaluator;

    public BruteForceSearch(GenerationStrategy strategy, int limit, CostHeuristic heuristic,
                            CheckpointManager checkpointManager, int checkpointInterval, boolean resume) {
        this(strategy, limit, heuristic, checkpointManager, checkpointInterval, resume, new BaselineEvaluator());
    }

    BruteForceSearch(GenerationStrategy strategy, int limit, CostHeuristic heuristic,
                     CheckpointManager checkpointManager, int checkpointInterval, boolean resume,
                     BaselineEvaluator baselineEvaluator) {
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be >= 1, got: " + checkpointInterval);
        }
        this.strategy = strategy;
        this.limit = limit;
        this.heuristic = heuristic;
        this.checkpointManager = checkpointManager;
        this.checkpointInterval = checkpointInterval;
        this.resume = resume;
        this.baselineEvaluator = baselineEvaluator;
    }

    @Override
    public SearchMode getMode() {
        return SearchMode.BRUTE_FORCE;
    }

    @Override
    public SearchSummary search(SearchContext context)
            throws BaselineEvaluationException, IOException, InterruptedException {
        VariantCache cache = context.cache();
        Measurement baseline = baselineEvaluator.evaluate(context);

        GenerationResult generation = context.generator().generate(context.source(), context.fileName(),
                context.variantsDir(), strategy, cache, limit);
        List<Variant> found = context.scanner().scan(context.variantsDir(), context.fileName(),
                context.source(), cache);

        Set<String> processed = new LinkedHashSet<>();
        if (resume && checkpointManager != null) {
            Optional<Checkpoint> checkpoint = checkpointManager.load();
            checkpoint.ifPresent(cp -> {
                processed.addAll(cp.processedHashes());
                logger.info("Resuming from checkpoint: {}/{} processed", cp.processedCount(), cp.totalCount());
            });
        }

        List<Variant> pending = new ArrayList<>();
        int skipped = generation.skippedCached();
        for (Variant variant : found) {
            if (processed.contains(variant.identityHash())) {
                skipped++;
            } else {
                pending.add(variant);
            }
        }
        int total = processed.size() + pending.size();
        logger.info("Brute force: {} variants to evaluate with {} workers", pending.size(), context.workers());

        VariantEvaluator evaluator = new VariantEvaluator(context, baseline);
        List<VariantResult> results = new ArrayList<>();
        int succeeded = 0;
        int failed = generation.failed();
        int evaluated = 0;
        int sinceSave = 0;

        ExecutorService pool = WorkerPools.fixed(context.workers(), "brute-force");
        CompletionService<NodeOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<NodeOutcome>, Variant> submitted = new HashMap<>();
        try {
            for (Variant variant : pending) {
                String hash = variant.identityHash();
                if (!cache.tryClaim(hash)) {
                    skipped++;
                    continue;
                }
                Future<NodeOutcome> future = completion.submit(() -> {
                    try {
                        return evaluator.evaluate(variant, variant.modifiedLines());
                    } finally {
                        cache.release(hash);
                    }
                });
                submitted.put(future, variant);
            }

            for (int i = 0; i < submitted.size(); i++) {
                Future<NodeOutcome> future = completion.take();
                Variant variant = submitted.get(future);
                NodeOutcome outcome = resolve(future, variant);
                evaluated++;
                results.add(toResult(outcome, baseline));
                if (outcome.isSuccess()) {
                    succeeded++;
                } else {
                    failed++;
                }
                if (cache.contains(variant.identityHash())) {
                    processed.add(variant.identityHash());
                    sinceSave++;
                }
                if (sinceSave >= checkpointInterval) {
                    saveCheckpoint(processed, total);
                    sinceSave = 0;
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            saveCheckpoint(processed, total);
            throw e;
        } finally {
            WorkerPools.shutdown(pool);
        }
        saveCheckpoint(processed, total);

        logger.info("Brute force finished: {} evaluated, {} succeeded, {} failed, {} skipped",
                evaluated, succeeded, failed, skipped);
        return new SearchSummary(SearchMode.BRUTE_FORCE, generation.candidates(), evaluated, succeeded,
                failed, 0, skipped, baseline, results, List.of());
    }

    private static NodeOutcome resolve(Future<NodeOutcome> future, Variant variant) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.error("[{}] Evaluation task failed: {}", variant.shortHash(), e.getCause().getMessage(), e.getCause());
            return NodeOutcome.failure(variant.modifiedLines(), variant.identityHash(), variant.path(),
                    NodeOutcome.UNEXPECTED_FAILURE, String.valueOf(e.getCause().getMessage()), false);
        }
    }

    private VariantResult toResult(NodeOutcome outcome, Measurement baseline) {
        if (!outcome.isSuccess()) {
            return new VariantResult(outcome.identityHash(), outcome.modifications(), NodeStatus.FAILED,
                    outcome.failureReason(), null, null, null, null, null, outcome.fromCache());
        }
        double error = outcome.metrics().error();
        double ratio = heuristic.energyRatio(outcome.metrics().energy(), baseline.energy());
        return new VariantResult(outcome.identityHash(), outcome.modifications(), NodeStatus.COMPLETED, null,
                error, outcome.metrics().energy(), outcome.metrics().latency(), ratio,
                heuristic.cost(error, ratio), outcome.fromCache());
    }

    private void saveCheckpoint(Set<String> processed, int total) throws IOException {
        if (checkpointManager == null) {
            return;
        }
        checkpointManager.save(processed.size(), total, processed);
    }
}
