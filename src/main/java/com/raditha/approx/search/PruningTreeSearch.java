package com.raditha.approx.search;

import com.raditha.approx.cache.CacheEntry;
import com.raditha.approx.generation.GenerationException;
import com.raditha.approx.generation.Variant;
import com.raditha.approx.hashing.CanonicalHasher;
import com.raditha.approx.pipeline.Measurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Breadth-first search over the subset tree with cost-based pruning.
 * <p>
 * Levels are separated by a barrier: every node of level {@code k} is decided before
 * any node of level {@code k + 1} is submitted, and only children of accepted nodes are
 * submitted at all. Workers return {@link NodeOutcome} values; node state and pruning
 * are updated on the calling thread only.
 * <p>
 * A node whose hash already has an outcome in the cache is not evaluated again. Its
 * stored metrics are put through the cost rule of this run.
 */
public class PruningTreeSearch implements SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(PruningTreeSearch.class);

    private final CostHeuristic heuristic;
    private final Path reportDir;
    private final String reportBaseName;
    private final BaselineEvaluator baselineEvaluator;
    private VariantTree lastTree;

    /**
     * @param heuristic      cost rule
     * @param reportDir      where the text and DOT reports go; null to skip them
     * @param reportBaseName file name of the reports without extension
     */
    public PruningTreeSearch(CostHeuristic heuristic, Path reportDir, String reportBaseName) {
        this(heuristic, reportDir, reportBaseName, new BaselineEvaluator());
    }

    PruningTreeSearch(CostHeuristic heuristic, Path reportDir, String reportBaseName,
                      BaselineEvaluator baselineEvaluator) {
        this.heuristic = heuristic;
        this.reportDir = reportDir;
        this.reportBaseName = reportBaseName;
        this.baselineEvaluator = baselineEvaluator;
    }

    @Override
    public SearchMode getMode() {
        return SearchMode.PRUNING_TREE;
    }

    /**
     * The tree of the most recent run, or null before the first.
     */
    public VariantTree getLastTree() {
        return lastTree;
    }

    @Override
    public SearchSummary search(SearchContext context)
            throws BaselineEvaluationException, IOException, InterruptedException {
        VariantTree tree = VariantTree.build(context.source().modifiableLines());
        lastTree = tree;
        logger.info("Pruning tree: {} modifiable lines, {} nodes, alpha={}, threshold={}",
                tree.getModifiableLines().size(), tree.size(), heuristic.alpha(), heuristic.threshold());

        Measurement baseline = baselineEvaluator.evaluate(context);
        TreeNode root = tree.root();
        root.setIdentityHash(CanonicalHasher.identityHash(context.source().lines(),
                context.source().physicalToLogical()));
        root.setVariantPath(context.sourceFile());
        root.setMeasurements(0.0, baseline.energy(), baseline.latency(), 1.0, heuristic.cost(0.0, 1.0));
        root.setStatus(NodeStatus.COMPLETED);

        VariantEvaluator evaluator = new VariantEvaluator(context, baseline);
        Map<String, CompletableFuture<NodeOutcome>> byHash = new ConcurrentHashMap<>();
        ExecutorService pool = WorkerPools.fixed(context.workers(), "tree-worker");
        try {
            List<TreeNode> frontier = tree.children(root.getModifications());
            int level = 1;
            while (!frontier.isEmpty()) {
                logger.info("Level {}: evaluating {} nodes", level, frontier.size());
                List<Callable<NodeOutcome>> tasks = new ArrayList<>();
                for (TreeNode node : frontier) {
                    node.setStatus(NodeStatus.SIMULATING);
                    List<Integer> key = node.getModifications();
                    tasks.add(() -> evaluateNode(context, evaluator, byHash, key));
                }
                List<Future<NodeOutcome>> futures = pool.invokeAll(tasks);

                List<TreeNode> next = new ArrayList<>();
                for (int i = 0; i < frontier.size(); i++) {
                    TreeNode node = frontier.get(i);
                    apply(tree, node, resolve(futures.get(i), node), baseline, next);
                }
                frontier = next;
                level++;
            }
        } finally {
            WorkerPools.shutdown(pool);
        }

        List<Path> artifacts = exportReports(tree);
        return summarize(tree, baseline, artifacts);
    }

    private static NodeOutcome evaluateNode(SearchContext context, VariantEvaluator evaluator,
                                            Map<String, CompletableFuture<NodeOutcome>> byHash,
                                            List<Integer> key) {
        Variant variant;
        try {
            variant = context.generator().generateSpecific(context.source(), context.fileName(), key,
                    context.variantsDir());
        } catch (GenerationException e) {
            logger.error("Could not materialise lines {}: {}", key, e.getMessage());
            return NodeOutcome.failure(key, null, null, NodeOutcome.GENERATION_FAILURE, e.getMessage(), false);
        }

        Optional<CacheEntry> cached = context.cache().get(variant.identityHash());
        if (cached.isPresent()) {
            return VariantEvaluator.fromCache(cached.get(), variant, key);
        }

        CompletableFuture<NodeOutcome> mine = new CompletableFuture<>();
        CompletableFuture<NodeOutcome> existing = byHash.putIfAbsent(variant.identityHash(), mine);
        if (existing != null) {
            logger.debug("[{}] Lines {} give an already evaluated variant", variant.shortHash(), key);
            return existing.join().forNode(key);
        }
        try {
            NodeOutcome outcome = evaluator.evaluate(variant, key);
            mine.complete(outcome);
            return outcome;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        }
    }

    private static NodeOutcome resolve(Future<NodeOutcome> future, TreeNode node) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            logger.error("Node {} failed unexpectedly: {}", node.getName(), cause.getMessage(), cause);
            return NodeOutcome.failure(node.getModifications(), null, null, NodeOutcome.UNEXPECTED_FAILURE,
                    String.valueOf(cause.getMessage()), false);
        }
    }

    private void apply(VariantTree tree, TreeNode node, NodeOutcome outcome, Measurement baseline,
                       List<TreeNode> next) {
        node.setIdentityHash(outcome.identityHash());
        node.setVariantPath(outcome.variantPath());
        node.setFromCache(outcome.fromCache());
        String id = CanonicalHasher.shortHash(outcome.identityHash());

        if (!outcome.isSuccess()) {
            node.setStatus(NodeStatus.FAILED);
            node.setReason(outcome.failureReason());
            int pruned = tree.pruneDescendants(node.getModifications(), NodeOutcome.PARENT_REJECTED);
            logger.warn("[{}] {} FAILED ({}), pruned {} descendants", id, node.getName(),
                    outcome.failureReason(), pruned);
            return;
        }

        double error = outcome.metrics().error();
        double ratio = heuristic.energyRatio(outcome.metrics().energy(), baseline.energy());
        double cost = heuristic.cost(error, ratio);
        node.setMeasurements(error, outcome.metrics().energy(), outcome.metrics().latency(), ratio, cost);

        if (heuristic.shouldPrune(cost)) {
            node.setStatus(NodeStatus.PRUNED);
            node.setReason(NodeOutcome.COST_ABOVE_THRESHOLD);
            int pruned = tree.pruneDescendants(node.getModifications(), NodeOutcome.PARENT_REJECTED);
            logger.info("[{}] {} PRUNED (cost={} > {}), pruned {} descendants", id, node.getName(),
                    cost, heuristic.threshold(), pruned);
        } else {
            node.setStatus(NodeStatus.COMPLETED);
            next.addAll(tree.children(node.getModifications()));
            logger.info("[{}] {} COMPLETED (cost={})", id, node.getName(), cost);
        }
    }

    private List<Path> exportReports(VariantTree tree) throws IOException {
        if (reportDir == null) {
            return List.of();
        }
        TreeReportExporter exporter = new TreeReportExporter();
        Path text = exporter.exportText(tree, reportDir.resolve(reportBaseName + ".txt"));
        Path dot = exporter.exportDot(tree, reportDir.resolve(reportBaseName + ".dot"));
        logger.info("Tree reports written to {} and {}", text, dot);
        return List.of(text, dot);
    }

    private static SearchSummary summarize(VariantTree tree, Measurement baseline, List<Path> artifacts) {
        List<VariantResult> results = new ArrayList<>();
        int evaluated = 0;
        int skipped = 0;
        int succeeded = 0;
        int failed = 0;
        int pruned = 0;
        for (TreeNode node : tree.nodes()) {
            if (node.isRoot()) {
                continue;
            }
            results.add(VariantResult.of(node));
            boolean measured = node.getIdentityHash() != null;
            if (measured && node.isFromCache()) {
                skipped++;
            } else if (measured) {
                evaluated++;
            }
            switch (node.getStatus()) {
                case COMPLETED -> succeeded++;
                case FAILED -> failed++;
                case PRUNED -> pruned++;
                default -> logger.warn("Node {} ended in state {}", node.getName(), node.getStatus());
            }
        }
        logger.info("Pruning tree finished: {} evaluated, {} completed, {} failed, {} pruned, {} from cache",
                evaluated, succeeded, failed, pruned, skipped);
        return new SearchSummary(SearchMode.PRUNING_TREE, tree.size() - 1, evaluated, succeeded, failed,
                pruned, skipped, baseline, results, artifacts);
    }
}
