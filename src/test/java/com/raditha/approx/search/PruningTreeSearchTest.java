package com.raditha.approx.search;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.cache.VariantStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PruningTreeSearchTest {

    private static final List<String> TWO_LINES = List.of(
            "float kernel(float a, float b) {", // 0
            "    float s = 0;",                  // 1
            "    //anotacao:",                   // 2
            "    float x = a * b;",              // 3
            "    s = s;",                        // 4
            "",                                  // 5
            "    //anotacao:",                   // 6
            "    float y = x + a;",              // 7
            "    return y;",                     // 8
            "}");                                // 9

    private static final List<String> THREE_LINES = List.of(
            "float kernel(float a, float b, float c) {",
            "    //anotacao:",
            "    float x = a * b;",
            "    //anotacao:",
            "    float y = x + c;",
            "    //anotacao:",
            "    float z = y - a;",
            "    return z;",
            "}");

    @TempDir
    Path tempDir;

    @Test
    void testCostlyNodePrunesItsSubtree() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        toolchain.errors.put(List.of(3), 0.01);
        toolchain.energies.put(List.of(3), 90.0);
        toolchain.energies.put(List.of(7), 50.0);
        PruningTreeSearch search = new PruningTreeSearch(new CostHeuristic(0.5, 0.3), null, "tree");

        SearchSummary summary = search.search(toolchain.context(VariantCache.inMemory(), 2));

        VariantTree tree = search.getLastTree();
        TreeNode three = tree.node(List.of(3));
        assertEquals(NodeStatus.PRUNED, three.getStatus());
        assertEquals("cost_above_threshold", three.getReason());
        assertEquals(0.455, three.getCost(), 1e-9);
        assertEquals(0.9, three.getEnergyRatio(), 1e-9);

        TreeNode seven = tree.node(List.of(7));
        assertEquals(NodeStatus.COMPLETED, seven.getStatus());
        assertEquals(0.25, seven.getCost(), 1e-9);

        TreeNode both = tree.node(List.of(3, 7));
        assertEquals(NodeStatus.PRUNED, both.getStatus());
        assertEquals("parent_rejected", both.getReason());
        assertNull(both.getIdentityHash());
        verify(toolchain.builder, never()).compile(eq(List.of(toolchain.variantPath(List.of(3, 7)))), anyList());
        verify(toolchain.builder, times(3)).compile(anyList(), anyList());

        assertEquals(3, summary.candidates());
        assertEquals(2, summary.evaluated());
        assertEquals(1, summary.succeeded());
        assertEquals(0, summary.failed());
        assertEquals(2, summary.pruned());
        assertEquals(0, summary.skipped());
        assertEquals(FakeToolchain.BASELINE_ENERGY, summary.baseline().energy());
    }

    @Test
    void testRootIsCompletedBaseline() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        PruningTreeSearch search = new PruningTreeSearch(new CostHeuristic(0.5, 0.3), null, "tree");

        search.search(toolchain.context(VariantCache.inMemory(), 1));

        TreeNode root = search.getLastTree().root();
        assertEquals(NodeStatus.COMPLETED, root.getStatus());
        assertEquals(0.0, root.getError());
        assertEquals(1.0, root.getEnergyRatio());
        assertEquals(0.5, root.getCost(), 1e-12);
        assertEquals(toolchain.sourceFile, root.getVariantPath());
        assertEquals(List.of(), toolchain.compiled.get(0));
    }

    @Test
    void testBuildFailureOnlyRejectsThatSubtree() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        toolchain.buildFailures.add(List.of(7));
        toolchain.errors.put(List.of(3), 0.01);
        toolchain.errors.put(List.of(3, 7), 0.02);
        VariantCache cache = VariantCache.inMemory();
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree");

        SearchSummary summary = search.search(toolchain.context(cache, 2));

        VariantTree tree = search.getLastTree();
        assertEquals(NodeStatus.FAILED, tree.node(List.of(7)).getStatus());
        assertEquals("build_failure", tree.node(List.of(7)).getReason());
        assertEquals(NodeStatus.COMPLETED, tree.node(List.of(3)).getStatus());
        assertEquals(NodeStatus.COMPLETED, tree.node(List.of(3, 7)).getStatus());
        assertEquals(0.02, tree.node(List.of(3, 7)).getError(), 1e-12);
        assertEquals(VariantStatus.FAILED, cache.get(toolchain.hash(List.of(7))).orElseThrow().status());
        assertEquals(1, summary.failed());
        assertEquals(2, summary.succeeded());
        assertEquals(3, summary.evaluated());
    }

    @Test
    void testLevelsAreSeparatedByBarrier() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, THREE_LINES);
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree");

        SearchSummary summary = search.search(toolchain.context(VariantCache.inMemory(), 4));

        List<List<Integer>> order = new ArrayList<>(toolchain.compiled);
        assertEquals(8, order.size());
        assertEquals(List.of(), order.get(0));
        for (int i = 1; i < order.size(); i++) {
            assertTrue(order.get(i - 1).size() <= order.get(i).size(), "level order broken at " + order);
        }
        assertEquals(7, summary.succeeded());
        assertTrue(search.getLastTree().nodes().stream().allMatch(n -> n.getStatus() == NodeStatus.COMPLETED));
    }

    @Test
    void testCheaperDescendantOfPrunedNodeIsNeverEvaluated() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        toolchain.errors.put(List.of(3), 0.2);
        toolchain.errors.put(List.of(3, 7), 0.0);
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree");

        search.search(toolchain.context(VariantCache.inMemory(), 2));

        TreeNode both = search.getLastTree().node(List.of(3, 7));
        assertEquals(NodeStatus.PRUNED, both.getStatus());
        assertNull(both.getCost());
        assertFalse(toolchain.compiled.contains(List.of(3, 7)));
    }

    @Test
    void testIdenticalVariantsReuseOneEvaluation() throws Exception {
        List<String> kernel = new ArrayList<>(TWO_LINES);
        kernel.set(7, "    float y = x / a;");
        FakeToolchain toolchain = new FakeToolchain(tempDir, kernel);
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree");

        SearchSummary summary = search.search(toolchain.context(VariantCache.inMemory(), 2));

        VariantTree tree = search.getLastTree();
        assertEquals(2, toolchain.compiled.size());
        assertTrue(tree.node(List.of(7)).isFromCache());
        assertEquals(tree.root().getIdentityHash(), tree.node(List.of(7)).getIdentityHash());
        assertEquals(tree.node(List.of(3)).getIdentityHash(), tree.node(List.of(3, 7)).getIdentityHash());
        assertEquals(NodeStatus.COMPLETED, tree.node(List.of(3, 7)).getStatus());
        assertEquals(1, summary.evaluated());
        assertEquals(2, summary.skipped());
    }

    @Test
    void testResumeReusesCachedOutcomesAndRedecidesPruning() throws Exception {
        Path cacheFile = tempDir.resolve("executed_variants.jsonl");
        FakeToolchain first = new FakeToolchain(tempDir, TWO_LINES);
        first.errors.put(List.of(3), 0.01);
        first.energies.put(List.of(3), 90.0);
        first.buildFailures.add(List.of(7));
        new PruningTreeSearch(new CostHeuristic(0.5, 0.3), null, "tree")
                .search(first.context(new VariantCache(cacheFile), 2));

        FakeToolchain second = new FakeToolchain(tempDir, TWO_LINES);
        PruningTreeSearch search = new PruningTreeSearch(new CostHeuristic(0.5, 0.5), null, "tree");
        SearchSummary summary = search.search(second.context(new VariantCache(cacheFile), 2));

        VariantTree tree = search.getLastTree();
        assertEquals(List.of(List.of(3, 7)), second.compiled);
        assertEquals(NodeStatus.COMPLETED, tree.node(List.of(3)).getStatus());
        assertTrue(tree.node(List.of(3)).isFromCache());
        assertEquals(NodeStatus.FAILED, tree.node(List.of(7)).getStatus());
        assertEquals("build_failure", tree.node(List.of(7)).getReason());
        assertEquals(NodeStatus.COMPLETED, tree.node(List.of(3, 7)).getStatus());
        assertEquals(1, summary.evaluated());
        assertEquals(2, summary.skipped());
    }

    @Test
    void testCacheOpenedBeforeAnotherRunSeesItsOutcomes() throws Exception {
        Path cacheFile = tempDir.resolve("executed_variants.jsonl");
        VariantCache writer = new VariantCache(cacheFile);
        VariantCache staleReader = new VariantCache(cacheFile);
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);

        new PruningTreeSearch(CostHeuristic.defaults(), null, "tree").search(toolchain.context(writer, 2));
        assertEquals(4, toolchain.compiled.size());
        toolchain.compiled.clear();

        SearchSummary summary = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree")
                .search(toolchain.context(staleReader, 2));

        assertTrue(toolchain.compiled.isEmpty());
        assertEquals(0, summary.evaluated());
        assertEquals(3, summary.skipped());
        assertEquals(3, summary.succeeded());
    }

    @Test
    void testCachedSuccessWithoutMetricsFails() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        VariantCache cache = VariantCache.inMemory();
        cache.tryAdd(toolchain.hash(List.of(3)));
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree");

        search.search(toolchain.context(cache, 1));

        TreeNode three = search.getLastTree().node(List.of(3));
        assertEquals(NodeStatus.FAILED, three.getStatus());
        assertEquals("missing_cached_metrics", three.getReason());
        assertEquals(NodeStatus.PRUNED, search.getLastTree().node(List.of(3, 7)).getStatus());
    }

    @Test
    void testBaselineFailureStopsSearch() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        toolchain.buildFailures.add(List.of());
        VariantCache cache = VariantCache.inMemory();
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), null, "tree");

        BaselineEvaluationException e = assertThrows(BaselineEvaluationException.class,
                () -> search.search(toolchain.context(cache, 1)));

        assertTrue(e.getMessage().contains("build_failure"));
        assertEquals(0, cache.size());
        assertEquals(1, toolchain.compiled.size());
    }

    @Test
    void testReportsWritten() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);
        Path reports = tempDir.resolve("reports");
        PruningTreeSearch search = new PruningTreeSearch(CostHeuristic.defaults(), reports, "pruning_tree");

        SearchSummary summary = search.search(toolchain.context(VariantCache.inMemory(), 1));

        assertEquals(List.of(reports.resolve("pruning_tree.txt"), reports.resolve("pruning_tree.dot")),
                summary.artifacts());
        assertTrue(Files.readString(reports.resolve("pruning_tree.txt")).startsWith("Pruning tree: 4 nodes"));
        assertTrue(Files.readString(reports.resolve("pruning_tree.dot")).contains("\"mod_3\" -> \"mod_3_7\";"));
    }

    @Test
    void testModifiedLinesRecorded() throws Exception {
        FakeToolchain toolchain = new FakeToolchain(tempDir, TWO_LINES);

        new PruningTreeSearch(CostHeuristic.defaults(), null, "tree")
                .search(toolchain.context(VariantCache.inMemory(), 1));

        Path record = tempDir.resolve("modified-lines").resolve("lines_" + toolchain.hash(List.of(3, 7)) + ".txt");
        assertEquals("3\n7\n", Files.readString(record));
    }
}
