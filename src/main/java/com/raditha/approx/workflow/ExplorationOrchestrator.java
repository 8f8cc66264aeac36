package com.raditha.approx.workflow;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.checkpoint.CheckpointManager;
import com.raditha.approx.config.ApplicationConfig;
import com.raditha.approx.config.ExplorerConfig;
import com.raditha.approx.generation.GenerationResult;
import com.raditha.approx.generation.ModifiedLinesRecorder;
import com.raditha.approx.generation.VariantGenerator;
import com.raditha.approx.generation.VariantScanner;
import com.raditha.approx.metrics.RunMetricsExporter;
import com.raditha.approx.metrics.RunMetricsExporter.RunMetrics;
import com.raditha.approx.parser.AnnotationParser;
import com.raditha.approx.parser.ParsedSource;
import com.raditha.approx.pipeline.EvaluationPipeline;
import com.raditha.approx.search.BaselineEvaluationException;
import com.raditha.approx.search.BruteForceSearch;
import com.raditha.approx.search.PruningTreeSearch;
import com.raditha.approx.search.SearchContext;
import com.raditha.approx.search.SearchEngine;
import com.raditha.approx.search.SearchMode;
import com.raditha.approx.search.SearchSummary;
import com.raditha.approx.transform.OperatorTransformer;
import com.raditha.approx.workspace.ExecutionWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one exploration: parses the kernel, prepares the workspace and the cache, then
 * hands everything to the selected search engine and writes the run report.
 * <p>
 * The cache is created here and passed by reference to the generator and the engine,
 * so one run uses exactly one cache instance.
 */
public class ExplorationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ExplorationOrchestrator.class);

    /**
     * What to run.
     *
     * @param application  kernel to explore
     * @param mode         search engine
     * @param workspace    existing workspace to reuse; null creates a new one
     * @param cacheFile    cache outside the workspace; null uses the workspace cache
     * @param resume       resume brute force from its checkpoint
     * @param generateOnly only write variant files, evaluate nothing
     * @param export       report formats; null writes none
     */
    public record RunRequest(
            ApplicationConfig application,
            SearchMode mode,
            Path workspace,
            Path cacheFile,
            boolean resume,
            boolean generateOnly,
            ExportFormat export) {
    }

    /**
     * What a run produced. {@code summary} and {@code metrics} are null for generate-only
     * runs, {@code generation} is null otherwise.
     */
    public record RunOutcome(
            ExecutionWorkspace workspace,
            GenerationResult generation,
            SearchSummary summary,
            RunMetrics metrics,
            List<Path> reports) {
    }

    private final ExplorerConfig config;
    private final PipelineFactory pipelineFactory;
    private final RunMetricsExporter exporter = new RunMetricsExporter();

    public ExplorationOrchestrator(ExplorerConfig config, PipelineFactory pipelineFactory) {
        this.config = config;
        this.pipelineFactory = pipelineFactory;
    }

    public RunOutcome run(RunRequest request) throws IOException, BaselineEvaluationException, InterruptedException {
        ApplicationConfig app = request.application();
        LocalDateTime start = LocalDateTime.now();

        ParsedSource source = new AnnotationParser(config.annotationMarker()).parse(app.sourceFile());
        logger.info("{}: {} modifiable lines in {}", app.name(), source.modifiableCount(), app.sourceFile());

        ExecutionWorkspace workspace = request.workspace() != null
                ? ExecutionWorkspace.open(request.workspace())
                : ExecutionWorkspace.create(config.storageRoot(), app.name(), request.mode().toCliString(), start);
        if (app.approxHeader() != null) {
            if (Files.isRegularFile(app.approxHeader())) {
                workspace.installHeader(app.approxHeader());
            } else {
                logger.warn("Approximation header {} not found", app.approxHeader());
            }
        }

        VariantCache cache = new VariantCache(request.cacheFile() != null
                ? request.cacheFile() : workspace.getCacheFile());
        VariantGenerator generator = new VariantGenerator(new OperatorTransformer(app.operators()));
        String fileName = app.sourceFile().getFileName().toString();

        if (request.generateOnly()) {
            GenerationResult generation = generator.generate(source, fileName, workspace.getVariantsDir(),
                    config.strategy(), cache, config.variantLimit());
            return new RunOutcome(workspace, generation, null, null, List.of());
        }

        EvaluationPipeline pipeline = pipelineFactory.create(config, app, workspace);
        SearchContext context = new SearchContext(source, app.sourceFile(), workspace.getVariantsDir(),
                generator, new VariantScanner(), cache, pipeline,
                new ModifiedLinesRecorder(workspace.getModifiedLinesDir()), config.effectiveWorkers());

        SearchEngine engine = createEngine(request, workspace, start);
        SearchSummary summary = engine.search(context);

        LocalDateTime end = LocalDateTime.now();
        RunMetrics metrics = exporter.buildMetrics(app.name(), summary, context.workers(), workspace.getRoot(),
                start, end);
        List<Path> reports = exportReports(metrics, request.export(), workspace, start);
        return new RunOutcome(workspace, null, summary, metrics, reports);
    }

    SearchEngine createEngine(RunRequest request, ExecutionWorkspace workspace, LocalDateTime start) {
        String timestamp = start.format(ExecutionWorkspace.TIMESTAMP_FORMAT);
        return switch (request.mode()) {
            case PRUNING_TREE -> new PruningTreeSearch(config.heuristic(), workspace.getLogsDir(),
                    "pruning_tree_" + request.application().name() + "_" + timestamp);
            case BRUTE_FORCE -> new BruteForceSearch(config.strategy(), config.variantLimit(), config.heuristic(),
                    new CheckpointManager(workspace.getCheckpointFile()), config.checkpointInterval(),
                    request.resume());
        };
    }

    private List<Path> exportReports(RunMetrics metrics, ExportFormat format, ExecutionWorkspace workspace,
                                     LocalDateTime start) throws IOException {
        if (format == null) {
            return List.of();
        }
        String base = "run_report_" + start.format(ExecutionWorkspace.TIMESTAMP_FORMAT);
        List<Path> written = new ArrayList<>();
        if (format.includesJson()) {
            Path json = workspace.getOutputsDir().resolve(base + ".json");
            exporter.exportToJson(metrics, json);
            written.add(json);
        }
        if (format.includesCsv()) {
            Path csv = workspace.getOutputsDir().resolve(base + ".csv");
            exporter.exportToCsv(metrics, csv);
            written.add(csv);
        }
        written.forEach(p -> logger.info("Run report written to {}", p));
        return written;
    }
}
