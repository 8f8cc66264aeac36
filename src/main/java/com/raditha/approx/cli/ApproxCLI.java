package com.raditha.approx.cli;

import com.raditha.approx.config.ApplicationConfig;
import com.raditha.approx.config.ExplorerConfig;
import com.raditha.approx.config.ExplorerSettings;
import com.raditha.approx.config.SettingsLoader;
import com.raditha.approx.generation.GenerationResult;
import com.raditha.approx.generation.GenerationStrategy;
import com.raditha.approx.hashing.CanonicalHasher;
import com.raditha.approx.metrics.RunMetricsExporter;
import com.raditha.approx.search.BaselineEvaluationException;
import com.raditha.approx.search.NodeStatus;
import com.raditha.approx.search.SearchMode;
import com.raditha.approx.search.SearchSummary;
import com.raditha.approx.search.VariantResult;
import com.raditha.approx.workflow.CommandPipelineFactory;
import com.raditha.approx.workflow.ExplorationOrchestrator;
import com.raditha.approx.workflow.ExplorationOrchestrator.RunOutcome;
import com.raditha.approx.workflow.ExplorationOrchestrator.RunRequest;
import com.raditha.approx.workflow.ExportFormat;
import com.raditha.approx.workflow.PipelineFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the approximate variant explorer.
 * <p>
 * Usage:
 * java -jar approx-explorer.jar --app fft [options]
 * <p>
 * Configuration priority: CLI arguments > explorer.yml > defaults
 */
@Command(name = "approx", mixinStandardHelpOptions = true, version = "approx-explorer v1.0.0",
        description = "Explores approximate-operator variants of a numeric kernel")
@SuppressWarnings("java:S106")
public class ApproxCLI implements Callable<Integer> {

    private static final int BEST_VARIANTS_SHOWN = 10;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--app", required = true, description = "Application to explore", paramLabel = "<name>")
    private String application;

    @Option(names = "--mode", description = "Search mode: brute-force or pruning-tree (default: pruning-tree)",
            paramLabel = "<mode>", converter = SearchModeConverter.class)
    private SearchMode mode = SearchMode.PRUNING_TREE;

    @Option(names = "--strategy", description = "Variant generation: all or one-hot", paramLabel = "<strategy>",
            converter = StrategyConverter.class)
    private GenerationStrategy strategy;

    @Option(names = "--limit", description = "Maximum number of new variants, 0 for no cap", paramLabel = "<n>")
    private Integer limit;

    @Option(names = "--workers", description = "Worker threads, 0 for CPUs - 1", paramLabel = "<n>")
    private Integer workers;

    @Option(names = "--threshold", description = "Pruning threshold on the cost (default: 0.05)",
            paramLabel = "<x>")
    private Double threshold;

    @Option(names = "--alpha", description = "Weight of the error in the cost, 0.0-1.0 (default: 1.0)",
            paramLabel = "<x>")
    private Double alpha;

    @Option(names = "--timeout", description = "Timeout in seconds for each compiler or simulator run",
            paramLabel = "<seconds>")
    private Integer timeout;

    @Option(names = "--storage-root", description = "Directory holding execution workspaces", paramLabel = "<path>")
    private String storageRoot;

    @Option(names = "--workspace", description = "Reuse an existing execution workspace", paramLabel = "<path>")
    private String workspace;

    @Option(names = "--cache-file", description = "Use this cache file instead of the workspace cache",
            paramLabel = "<path>")
    private String cacheFile;

    @Option(names = "--resume", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Resume brute force from its checkpoint (default: true)")
    private boolean resume;

    @Option(names = "--generate-only", description = "Only write variant files")
    private boolean generateOnly = false;

    @Option(names = "--export", description = "Export run report (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    private final PipelineFactory pipelineFactory;

    public ApproxCLI() {
        this(new CommandPipelineFactory());
    }

    ApproxCLI(PipelineFactory pipelineFactory) {
        this.pipelineFactory = pipelineFactory;
    }

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Path configPath = configFile != null ? Path.of(configFile) : null;
        Map<String, Object> settings = SettingsLoader.load(configPath);
        Path baseDir = configPath != null && configPath.toAbsolutePath().getParent() != null
                ? configPath.toAbsolutePath().getParent()
                : Path.of("").toAbsolutePath();

        ExplorerConfig config = ExplorerSettings.loadConfig(settings, new ExplorerSettings.Overrides(
                workers, strategy, limit, threshold, alpha, timeout,
                storageRoot != null ? Path.of(storageRoot) : null));
        ApplicationConfig app = ExplorerSettings.loadApplication(settings, application, baseDir);

        ExportFormat export = exportFormat != null ? ExportFormat.fromString(exportFormat) : null;
        RunRequest request = new RunRequest(app, mode,
                workspace != null ? Path.of(workspace) : null,
                cacheFile != null ? Path.of(cacheFile) : null,
                resume, generateOnly, export);

        RunOutcome outcome = new ExplorationOrchestrator(config, pipelineFactory).run(request);

        if (outcome.generation() != null) {
            printGenerationReport(outcome);
            return 0;
        }
        if (jsonOutput) {
            System.out.println(new RunMetricsExporter().toJson(outcome.metrics()));
        } else {
            printTextReport(app, config, outcome);
        }
        if (mode == SearchMode.BRUTE_FORCE && outcome.summary().failed() > 0) {
            return 1;
        }
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine(new ApproxCLI()).execute(args));
    }

    /**
     * Command line with the exit-code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine(ApproxCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else if (ex instanceof BaselineEvaluationException) {
                commandLine.getErr().println("Baseline failed: " + ex.getMessage());
                return 5;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold != null && (threshold.isNaN() || threshold < 0)) {
            throw new IllegalArgumentException("Threshold must be >= 0, got: " + threshold);
        }
        if (alpha != null && (alpha.isNaN() || alpha < 0 || alpha > 1)) {
            throw new IllegalArgumentException("Alpha must be between 0.0 and 1.0, got: " + alpha);
        }
        if (workers != null && workers < 0) {
            throw new IllegalArgumentException("Workers must be >= 0, got: " + workers);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must be >= 0, got: " + limit);
        }
        if (timeout != null && timeout < 1) {
            throw new IllegalArgumentException("Timeout must be at least 1 second, got: " + timeout);
        }
        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }
        if (configFile != null && !Files.exists(Path.of(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (workspace != null && !Files.isDirectory(Path.of(workspace))) {
            throw new IllegalArgumentException("Workspace not found: " + workspace);
        }
    }

    private static void printGenerationReport(RunOutcome outcome) {
        GenerationResult generation = outcome.generation();
        System.out.println("=".repeat(80));
        System.out.println("VARIANT GENERATION REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Workspace: %s%n", outcome.workspace().getRoot());
        System.out.printf("Candidates: %d%n", generation.candidates());
        System.out.printf("Generated: %d%n", generation.generated());
        System.out.printf("Skipped (cached): %d%n", generation.skippedCached());
        System.out.printf("Skipped (duplicate): %d%n", generation.skippedDuplicate());
        System.out.printf("Already present: %d%n", generation.alreadyPresent());
        System.out.printf("Failed: %d%n", generation.failed());
        if (generation.limitReached()) {
            System.out.println("Variant limit reached, enumeration stopped early");
        }
    }

    private static void printTextReport(ApplicationConfig app, ExplorerConfig config, RunOutcome outcome) {
        SearchSummary summary = outcome.summary();
        System.out.println("=".repeat(80));
        System.out.println("APPROXIMATE VARIANT EXPLORATION REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Application: %s%n", app.name());
        System.out.printf("Mode: %s%n", summary.mode().toCliString());
        System.out.printf("Workspace: %s%n", outcome.workspace().getRoot());
        System.out.printf(Locale.ROOT, "Cost: alpha=%.2f threshold=%.4f%n", config.alpha(), config.threshold());
        if (summary.baseline() != null) {
            System.out.printf(Locale.ROOT, "Baseline: energy=%.6f latency=%.3f ms%n",
                    summary.baseline().energy(), summary.baseline().latency());
        }
        System.out.println();
        System.out.printf("Candidates: %d%n", summary.candidates());
        System.out.printf("Evaluated: %d%n", summary.evaluated());
        System.out.printf("Succeeded: %d%n", summary.succeeded());
        System.out.printf("Failed: %d%n", summary.failed());
        System.out.printf("Pruned: %d%n", summary.pruned());
        System.out.printf("Skipped: %d%n", summary.skipped());
        System.out.println();

        List<VariantResult> best = summary.results().stream()
                .filter(r -> r.status() == NodeStatus.COMPLETED && r.cost() != null)
                .sorted(Comparator.comparingDouble(VariantResult::cost))
                .limit(BEST_VARIANTS_SHOWN)
                .toList();
        if (!best.isEmpty()) {
            System.out.println("Best variants:");
            for (VariantResult result : best) {
                System.out.printf(Locale.ROOT, "  %s lines=%s error=%.4f energy=%.6f cost=%.4f%n",
                        CanonicalHasher.shortHash(result.identityHash()), result.modifiedLines(),
                        result.error(), result.energy(), result.cost());
            }
            System.out.println();
        }

        List<VariantResult> failures = summary.results().stream()
                .filter(r -> r.status() == NodeStatus.FAILED)
                .toList();
        if (!failures.isEmpty()) {
            System.out.println("Failed variants:");
            failures.forEach(r -> System.out.printf("  %s lines=%s reason=%s%n",
                    CanonicalHasher.shortHash(r.identityHash()), r.modifiedLines(), r.reason()));
            System.out.println();
        }

        if (!summary.artifacts().isEmpty() || !outcome.reports().isEmpty()) {
            System.out.println("Artifacts:");
            summary.artifacts().forEach(p -> System.out.println("  " + p));
            outcome.reports().forEach(p -> System.out.println("  " + p));
        }
    }

    /**
     * Custom converter for SearchMode enum to handle CLI string values.
     */
    public static class SearchModeConverter implements ITypeConverter<SearchMode> {
        @Override
        public SearchMode convert(String value) throws Exception {
            return SearchMode.fromString(value);
        }
    }

    /**
     * Custom converter for GenerationStrategy enum to handle CLI string values.
     */
    public static class StrategyConverter implements ITypeConverter<GenerationStrategy> {
        @Override
        public GenerationStrategy convert(String value) throws Exception {
            return GenerationStrategy.fromString(value);
        }
    }
}
