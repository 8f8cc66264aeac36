package com.raditha.approx.pipeline;

import com.raditha.approx.generation.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Runs one variant through build, simulation, profiling and output comparison.
 * <p>
 * Each stage reports its own {@link PipelineException} subtype, so callers know which
 * stage failed. The executable and the instruction log are deleted afterwards whatever
 * the outcome; program output and the energy report are kept.
 */
public class EvaluationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationPipeline.class);

    private final BuildCollaborator builder;
    private final ExecuteCollaborator executor;
    private final ProfileCollaborator profiler;
    private final ErrorCollaborator errorCalculator;
    private final StatusListener listener;
    private final PipelineOptions options;

    public EvaluationPipeline(BuildCollaborator builder, ExecuteCollaborator executor,
                              ProfileCollaborator profiler, ErrorCollaborator errorCalculator,
                              StatusListener listener, PipelineOptions options) {
        this.builder = builder;
        this.executor = executor;
        this.profiler = profiler;
        this.errorCalculator = errorCalculator;
        this.listener = listener == null ? StatusListener.NONE : listener;
        this.options = options;
    }

    /**
     * Build, simulate and profile without comparing outputs. Used for the baseline.
     */
    public Measurement measure(Variant variant) throws PipelineException {
        String id = variant.shortHash();
        Path executable = null;
        Path log = null;
        try {
            notify(id, "building");
            executable = builder.compile(List.of(variant.path()), options.buildFlags());

            notify(id, "simulating");
            ExecutionResult execution = executor.run(executable, options.inputData(), options.timeout());
            log = execution.logPath();

            notify(id, "profiling");
            ProfileResult profile = profiler.profile(execution.logPath(), options.energyModel());
            return new Measurement(execution.outputPath(), profile.energy(), profile.latency(),
                    profile.reportPath(), execution.wallTime());
        } catch (PipelineException e) {
            notify(id, "failed: " + e.getReason());
            throw e;
        } finally {
            if (!options.keepTemporaries()) {
                cleanup(executable);
                cleanup(log);
            }
        }
    }

    /**
     * Measure the variant and compare its output with {@code referenceOutput}.
     */
    public Evaluation evaluate(Variant variant, Path referenceOutput) throws PipelineException {
        Measurement measurement = measure(variant);
        String id = variant.shortHash();
        try {
            notify(id, "comparing outputs");
            double error = errorCalculator.compareOutputs(referenceOutput, measurement.outputPath());
            if (Double.isNaN(error) || error < 0 || error > 1) {
                throw new ComparisonException("Error value out of range: " + error);
            }
            notify(id, String.format(Locale.ROOT, "completed (error=%.4f, energy=%.4f)", error, measurement.energy()));
            return new Evaluation(measurement, error);
        } catch (ComparisonException e) {
            notify(id, "failed: " + e.getReason());
            throw e;
        }
    }

    private void notify(String id, String message) {
        try {
            listener.onStatus(id, message);
        } catch (RuntimeException e) {
            logger.warn("Status listener failed for {}: {}", id, e.getMessage());
        }
    }

    private static void cleanup(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
