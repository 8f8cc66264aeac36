package com.raditha.approx.workflow;

import com.raditha.approx.config.ApplicationConfig;
import com.raditha.approx.config.ExplorerConfig;
import com.raditha.approx.pipeline.BuildCollaborator;
import com.raditha.approx.pipeline.BuildException;
import com.raditha.approx.pipeline.ErrorCollaborator;
import com.raditha.approx.pipeline.EvaluationPipeline;
import com.raditha.approx.pipeline.ExecuteCollaborator;
import com.raditha.approx.pipeline.ExecutionResult;
import com.raditha.approx.pipeline.PipelineOptions;
import com.raditha.approx.pipeline.ProfileCollaborator;
import com.raditha.approx.pipeline.ProfileResult;
import com.raditha.approx.workspace.ExecutionWorkspace;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Pipeline whose stages are Mockito stubs writing into the run's workspace. Every
 * program measures energy 10 and matches the reference output exactly.
 */
public class StubPipelineFactory implements PipelineFactory {

    public static final double ENERGY = 10.0;

    private final String failOnText;
    private final AtomicInteger created = new AtomicInteger();

    /**
     * @param failOnText compilation fails for any source containing this text; null never fails
     */
    public StubPipelineFactory(String failOnText) {
        this.failOnText = failOnText;
    }

    public StubPipelineFactory() {
        this(null);
    }

    public int createdCount() {
        return created.get();
    }

    @Override
    public EvaluationPipeline create(ExplorerConfig config, ApplicationConfig application,
                                     ExecutionWorkspace workspace) {
        created.incrementAndGet();
        BuildCollaborator builder = mock(BuildCollaborator.class);
        ExecuteCollaborator executor = mock(ExecuteCollaborator.class);
        ProfileCollaborator profiler = mock(ProfileCollaborator.class);
        ErrorCollaborator errorCalculator = mock(ErrorCollaborator.class);
        try {
            when(builder.compile(anyList(), anyList()))
                    .thenAnswer(inv -> compile(inv.getArgument(0), workspace));
            when(executor.run(any(), any(), any()))
                    .thenAnswer(inv -> run(inv.getArgument(0), workspace));
            when(profiler.profile(any(), any())).thenReturn(new ProfileResult(2.5, ENERGY, null));
            when(errorCalculator.compareOutputs(any(), any())).thenReturn(0.0);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
        return new EvaluationPipeline(builder, executor, profiler, errorCalculator, null,
                new PipelineOptions(application.buildFlags(), application.inputData(), config.timeout(),
                        application.energyModel(), false));
    }

    private Path compile(List<Path> files, ExecutionWorkspace workspace) throws IOException, BuildException {
        String content = Files.readString(files.get(0), StandardCharsets.UTF_8);
        if (failOnText != null && content.contains(failOnText)) {
            throw new BuildException(failOnText + " undeclared");
        }
        Path executable = workspace.getExecutablesDir().resolve(files.get(0).getFileName() + ".exe");
        Files.writeString(executable, content, StandardCharsets.UTF_8);
        return executable;
    }

    private static ExecutionResult run(Path executable, ExecutionWorkspace workspace) throws IOException {
        String name = executable.getFileName().toString();
        Path output = workspace.getOutputsDir().resolve(name + ".data");
        Path log = workspace.getLogsDir().resolve(name + ".log");
        Files.writeString(output, "1.0 2.0 3.0\n", StandardCharsets.UTF_8);
        Files.writeString(log, "fadd.s\n", StandardCharsets.UTF_8);
        return new ExecutionResult(output, log, Duration.ofMillis(3));
    }
}
