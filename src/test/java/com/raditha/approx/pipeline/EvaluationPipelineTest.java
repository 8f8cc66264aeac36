package com.raditha.approx.pipeline;

import com.raditha.approx.generation.Variant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EvaluationPipelineTest {

    private static final String HASH = "0123456789abcdef".repeat(4);

    @TempDir
    Path tempDir;

    private BuildCollaborator builder;
    private ExecuteCollaborator executor;
    private ProfileCollaborator profiler;
    private ErrorCollaborator errorCalculator;
    private PipelineOptions options;
    private Variant variant;
    private Path executable;
    private Path log;
    private Path output;
    private Path energyModel;

    @BeforeEach
    void setUp() throws Exception {
        builder = mock(BuildCollaborator.class);
        executor = mock(ExecuteCollaborator.class);
        profiler = mock(ProfileCollaborator.class);
        errorCalculator = mock(ErrorCollaborator.class);
        energyModel = tempDir.resolve("energy.json");
        options = new PipelineOptions(List.of("-O2"), "input.bin", Duration.ofSeconds(5), energyModel, false);

        variant = new Variant(tempDir.resolve("kernel_" + HASH + ".c"), HASH, List.of(3));
        executable = Files.writeString(tempDir.resolve("kernel_" + HASH), "elf");
        log = Files.writeString(tempDir.resolve("kernel_" + HASH + ".log"), "trace");
        output = Files.writeString(tempDir.resolve("kernel_" + HASH + ".data"), "1 2 3");

        when(builder.compile(anyList(), anyList())).thenReturn(executable);
        when(executor.run(eq(executable), eq("input.bin"), any()))
                .thenReturn(new ExecutionResult(output, log, Duration.ofMillis(12)));
        when(profiler.profile(log, energyModel))
                .thenReturn(new ProfileResult(0.8, 42.0, tempDir.resolve("report.json")));
    }

    @Test
    void testEvaluateRunsEveryStage() throws Exception {
        Path reference = tempDir.resolve("reference.data");
        when(errorCalculator.compareOutputs(reference, output)).thenReturn(0.125);

        Evaluation evaluation = pipeline(null).evaluate(variant, reference);

        assertEquals(0.125, evaluation.error());
        assertEquals(42.0, evaluation.energy());
        assertEquals(0.8, evaluation.latency());
        assertEquals(output, evaluation.measurement().outputPath());
        verify(builder).compile(List.of(variant.path()), List.of("-O2"));
    }

    @Test
    void testTemporariesRemovedOutputKept() throws Exception {
        when(errorCalculator.compareOutputs(any(), any())).thenReturn(0.0);

        pipeline(null).evaluate(variant, tempDir.resolve("reference.data"));

        assertFalse(Files.exists(executable));
        assertFalse(Files.exists(log));
        assertTrue(Files.exists(output));
    }

    @Test
    void testKeepTemporaries() throws Exception {
        options = new PipelineOptions(List.of(), "input.bin", Duration.ofSeconds(5), energyModel, true);

        pipeline(null).measure(variant);

        assertTrue(Files.exists(executable));
        assertTrue(Files.exists(log));
    }

    @Test
    void testBuildFailureStopsPipeline() throws Exception {
        when(builder.compile(anyList(), anyList())).thenThrow(new BuildException("undeclared FMULX"));

        BuildException e = assertThrows(BuildException.class,
                () -> pipeline(null).evaluate(variant, tempDir.resolve("reference.data")));

        assertEquals("build_failure", e.getReason());
        verifyNoInteractions(executor, profiler, errorCalculator);
    }

    @Test
    void testSimulationFailureCleansExecutable() throws Exception {
        when(executor.run(any(), any(), any())).thenThrow(new SimulationException("exit 1"));

        assertThrows(SimulationException.class, () -> pipeline(null).measure(variant));

        assertFalse(Files.exists(executable));
        verify(profiler, never()).profile(any(), any());
    }

    @Test
    void testProfileFailure() throws Exception {
        when(profiler.profile(any(), any())).thenThrow(new ProfileException("no instructions"));

        ProfileException e = assertThrows(ProfileException.class, () -> pipeline(null).measure(variant));

        assertEquals("profiling_failure", e.getReason());
        assertFalse(Files.exists(log));
    }

    @Test
    void testErrorOutOfRangeIsComparisonFailure() throws Exception {
        when(errorCalculator.compareOutputs(any(), any())).thenReturn(1.5);

        ComparisonException e = assertThrows(ComparisonException.class,
                () -> pipeline(null).evaluate(variant, tempDir.resolve("reference.data")));
        assertEquals("error_calculation_failure", e.getReason());
    }

    @Test
    void testListenerSeesProgressAndCannotBreakPipeline() throws Exception {
        when(errorCalculator.compareOutputs(any(), any())).thenReturn(0.0);
        List<String> messages = new ArrayList<>();
        StatusListener listener = (id, message) -> {
            messages.add(id + " " + message);
            throw new IllegalStateException("listener bug");
        };

        Evaluation evaluation = pipeline(listener).evaluate(variant, tempDir.resolve("reference.data"));

        assertEquals(0.0, evaluation.error());
        assertEquals("01234567 building", messages.get(0));
        assertTrue(messages.get(messages.size() - 1).startsWith("01234567 completed"));
    }

    @Test
    void testMeasureDoesNotCompareOutputs() throws Exception {
        Measurement measurement = pipeline(null).measure(variant);

        assertEquals(42.0, measurement.energy());
        assertEquals(Duration.ofMillis(12), measurement.wallTime());
        verifyNoInteractions(errorCalculator);
    }

    @Test
    void testInvalidTimeoutRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PipelineOptions(List.of(), null, Duration.ZERO, energyModel, false));
    }

    private EvaluationPipeline pipeline(StatusListener listener) {
        return new EvaluationPipeline(builder, executor, profiler, errorCalculator, listener, options);
    }
}
