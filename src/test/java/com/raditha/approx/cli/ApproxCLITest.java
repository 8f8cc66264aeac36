package com.raditha.approx.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.approx.generation.GenerationStrategy;
import com.raditha.approx.search.SearchMode;
import com.raditha.approx.workflow.StubPipelineFactory;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ApproxCLI option parsing and the reports it prints.
 */
class ApproxCLITest {

    private static final List<String> KERNEL = List.of(
            "float kernel(float a, float b) {",
            "    //anotacao:",
            "    float x = a * b;",
            "    //anotacao:",
            "    float y = x + a;",
            "    return y - b;",
            "}");

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private PrintStream originalOut;
    private Path configFile;
    private Path storageRoot;

    @BeforeEach
    void setUp() throws IOException {
        outContent = new ByteArrayOutputStream();
        originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));

        Files.write(tempDir.resolve("kernel.c"), KERNEL, StandardCharsets.UTF_8);
        storageRoot = tempDir.resolve("storage");
        configFile = tempDir.resolve("explorer.yml");
        Files.writeString(configFile, String.join("\n",
                "explorer:",
                "  workers: 2",
                "  storage_root: '" + storageRoot + "'",
                "applications:",
                "  demo:",
                "    source_file: kernel.c",
                "    operators:",
                "      '*': FMULX",
                "      '+': FADDX",
                "    energy_model: energy.json",
                ""), StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private int execute(StubPipelineFactory factory, String... args) {
        return ApproxCLI.createCommandLine(new ApproxCLI(factory)).execute(args);
    }

    private String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    private Path onlyWorkspace() throws IOException {
        try (Stream<Path> dirs = Files.list(storageRoot)) {
            List<Path> all = dirs.toList();
            assertEquals(1, all.size());
            return all.get(0);
        }
    }

    @Test
    void testPruningTreeTextReport() {
        int exitCode = execute(new StubPipelineFactory(), "--config-file", configFile.toString(), "--app", "demo");

        assertEquals(0, exitCode);
        String out = output();
        assertTrue(out.contains("APPROXIMATE VARIANT EXPLORATION REPORT"));
        assertTrue(out.contains("Application: demo"));
        assertTrue(out.contains("Mode: pruning-tree"));
        assertTrue(out.contains("Succeeded: 3"));
        assertTrue(out.contains("Best variants:"));
        assertFalse(out.contains("Failed variants:"));
    }

    @Test
    void testJsonOutputIsParseable() throws IOException {
        int exitCode = execute(new StubPipelineFactory(), "--config-file", configFile.toString(), "--app", "demo",
                "--mode", "brute-force", "--json");

        assertEquals(0, exitCode);
        JsonNode json = new ObjectMapper().readTree(output());
        assertEquals("demo", json.get("application").asText());
        assertEquals("brute-force", json.get("mode").asText());
        assertEquals(3, json.get("succeeded").asInt());
        assertEquals(3, json.get("variants").size());
    }

    @Test
    void testGenerateOnlyPrintsGenerationReport() throws IOException {
        StubPipelineFactory factory = new StubPipelineFactory();

        int exitCode = execute(factory, "--config-file", configFile.toString(), "--app", "demo",
                "--generate-only", "--strategy", "one-hot");

        assertEquals(0, exitCode);
        assertEquals(0, factory.createdCount());
        String out = output();
        assertTrue(out.contains("VARIANT GENERATION REPORT"));
        assertTrue(out.contains("Generated: 2"));
        try (Stream<Path> files = Files.list(onlyWorkspace().resolve("variants"))) {
            assertEquals(2, files.count());
        }
    }

    @Test
    void testExportWritesRunReports() throws IOException {
        int exitCode = execute(new StubPipelineFactory(), "--config-file", configFile.toString(), "--app", "demo",
                "--export", "both");

        assertEquals(0, exitCode);
        try (Stream<Path> files = Files.list(onlyWorkspace().resolve("outputs"))) {
            List<String> reports = files.map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith("run_report_"))
                    .sorted()
                    .toList();
            assertEquals(2, reports.size());
            assertTrue(reports.get(0).endsWith(".csv"));
            assertTrue(reports.get(1).endsWith(".json"));
        }
    }

    @Test
    void testStorageRootOverride() throws IOException {
        Path other = tempDir.resolve("elsewhere");

        int exitCode = execute(new StubPipelineFactory(), "--config-file", configFile.toString(), "--app", "demo",
                "--generate-only", "--storage-root", other.toString());

        assertEquals(0, exitCode);
        assertFalse(Files.exists(storageRoot));
        try (Stream<Path> dirs = Files.list(other)) {
            assertTrue(dirs.allMatch(d -> d.getFileName().toString().startsWith("demo_pruning-tree_")));
        }
    }

    @Test
    void testBruteForceWithFailuresExitsWithOne() {
        int exitCode = execute(new StubPipelineFactory("FMULX"), "--config-file", configFile.toString(),
                "--app", "demo", "--mode", "brute-force");

        assertEquals(1, exitCode);
        String out = output();
        assertTrue(out.contains("Failed: 2"));
        assertTrue(out.contains("reason=build_failure"));
    }

    @Test
    void testPruningTreeWithFailuresExitsWithZero() {
        int exitCode = execute(new StubPipelineFactory("FMULX"), "--config-file", configFile.toString(),
                "--app", "demo");

        assertEquals(0, exitCode);
        assertTrue(output().contains("Failed variants:"));
    }

    @Test
    void testHelpOption() {
        int exitCode = execute(new StubPipelineFactory(), "--help");

        assertEquals(0, exitCode);
        assertTrue(output().contains("--app"));
    }

    @Test
    void testParsesAllOptions() {
        ApproxCLI cli = new ApproxCLI(new StubPipelineFactory());
        CommandLine commandLine = new CommandLine(cli);

        assertDoesNotThrow(() -> commandLine.parseArgs("--app", "fft", "--mode", "brute-force",
                "--strategy", "one-hot", "--limit", "10", "--workers", "4", "--threshold", "0.1",
                "--alpha", "0.5", "--timeout", "30", "--no-resume", "--export", "csv", "--json"));
    }

    /**
     * Property: every combination of valid option values parses.
     */
    @Property(tries = 100)
    void validArgumentsParse(
            @ForAll @IntRange(min = 0, max = 64) int workers,
            @ForAll @IntRange(min = 0, max = 10000) int limit,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double alpha,
            @ForAll @DoubleRange(min = 0.0, max = 10.0) double threshold,
            @ForAll("modes") SearchMode mode,
            @ForAll("strategies") GenerationStrategy strategy) {

        List<String> args = new ArrayList<>();
        args.add("--app");
        args.add("fft");
        args.add("--workers");
        args.add(String.valueOf(workers));
        args.add("--limit");
        args.add(String.valueOf(limit));
        args.add("--alpha");
        args.add(String.valueOf(alpha));
        args.add("--threshold");
        args.add(String.valueOf(threshold));
        args.add("--mode");
        args.add(mode.toCliString());
        args.add("--strategy");
        args.add(strategy.toCliString());

        CommandLine commandLine = new CommandLine(new ApproxCLI(new StubPipelineFactory()));
        try {
            commandLine.parseArgs(args.toArray(new String[0]));
        } catch (Exception e) {
            fail("Valid CLI arguments should parse: " + e.getMessage() + " for args: " + String.join(" ", args));
        }
    }

    @Provide
    Arbitrary<SearchMode> modes() {
        return Arbitraries.of(SearchMode.values());
    }

    @Provide
    Arbitrary<GenerationStrategy> strategies() {
        return Arbitraries.of(GenerationStrategy.values());
    }
}
