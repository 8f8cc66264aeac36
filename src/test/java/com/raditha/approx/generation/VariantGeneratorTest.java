package com.raditha.approx.generation;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.hashing.CanonicalHasher;
import com.raditha.approx.parser.AnnotationParser;
import com.raditha.approx.parser.ParsedSource;
import com.raditha.approx.transform.OperatorTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class VariantGeneratorTest {

    private static final List<String> KERNEL = List.of(
            "float kernel(float a, float b, float c) {", // 0
            "    //anotacao:",                            // 1
            "    float x = a * b;",                       // 2
            "    //anotacao:",                            // 3
            "    float y = x + c;",                       // 4
            "    //anotacao:",                            // 5
            "    float z = y - a;",                       // 6
            "    return z;",                              // 7
            "}");                                         // 8

    @TempDir
    Path tempDir;

    private VariantGenerator generator;
    private ParsedSource source;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        generator = new VariantGenerator(new OperatorTransformer(Map.of("*", "FMULX", "+", "FADDX", "-", "FSUBX")));
        source = new AnnotationParser().parse(KERNEL);
        outputDir = tempDir.resolve("variants");
    }

    @Test
    void testGeneratesEverySubsetWithDistinctHashes() throws IOException {
        GenerationResult result = generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 0);

        assertEquals(7, result.generated());
        assertEquals(7, result.candidates());
        assertFalse(result.limitReached());
        Set<String> hashes = new HashSet<>();
        for (Variant variant : result.variants()) {
            assertTrue(hashes.add(variant.identityHash()));
            assertTrue(Files.exists(variant.path()));
            assertEquals(VariantGenerator.variantFileName("kernel.c", variant.identityHash()),
                    variant.path().getFileName().toString());
        }
        assertEquals(List.of(2), result.variants().get(0).modifiedLines());
        assertEquals(List.of(2, 4, 6), result.variants().get(6).modifiedLines());
    }

    @Test
    void testVariantContentRewritesOnlySelectedLines() throws IOException, GenerationException {
        Variant variant = generator.generateSpecific(source, "kernel.c", List.of(4), outputDir);

        List<String> lines = Files.readAllLines(variant.path(), StandardCharsets.UTF_8);
        assertEquals(KERNEL.size(), lines.size());
        assertEquals("    float x = a * b;", lines.get(2));
        assertEquals("    float y = FADDX(x, c);", lines.get(4));
        assertEquals("    float z = y - a;", lines.get(6));
    }

    @Test
    void testFileNameHashMatchesContent() throws IOException {
        GenerationResult result = generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 0);

        for (Variant variant : result.variants()) {
            List<String> lines = Files.readAllLines(variant.path(), StandardCharsets.UTF_8);
            assertEquals(variant.identityHash(), CanonicalHasher.identityHash(lines, source.physicalToLogical()));
        }
    }

    @Test
    void testSecondRunIsIdempotent() throws IOException {
        generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 0);

        GenerationResult second = generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 0);

        assertEquals(0, second.generated());
        assertEquals(7, second.alreadyPresent());
        assertEquals(7, listVariants().size());
    }

    @Test
    void testCachedHashesAreNotWritten() throws IOException, GenerationException {
        VariantCache cache = VariantCache.inMemory();
        String cached = generator.generateSpecific(source, "kernel.c", List.of(2), tempDir.resolve("other"))
                .identityHash();
        cache.tryAdd(cached);

        GenerationResult result = generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, cache, 0);

        assertEquals(6, result.generated());
        assertEquals(1, result.skippedCached());
        assertTrue(result.variants().stream().noneMatch(v -> v.identityHash().equals(cached)));
    }

    @Test
    void testLimitCapsNewFiles() throws IOException {
        GenerationResult result = generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 2);

        assertEquals(2, result.generated());
        assertTrue(result.limitReached());
        assertEquals(2, listVariants().size());
    }

    @Test
    void testNegativeLimitRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, -1));
    }

    @Test
    void testOneHot() throws IOException {
        GenerationResult result = generator.generate(source, "kernel.c", outputDir,
                GenerationStrategy.ONE_HOT, null, 0);

        assertEquals(3, result.generated());
        assertEquals(List.of(List.of(2), List.of(4), List.of(6)),
                result.variants().stream().map(Variant::modifiedLines).toList());
    }

    @Test
    void testNoOpRewriteIsDeduplicatedAgainstBaseline() throws IOException {
        ParsedSource division = new AnnotationParser().parse(List.of(
                "float f(float a, float b) {",
                "    //anotacao:",
                "    float x = a * b;",
                "    //anotacao:",
                "    float q = a / b;",
                "    return x + q;",
                "}"));

        GenerationResult result = generator.generate(division, "f.c", outputDir, GenerationStrategy.ALL, null, 0);

        assertEquals(3, result.candidates());
        assertEquals(1, result.generated());
        assertEquals(2, result.skippedDuplicate());
    }

    @Test
    void testGenerateSpecificReusesExistingFile() throws IOException, GenerationException {
        GenerationResult result = generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 0);
        Variant expected = result.variants().get(3);
        long modified = Files.getLastModifiedTime(expected.path()).toMillis();

        Variant variant = generator.generateSpecific(source, "kernel.c", List.of(4, 2), outputDir);

        assertEquals(expected.identityHash(), variant.identityHash());
        assertEquals(List.of(2, 4), variant.modifiedLines());
        assertEquals(modified, Files.getLastModifiedTime(variant.path()).toMillis());
    }

    @Test
    void testGenerateSpecificRejectsUnannotatedLine() {
        assertThrows(IllegalArgumentException.class,
                () -> generator.generateSpecific(source, "kernel.c", List.of(7), outputDir));
    }

    @Test
    void testConcurrentGeneratorsNeverLeavePartialFiles() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<GenerationResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                tasks.add(() -> generator.generate(source, "kernel.c", outputDir, GenerationStrategy.ALL, null, 0));
            }
            int total = 0;
            for (Future<GenerationResult> future : pool.invokeAll(tasks)) {
                total += future.get().generated();
            }
            assertTrue(total >= 7);
        } finally {
            pool.shutdownNow();
        }

        List<Path> files = listVariants();
        assertEquals(7, files.size());
        for (Path file : files) {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            String hash = CanonicalHasher.identityHash(lines, source.physicalToLogical());
            assertEquals(VariantGenerator.variantFileName("kernel.c", hash), file.getFileName().toString());
        }
        try (Stream<Path> all = Files.list(outputDir)) {
            assertTrue(all.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void testFileNameHelpers() {
        assertEquals("kernel", VariantGenerator.baseName("kernel.c"));
        assertEquals(".c", VariantGenerator.extension("kernel.c"));
        assertEquals("Makefile", VariantGenerator.baseName("Makefile"));
        assertEquals("", VariantGenerator.extension("Makefile"));
        assertEquals("fft_abc.cpp", VariantGenerator.variantFileName("fft.cpp", "abc"));
    }

    private List<Path> listVariants() throws IOException {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("kernel_")).sorted().toList();
        }
    }
}
