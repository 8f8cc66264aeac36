package com.raditha.approx.generation;

import com.raditha.approx.parser.ParsedSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps, for each evaluated variant, the list of physical lines it rewrote
 * ({@code lines_<hash>.txt}, one index per line) and a unified diff against the
 * original ({@code lines_<hash>.diff}).
 */
public class ModifiedLinesRecorder {

    private final Path directory;

    public ModifiedLinesRecorder(Path directory) {
        this.directory = directory;
    }

    public Path record(Variant variant, ParsedSource original, String fileName) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve("lines_" + variant.identityHash() + ".txt");
        String body = variant.modifiedLines().stream()
                .map(String::valueOf)
                .collect(Collectors.joining("\n"));
        Files.writeString(target, body.isEmpty() ? "" : body + "\n", StandardCharsets.UTF_8);

        if (Files.exists(variant.path())) {
            List<String> variantLines = Files.readAllLines(variant.path(), StandardCharsets.UTF_8);
            String diff = VariantDiff.unifiedDiff(fileName, original.lines(), variantLines, 1);
            Files.writeString(directory.resolve("lines_" + variant.identityHash() + ".diff"), diff,
                    StandardCharsets.UTF_8);
        }
        return target;
    }

    /**
     * Read back a record written by {@link #record}.
     */
    public List<Integer> read(String hash) throws IOException {
        Path file = directory.resolve("lines_" + hash + ".txt");
        return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .toList();
    }

    public Path getDirectory() {
        return directory;
    }
}
