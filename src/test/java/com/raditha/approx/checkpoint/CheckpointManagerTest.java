package com.raditha.approx.checkpoint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void testSaveAndLoad() throws IOException {
        CheckpointManager manager = new CheckpointManager(tempDir.resolve("state").resolve("checkpoint.json"));

        manager.save(2, 10, List.of("h2", "h1"));
        Checkpoint checkpoint = manager.load().orElseThrow();

        assertEquals(10, checkpoint.totalCount());
        assertEquals(2, checkpoint.processedCount());
        assertEquals(Set.of("h1", "h2"), checkpoint.processedHashes());
        assertTrue(checkpoint.isProcessed("h1"));
        assertFalse(checkpoint.isProcessed("h3"));
        assertNotNull(checkpoint.savedAt());
    }

    @Test
    void testSaveReplacesPreviousCheckpoint() throws IOException {
        Path file = tempDir.resolve("checkpoint.json");
        CheckpointManager manager = new CheckpointManager(file);

        manager.save(1, 3, List.of("h1"));
        manager.save(3, 3, List.of("h1", "h2", "h3"));

        assertEquals(3, manager.load().orElseThrow().processedHashes().size());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void testMissingCheckpoint() {
        assertTrue(new CheckpointManager(tempDir.resolve("none.json")).load().isEmpty());
    }

    @Test
    void testCorruptCheckpointIsIgnored() throws IOException {
        Path file = tempDir.resolve("checkpoint.json");
        Files.writeString(file, "{\"total_count\": ");

        assertTrue(new CheckpointManager(file).load().isEmpty());
    }

    @Test
    void testEmptyCheckpointIsIgnored() throws IOException {
        Path file = tempDir.resolve("checkpoint.json");
        Files.writeString(file, "null");

        assertTrue(new CheckpointManager(file).load().isEmpty());
    }
}
