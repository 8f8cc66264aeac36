package com.raditha.approx.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Saves and restores brute-force progress.
 * <p>
 * The checkpoint is written to a temporary file beside the target and renamed over it,
 * so a crash mid-save leaves the previous checkpoint intact. Callers only pass hashes
 * whose outcome is already in the variant cache, so a checkpoint never claims more than
 * was actually processed.
 */
public class CheckpointManager {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointManager.class);

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path file;

    public CheckpointManager(Path file) {
        this.file = file;
    }

    public synchronized void save(int processedCount, int totalCount, Collection<String> processedHashes)
            throws IOException {
        Checkpoint checkpoint = new Checkpoint(totalCount, processedCount,
                new TreeSet<>(processedHashes), Instant.now());
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);

        Path temp = Files.createTempFile(parent, "." + file.getFileName(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), checkpoint);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Checkpoint saved: {}/{} processed", processedCount, totalCount);
    }

    /**
     * @return the last saved checkpoint, or empty if there is none or it cannot be read
     */
    public Optional<Checkpoint> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Checkpoint checkpoint = mapper.readValue(file.toFile(), Checkpoint.class);
            if (checkpoint == null) {
                logger.warn("Ignoring empty checkpoint {}", file);
                return Optional.empty();
            }
            logger.info("Resuming from checkpoint: {}/{} processed",
                    checkpoint.processedCount(), checkpoint.totalCount());
            return Optional.of(checkpoint);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring corrupt checkpoint {}: {}", file, e.getOriginalMessage());
        } catch (IOException e) {
            logger.warn("Cannot read checkpoint {}: {}", file, e.getMessage());
        }
        return Optional.empty();
    }

    public Path getFile() {
        return file;
    }
}
