package com.raditha.approx.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Set;

/**
 * Progress of a brute-force run.
 *
 * @param totalCount      number of candidates the run set out to evaluate
 * @param processedCount  number of candidates whose outcome has been recorded
 * @param processedHashes identity hashes whose outcome has been recorded
 * @param savedAt         when the checkpoint was written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(int totalCount, int processedCount, Set<String> processedHashes, Instant savedAt) {

    public Checkpoint {
        processedHashes = processedHashes == null ? Set.of() : Set.copyOf(processedHashes);
    }

    public boolean isProcessed(String hash) {
        return processedHashes.contains(hash);
    }
}
