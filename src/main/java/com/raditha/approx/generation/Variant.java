package com.raditha.approx.generation;

import com.raditha.approx.hashing.CanonicalHasher;

import java.nio.file.Path;
import java.util.List;

/**
 * A materialised rewrite of the kernel source.
 *
 * @param path          the variant file on disk
 * @param identityHash  canonical hash of the variant's logical lines
 * @param modifiedLines sorted physical indices that were rewritten; empty for the baseline
 */
public record Variant(Path path, String identityHash, List<Integer> modifiedLines) {

    public Variant {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (identityHash == null || identityHash.isBlank()) {
            throw new IllegalArgumentException("identityHash cannot be blank");
        }
        modifiedLines = modifiedLines == null ? List.of() : List.copyOf(modifiedLines);
    }

    public String shortHash() {
        return CanonicalHasher.shortHash(identityHash);
    }

    public boolean isBaseline() {
        return modifiedLines.isEmpty();
    }
}
