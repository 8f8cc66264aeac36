package com.raditha.approx.generation;

import java.util.List;

/**
 * Outcome of one generator pass.
 *
 * @param variants         newly written variants, in enumeration order
 * @param candidates       subsets visited before deduplication
 * @param skippedCached    subsets whose hash was already in the cache
 * @param skippedDuplicate subsets identical to the baseline or to an earlier subset of this pass
 * @param alreadyPresent   subsets whose variant file already existed in the output directory
 * @param failed           subsets that could not be written
 * @param limitReached     true when enumeration stopped at the configured cap
 */
public record GenerationResult(
        List<Variant> variants,
        int candidates,
        int skippedCached,
        int skippedDuplicate,
        int alreadyPresent,
        int failed,
        boolean limitReached) {

    public GenerationResult {
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public int generated() {
        return variants.size();
    }

    public int skipped() {
        return skippedCached + skippedDuplicate + alreadyPresent;
    }
}
