package com.raditha.approx.search;

import com.raditha.approx.pipeline.Measurement;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of one search run.
 *
 * @param mode       which engine ran
 * @param candidates variants considered
 * @param evaluated  variants sent through the pipeline during this run
 * @param succeeded  accepted variants
 * @param failed     variants with a failed stage
 * @param pruned     tree nodes rejected by cost or below a rejected node
 * @param skipped    variants not evaluated because an earlier run already had them
 * @param baseline   measurement of the unmodified kernel
 * @param results    per-variant rows
 * @param artifacts  report files written by the engine
 */
public record SearchSummary(
        SearchMode mode,
        int candidates,
        int evaluated,
        int succeeded,
        int failed,
        int pruned,
        int skipped,
        Measurement baseline,
        List<VariantResult> results,
        List<Path> artifacts) {

    public SearchSummary {
        results = results == null ? List.of() : List.copyOf(results);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
