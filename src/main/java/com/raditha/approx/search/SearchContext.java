package com.raditha.approx.search;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.generation.ModifiedLinesRecorder;
import com.raditha.approx.generation.VariantGenerator;
import com.raditha.approx.generation.VariantScanner;
import com.raditha.approx.parser.ParsedSource;
import com.raditha.approx.pipeline.EvaluationPipeline;

import java.nio.file.Path;

/**
 * Everything a search engine needs for one application. Built once by the orchestrator;
 * the cache is shared by reference.
 *
 * @param source      parsed kernel
 * @param sourceFile  the kernel on disk, compiled as the baseline
 * @param variantsDir where variants are written
 * @param generator   variant generator
 * @param scanner     variants directory scanner
 * @param cache       outcomes of earlier evaluations
 * @param pipeline    build, simulate, profile and compare
 * @param recorder    modified-lines records; may be null
 * @param workers     size of the worker pool
 */
public record SearchContext(
        ParsedSource source,
        Path sourceFile,
        Path variantsDir,
        VariantGenerator generator,
        VariantScanner scanner,
        VariantCache cache,
        EvaluationPipeline pipeline,
        ModifiedLinesRecorder recorder,
        int workers) {

    public SearchContext {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got: " + workers);
        }
    }

    public String fileName() {
        return sourceFile.getFileName().toString();
    }
}
