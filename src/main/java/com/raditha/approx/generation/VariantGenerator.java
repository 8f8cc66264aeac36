package com.raditha.approx.generation;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.hashing.CanonicalHasher;
import com.raditha.approx.parser.ParsedSource;
import com.raditha.approx.transform.OperatorTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates subsets of the modifiable lines, rewrites them, and publishes each
 * previously unseen variant as {@code <base>_<hash><ext>}.
 * <p>
 * Files are written to a temporary name in the output directory and renamed into place,
 * so a generator running concurrently against the same directory never observes a
 * partially written variant.
 */
public class VariantGenerator {

    private static final Logger logger = LoggerFactory.getLogger(VariantGenerator.class);

    private final OperatorTransformer transformer;

    public VariantGenerator(OperatorTransformer transformer) {
        this.transformer = transformer;
    }

    /**
     * @param source     parsed kernel
     * @param fileName   file name of the kernel, used to name variants
     * @param outputDir  created if absent
     * @param strategy   which subsets to visit
     * @param cache      hashes already evaluated; may be null
     * @param limit      maximum number of new files, 0 for no cap
     */
    public GenerationResult generate(ParsedSource source, String fileName, Path outputDir,
                                     GenerationStrategy strategy, VariantCache cache, int limit) throws IOException {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        Files.createDirectories(outputDir);

        String baselineHash = CanonicalHasher.identityHash(source.lines(), source.physicalToLogical());
        Set<String> seen = new HashSet<>();
        seen.add(baselineHash);

        List<Variant> variants = new ArrayList<>();
        int candidates = 0;
        int skippedCached = 0;
        int skippedDuplicate = 0;
        int alreadyPresent = 0;
        int failed = 0;
        boolean limitReached = false;

        SubsetEnumerator subsets = new SubsetEnumerator(source.modifiableLines(), strategy);
        while (subsets.hasNext()) {
            if (limit > 0 && variants.size() >= limit) {
                limitReached = true;
                logger.info("Variant limit of {} reached, stopping enumeration", limit);
                break;
            }
            List<Integer> subset = subsets.next();
            candidates++;

            List<String> lines = materialize(source, subset);
            String hash = CanonicalHasher.identityHash(lines, source.physicalToLogical());

            if (!seen.add(hash)) {
                skippedDuplicate++;
                continue;
            }
            if (cache != null && cache.contains(hash)) {
                skippedCached++;
                continue;
            }

            Path target = outputDir.resolve(variantFileName(fileName, hash));
            if (Files.exists(target)) {
                alreadyPresent++;
                continue;
            }
            try {
                publish(lines, target);
                variants.add(new Variant(target, hash, subset));
                logger.debug("Generated variant {} for lines {}", CanonicalHasher.shortHash(hash), subset);
            } catch (GenerationException e) {
                failed++;
                logger.error("[{}] {}", CanonicalHasher.shortHash(hash), e.getMessage());
            }
        }

        logger.info("Generation ({}): {} candidates, {} new, {} cached, {} duplicate, {} existing, {} failed",
                strategy.toCliString(), candidates, variants.size(), skippedCached, skippedDuplicate,
                alreadyPresent, failed);
        return new GenerationResult(variants, candidates, skippedCached, skippedDuplicate,
                alreadyPresent, failed, limitReached);
    }

    /**
     * Materialise exactly one subset. An existing file with the same hash is reused.
     */
    public Variant generateSpecific(ParsedSource source, String fileName, List<Integer> modifiedLines,
                                    Path outputDir) throws GenerationException {
        List<Integer> subset = modifiedLines.stream().sorted().toList();
        for (Integer index : subset) {
            if (!source.modifiableLines().contains(index)) {
                throw new IllegalArgumentException("Line " + index + " is not modifiable");
            }
        }
        List<String> lines = materialize(source, subset);
        String hash = CanonicalHasher.identityHash(lines, source.physicalToLogical());
        Path target = outputDir.resolve(variantFileName(fileName, hash));
        if (!Files.exists(target)) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                throw new GenerationException("Cannot create " + outputDir + ": " + e.getMessage(), e);
            }
            publish(lines, target);
        }
        return new Variant(target, hash, subset);
    }

    /**
     * The kernel lines with exactly {@code subset} rewritten.
     */
    public List<String> materialize(ParsedSource source, List<Integer> subset) {
        List<String> lines = new ArrayList<>(source.lines());
        for (Integer index : subset) {
            lines.set(index, transformer.applyTransform(lines.get(index)));
        }
        return lines;
    }

    public static String variantFileName(String fileName, String hash) {
        return baseName(fileName) + "_" + hash + extension(fileName);
    }

    public static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }

    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? "" : fileName.substring(dot);
    }

    private static void publish(List<String> lines, Path target) throws GenerationException {
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.writeString(temp, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new GenerationException("Cannot write variant " + target.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
