package com.raditha.approx.generation;

import com.raditha.approx.cache.VariantCache;
import com.raditha.approx.hashing.CanonicalHasher;
import com.raditha.approx.parser.ParsedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Collects the variants present in a variants directory, including files left there by
 * earlier or concurrent generator runs.
 * <p>
 * Each file is re-hashed with the original kernel's logical index, so the hash in the
 * file name is never trusted. Modified lines are recovered by diffing against the
 * original.
 */
public class VariantScanner {

    private static final Logger logger = LoggerFactory.getLogger(VariantScanner.class);

    /**
     * @param variantsDir directory holding {@code <base>_<hash><ext>} files
     * @param fileName    file name of the original kernel
     * @param original    the parsed original kernel
     * @param cache       hashes to leave out; may be null
     * @return variants in file-name order, one per distinct hash
     */
    public List<Variant> scan(Path variantsDir, String fileName, ParsedSource original, VariantCache cache)
            throws IOException {
        if (!Files.isDirectory(variantsDir)) {
            return List.of();
        }
        String prefix = VariantGenerator.baseName(fileName) + "_";
        String extension = VariantGenerator.extension(fileName);
        String baselineHash = CanonicalHasher.identityHash(original.lines(), original.physicalToLogical());

        List<Path> files;
        try (Stream<Path> listing = Files.list(variantsDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(extension);
                    })
                    .sorted()
                    .toList();
        }

        List<Variant> variants = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int cached = 0;
        for (Path file : files) {
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.warn("Skipping unreadable variant {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            String hash = CanonicalHasher.identityHash(lines, original.physicalToLogical());
            if (hash.equals(baselineHash) || !seen.add(hash)) {
                continue;
            }
            if (cache != null && cache.contains(hash)) {
                cached++;
                continue;
            }
            variants.add(new Variant(file, hash, VariantDiff.modifiedLines(original.lines(), lines)));
        }

        logger.info("Found {} variant files in {}: {} to evaluate, {} already cached",
                files.size(), variantsDir, variants.size(), cached);
        return variants;
    }
}
