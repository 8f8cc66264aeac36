package com.raditha.approx.hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Computes the identity hash of a variant.
 * <p>
 * Only logical lines take part: each one is trimmed and its internal whitespace runs are
 * collapsed to a single space, then the lines are joined with newlines and digested with
 * SHA-256. Two files that differ only in formatting, blank lines or annotation text get
 * the same hash.
 */
public final class CanonicalHasher {

    public static final int SHORT_HASH_LENGTH = 8;

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private CanonicalHasher() {
    }

    /**
     * @param lines             physical lines of the variant
     * @param physicalToLogical logical index of the original source
     * @return lowercase hex SHA-256 digest
     */
    public static String identityHash(List<String> lines, Map<Integer, Integer> physicalToLogical) {
        SortedMap<Integer, Integer> ordered = physicalToLogical instanceof SortedMap<Integer, Integer> sorted
                ? sorted
                : new TreeMap<>(physicalToLogical);

        StringJoiner canonical = new StringJoiner("\n");
        for (Integer index : ordered.keySet()) {
            if (index >= 0 && index < lines.size()) {
                canonical.add(normalize(lines.get(index)));
            }
        }
        return sha256(canonical.toString());
    }

    /**
     * Digest of a whole file with trailing whitespace removed from each line.
     * Used to tell whether two files on disk are the same baseline.
     */
    public static String contentHash(List<String> lines) {
        StringJoiner joined = new StringJoiner("\n");
        for (String line : lines) {
            joined.add(line.stripTrailing());
        }
        return sha256(joined.toString());
    }

    public static String shortHash(String hash) {
        if (hash == null) {
            return "--------";
        }
        return hash.length() <= SHORT_HASH_LENGTH ? hash : hash.substring(0, SHORT_HASH_LENGTH);
    }

    static String normalize(String line) {
        return WHITESPACE_RUN.matcher(line.strip()).replaceAll(" ");
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
