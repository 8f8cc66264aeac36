package com.raditha.approx.search;

/**
 * How the variant space is explored.
 */
public enum SearchMode {
    /**
     * Evaluate every variant that is not already cached, in any order.
     */
    BRUTE_FORCE,

    /**
     * Walk the subset lattice level by level and skip the subtrees of rejected nodes.
     */
    PRUNING_TREE;

    /**
     * @param value case-insensitive; {@code brute-force}, {@code brute_force},
     *              {@code pruning-tree}, {@code pruning_tree} and {@code tree} are accepted
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static SearchMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("SearchMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "brute-force", "brute_force", "bruteforce" -> BRUTE_FORCE;
            case "pruning-tree", "pruning_tree", "tree" -> PRUNING_TREE;
            default -> throw new IllegalArgumentException(
                    "Invalid search mode: " + value + ". Must be: brute-force or pruning-tree");
        };
    }

    public String toCliString() {
        return switch (this) {
            case BRUTE_FORCE -> "brute-force";
            case PRUNING_TREE -> "pruning-tree";
        };
    }
}
