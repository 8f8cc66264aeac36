package com.raditha.approx.generation;

/**
 * Which subsets of the modifiable lines become variants.
 */
public enum GenerationStrategy {
    /**
     * One modified line per variant. N candidates for N modifiable lines.
     */
    ONE_HOT,

    /**
     * Every non-empty subset of the modifiable lines. 2^N - 1 candidates.
     */
    ALL;

    /**
     * Convert a string value to GenerationStrategy.
     *
     * @param value case-insensitive, {@code one_hot} and {@code one-hot} both accepted
     * @throws IllegalArgumentException if the value is not a valid strategy
     */
    public static GenerationStrategy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("GenerationStrategy value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "one_hot", "one-hot" -> ONE_HOT;
            case "all" -> ALL;
            default -> throw new IllegalArgumentException(
                    "Invalid generation strategy: " + value + ". Must be: all or one-hot");
        };
    }

    public String toCliString() {
        return switch (this) {
            case ONE_HOT -> "one-hot";
            case ALL -> "all";
        };
    }
}
