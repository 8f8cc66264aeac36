package com.raditha.approx.search;

/**
 * Blends output error and relative energy into one cost:
 * {@code cost = alpha * error + (1 - alpha) * energy / baselineEnergy}.
 * <p>
 * The cost is not monotonic in the number of rewritten lines, so a node can cost less
 * than its pruned parent. Such descendants are still never evaluated.
 *
 * @param alpha     weight of the error term, 0..1
 * @param threshold nodes costing more than this are pruned
 */
public record CostHeuristic(double alpha, double threshold) {

    public static final double DEFAULT_ALPHA = 1.0;
    public static final double DEFAULT_THRESHOLD = 0.05;

    public CostHeuristic {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be between 0.0 and 1.0, got: " + alpha);
        }
        if (Double.isNaN(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be >= 0, got: " + threshold);
        }
    }

    public static CostHeuristic defaults() {
        return new CostHeuristic(DEFAULT_ALPHA, DEFAULT_THRESHOLD);
    }

    public double cost(double error, double energyRatio) {
        return alpha * error + (1 - alpha) * energyRatio;
    }

    public double energyRatio(double energy, double baselineEnergy) {
        if (baselineEnergy <= 0) {
            throw new IllegalArgumentException("baseline energy must be positive");
        }
        return energy / baselineEnergy;
    }

    public boolean shouldPrune(double cost) {
        return cost > threshold;
    }
}
