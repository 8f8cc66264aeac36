package com.raditha.approx.pipeline;

/**
 * A measured variant together with its output error against the baseline.
 */
public record Evaluation(Measurement measurement, double error) {

    public double energy() {
        return measurement.energy();
    }

    public double latency() {
        return measurement.latency();
    }
}
