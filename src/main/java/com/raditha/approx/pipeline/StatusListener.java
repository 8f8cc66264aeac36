package com.raditha.approx.pipeline;

/**
 * Receives human-readable progress for each variant. Purely observational: exceptions
 * thrown here are logged by the caller and never affect the outcome.
 */
@FunctionalInterface
public interface StatusListener {

    StatusListener NONE = (variantId, message) -> { };

    void onStatus(String variantId, String message);
}
