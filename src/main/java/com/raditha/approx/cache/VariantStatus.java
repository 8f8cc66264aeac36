package com.raditha.approx.cache;

/**
 * Pipeline outcome recorded for a variant hash.
 */
public enum VariantStatus {
    SUCCESS,
    FAILED
}
