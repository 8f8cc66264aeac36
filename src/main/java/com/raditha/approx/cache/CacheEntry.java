package com.raditha.approx.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One line of the cache file.
 *
 * @param hash      identity hash of the variant
 * @param status    pipeline outcome
 * @param reason    failure reason, null on success
 * @param timestamp when the outcome was recorded
 * @param metrics   measurements for successful entries, null otherwise
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
        String hash,
        VariantStatus status,
        String reason,
        Instant timestamp,
        VariantMetrics metrics) {

    public boolean isSuccess() {
        return status == VariantStatus.SUCCESS;
    }
}
