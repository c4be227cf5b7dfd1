package com.clawd.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted token bucket state. Tokens are kept fractional so slow refill rates accumulate.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TokenBucketState {

    private double tokens;

    /**
     * Epoch millis of the last refill computation.
     */
    private long lastRefillAt;
}
