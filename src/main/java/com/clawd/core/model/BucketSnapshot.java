package com.clawd.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only view of a bucket for inspection endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketSnapshot {

    @JsonProperty("resource")
    private String resource;

    @JsonProperty("capacity")
    private int capacity;

    @JsonProperty("refill_rate")
    private double refillRate;

    @JsonProperty("available_tokens")
    private double availableTokens;

    /**
     * Milliseconds until at least one token is available.
     */
    @JsonProperty("wait_ms")
    private long waitMillis;
}
