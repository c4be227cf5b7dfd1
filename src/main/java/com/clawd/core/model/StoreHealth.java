package com.clawd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a backing store health probe.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoreHealth {

    @JsonProperty("store")
    private String store;

    @JsonProperty("healthy")
    private boolean healthy;

    @JsonProperty("latency_ms")
    private Long latencyMs;

    @JsonProperty("error")
    private String error;
}
