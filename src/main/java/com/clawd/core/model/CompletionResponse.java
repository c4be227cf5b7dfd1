package com.clawd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Normalized completion result, produced fresh for every call.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionResponse {

    @JsonProperty("id")
    private String id;

    /**
     * Provider that produced the answer (e.g. "anthropic", "openai").
     */
    @JsonProperty("provider")
    private String provider;

    @JsonProperty("model")
    private String model;

    @JsonProperty("content")
    private String content;

    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    @JsonProperty("finish_reason")
    private String finishReason; // stop, length, tool_calls, content_filter

    @JsonProperty("usage")
    private Usage usage;

    /**
     * Providers tried and abandoned before this one answered, in attempt order.
     */
    @JsonProperty("failover_history")
    private List<ProviderFailure> failoverHistory;

    @JsonProperty("x_cached")
    private Boolean cached;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
