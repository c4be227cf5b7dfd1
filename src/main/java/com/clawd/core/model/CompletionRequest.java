package com.clawd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Normalized completion request. The router only reads it; adapters translate it into
 * their native shape right before the call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionRequest {

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("tools")
    private List<ToolDefinition> tools;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("temperature")
    private Double temperature;

    /**
     * Require the reply to be a single JSON object.
     */
    @JsonProperty("json_mode")
    private Boolean jsonMode;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    public boolean isJsonMode() {
        return Boolean.TRUE.equals(jsonMode);
    }
}
