package com.clawd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider-agnostic chat message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    @JsonProperty("role")
    private MessageRole role;

    @JsonProperty("content")
    private String content;

    /**
     * Tool invocations requested by an assistant message.
     */
    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    /**
     * For {@link MessageRole#TOOL} messages, the id of the call being answered.
     */
    @JsonProperty("tool_call_id")
    private String toolCallId;

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static Message toolResult(String toolCallId, String content) {
        return Message.builder().role(MessageRole.TOOL).toolCallId(toolCallId).content(content).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
