package com.clawd.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Author of a conversation message.
 */
public enum MessageRole {
    @JsonProperty("system")
    SYSTEM,

    @JsonProperty("user")
    USER,

    @JsonProperty("assistant")
    ASSISTANT,

    /**
     * Result of a tool invocation, answering an earlier assistant tool call.
     */
    @JsonProperty("tool")
    TOOL
}
