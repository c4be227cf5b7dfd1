package com.clawd.core.service;

import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.Message;
import com.clawd.core.model.ToolCall;
import com.clawd.core.model.ToolDefinition;

/**
 * Length-based token estimate for pre-flight budgeting.
 *
 * <p>This is an approximation (about four characters per token, plus a fixed overhead per
 * message), identical for every provider and deterministic for a given request. It is not a
 * billing-accurate count; providers report the real usage in {@code CompletionResponse.usage}.</p>
 */
public final class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;
    static final int TOKENS_PER_MESSAGE = 4;

    private TokenEstimator() {
    }

    public static int estimate(CompletionRequest request) {
        long chars = 0;
        int messages = 0;

        if (request.getMessages() != null) {
            for (Message message : request.getMessages()) {
                messages++;
                chars += length(message.getContent());
                if (message.hasToolCalls()) {
                    for (ToolCall call : message.getToolCalls()) {
                        chars += length(call.getName());
                        chars += call.getArguments() != null ? call.getArguments().toString().length() : 0;
                    }
                }
            }
        }

        if (request.hasTools()) {
            for (ToolDefinition tool : request.getTools()) {
                chars += length(tool.getName());
                chars += length(tool.getDescription());
                chars += tool.getParameters() != null ? tool.getParameters().toString().length() : 0;
            }
        }

        long tokens = (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN + (long) messages * TOKENS_PER_MESSAGE;
        return (int) Math.min(Integer.MAX_VALUE, tokens);
    }

    private static int length(String value) {
        return value != null ? value.length() : 0;
    }
}
