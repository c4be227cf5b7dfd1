package com.clawd.core.provider;

import com.clawd.core.exception.TransientIOException;
import com.clawd.core.exception.UnsupportedCapabilityException;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.Message;
import com.clawd.core.model.MessageRole;
import com.clawd.core.model.ToolCall;
import com.clawd.core.model.ToolDefinition;
import com.clawd.core.model.Usage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Translation between the normalized model and the Anthropic Messages format, used both by the
 * direct Anthropic API and by Claude models on Bedrock.
 */
@Slf4j
class AnthropicMessagesTranslator {

    private final ObjectMapper objectMapper;
    private final String provider;

    AnthropicMessagesTranslator(ObjectMapper objectMapper, String provider) {
        this.objectMapper = objectMapper;
        this.provider = provider;
    }

    /**
     * Convert a normalized request to the Messages body (without the model field).
     */
    ObjectNode toNative(CompletionRequest request, int maxTokens) {
        if (request.isJsonMode()) {
            throw new UnsupportedCapabilityException(provider, "json_mode",
                    "the Messages API has no JSON response format");
        }

        ObjectNode body = objectMapper.createObjectNode();
        List<String> systemParts = new ArrayList<>();
        ArrayNode messages = objectMapper.createArrayNode();
        ObjectNode previous = null;

        for (Message msg : request.getMessages()) {
            if (msg.getRole() == MessageRole.SYSTEM) {
                if (messages.size() > 0) {
                    throw new UnsupportedCapabilityException(provider, "system message position",
                            "system messages must precede the conversation");
                }
                systemParts.add(msg.getContent());
                continue;
            }

            String role = msg.getRole() == MessageRole.ASSISTANT ? "assistant" : "user";
            ArrayNode blocks = contentBlocks(msg);

            // The API requires alternating roles, so adjacent same-role messages are merged
            if (previous != null && role.equals(previous.get("role").asText())) {
                ((ArrayNode) previous.get("content")).addAll(blocks);
            } else {
                ObjectNode anthropicMsg = objectMapper.createObjectNode();
                anthropicMsg.put("role", role);
                anthropicMsg.set("content", blocks);
                messages.add(anthropicMsg);
                previous = anthropicMsg;
            }
        }

        body.set("messages", messages);
        if (!systemParts.isEmpty()) {
            body.put("system", String.join("\n\n", systemParts));
        }

        body.put("max_tokens", maxTokens);
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }

        if (request.hasTools()) {
            List<ObjectNode> schemas = ToolSchemas.parameterSchemas(provider, request.getTools(), objectMapper);
            ArrayNode tools = objectMapper.createArrayNode();
            for (int i = 0; i < request.getTools().size(); i++) {
                ToolDefinition tool = request.getTools().get(i);
                ObjectNode nativeTool = objectMapper.createObjectNode();
                nativeTool.put("name", tool.getName());
                if (tool.getDescription() != null) {
                    nativeTool.put("description", tool.getDescription());
                }
                nativeTool.set("input_schema", schemas.get(i));
                tools.add(nativeTool);
            }
            body.set("tools", tools);
        }

        return body;
    }

    private ArrayNode contentBlocks(Message msg) {
        ArrayNode blocks = objectMapper.createArrayNode();

        if (msg.getRole() == MessageRole.TOOL) {
            if (msg.getToolCallId() == null) {
                throw new UnsupportedCapabilityException(provider, "tool result",
                        "tool message without tool_call_id");
            }
            ObjectNode result = objectMapper.createObjectNode();
            result.put("type", "tool_result");
            result.put("tool_use_id", msg.getToolCallId());
            result.put("content", msg.getContent() != null ? msg.getContent() : "");
            blocks.add(result);
            return blocks;
        }

        if (msg.getContent() != null && !msg.getContent().isEmpty()) {
            ObjectNode text = objectMapper.createObjectNode();
            text.put("type", "text");
            text.put("text", msg.getContent());
            blocks.add(text);
        }

        if (msg.hasToolCalls()) {
            if (msg.getRole() != MessageRole.ASSISTANT) {
                throw new UnsupportedCapabilityException(provider, "tool calls",
                        "only assistant messages may carry tool calls");
            }
            for (ToolCall call : msg.getToolCalls()) {
                ObjectNode use = objectMapper.createObjectNode();
                use.put("type", "tool_use");
                use.put("id", call.getId());
                use.put("name", call.getName());
                use.set("input", call.getArguments() != null ? call.getArguments() : objectMapper.createObjectNode());
                blocks.add(use);
            }
        }

        if (blocks.isEmpty()) {
            throw new UnsupportedCapabilityException(provider, "empty message",
                    "a " + msg.getRole() + " message needs text or tool calls");
        }
        return blocks;
    }

    /**
     * Convert a Messages response to the normalized form.
     */
    CompletionResponse fromNative(JsonNode response, String model) {
        JsonNode content = response.get("content");
        if (content == null || !content.isArray()) {
            throw new TransientIOException(provider + " response has no content array");
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();

        for (JsonNode block : content) {
            String type = block.path("type").asText();
            switch (type) {
                case "text" -> text.append(block.path("text").asText());
                case "tool_use" -> toolCalls.add(ToolCall.builder()
                        .id(block.path("id").asText())
                        .name(block.path("name").asText())
                        .arguments(block.has("input") ? block.get("input") : objectMapper.createObjectNode())
                        .build());
                default -> log.debug("Ignoring {} content block of type {}", provider, type);
            }
        }

        Usage usage = null;
        if (response.has("usage")) {
            JsonNode usageNode = response.get("usage");
            int input = usageNode.path("input_tokens").asInt(0);
            int output = usageNode.path("output_tokens").asInt(0);
            usage = Usage.builder()
                    .promptTokens(input)
                    .completionTokens(output)
                    .totalTokens(input + output)
                    .build();
        }

        return CompletionResponse.builder()
                .id(response.has("id") ? response.get("id").asText() : "msg-" + UUID.randomUUID().toString().substring(0, 8))
                .provider(provider)
                .model(response.has("model") ? response.get("model").asText() : model)
                .content(text.toString())
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .finishReason(mapStopReason(response.path("stop_reason").asText("end_turn")))
                .usage(usage)
                .build();
    }

    /**
     * Map Claude stop reasons to normalized finish reasons.
     */
    private static String mapStopReason(String stopReason) {
        return switch (stopReason) {
            case "max_tokens" -> "length";
            case "tool_use" -> "tool_calls";
            default -> "stop";
        };
    }
}
