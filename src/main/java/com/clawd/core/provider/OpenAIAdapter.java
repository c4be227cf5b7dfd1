package com.clawd.core.provider;

import com.clawd.core.config.ClawdProperties;
import com.clawd.core.exception.TransientIOException;
import com.clawd.core.exception.UnsupportedCapabilityException;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.Message;
import com.clawd.core.model.MessageRole;
import com.clawd.core.model.ToolCall;
import com.clawd.core.model.ToolDefinition;
import com.clawd.core.model.Usage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * OpenAI chat completion adapter.
 * Supports GPT-4o and other chat models, including function calling and JSON mode.
 */
@Slf4j
@Component
public class OpenAIAdapter extends AbstractProviderAdapter {

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAIAdapter(WebClient webClient, ObjectMapper objectMapper, ClawdProperties properties) {
        super(webClient, objectMapper, properties, "openai");
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public JsonNode buildRequest(CompletionRequest request, String model) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = objectMapper.createArrayNode();
        for (Message msg : request.getMessages()) {
            messages.add(toNativeMessage(msg));
        }
        body.set("messages", messages);

        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }

        if (request.hasTools()) {
            List<ObjectNode> schemas = ToolSchemas.parameterSchemas(getName(), request.getTools(), objectMapper);
            ArrayNode tools = objectMapper.createArrayNode();
            for (int i = 0; i < request.getTools().size(); i++) {
                ToolDefinition tool = request.getTools().get(i);
                ObjectNode function = objectMapper.createObjectNode();
                function.put("name", tool.getName());
                if (tool.getDescription() != null) {
                    function.put("description", tool.getDescription());
                }
                function.set("parameters", schemas.get(i));

                ObjectNode nativeTool = objectMapper.createObjectNode();
                nativeTool.put("type", "function");
                nativeTool.set("function", function);
                tools.add(nativeTool);
            }
            body.set("tools", tools);
        }

        if (request.isJsonMode()) {
            ObjectNode format = objectMapper.createObjectNode();
            format.put("type", "json_object");
            body.set("response_format", format);
        }

        return body;
    }

    private ObjectNode toNativeMessage(Message msg) {
        ObjectNode nativeMsg = objectMapper.createObjectNode();
        nativeMsg.put("role", roleName(msg.getRole()));

        if (msg.getRole() == MessageRole.TOOL) {
            if (msg.getToolCallId() == null) {
                throw new UnsupportedCapabilityException(getName(), "tool result",
                        "tool message without tool_call_id");
            }
            nativeMsg.put("tool_call_id", msg.getToolCallId());
            nativeMsg.put("content", msg.getContent() != null ? msg.getContent() : "");
            return nativeMsg;
        }

        if (msg.getContent() != null) {
            nativeMsg.put("content", msg.getContent());
        } else {
            nativeMsg.putNull("content");
        }

        if (msg.hasToolCalls()) {
            if (msg.getRole() != MessageRole.ASSISTANT) {
                throw new UnsupportedCapabilityException(getName(), "tool calls",
                        "only assistant messages may carry tool calls");
            }
            ArrayNode calls = objectMapper.createArrayNode();
            for (ToolCall call : msg.getToolCalls()) {
                ObjectNode function = objectMapper.createObjectNode();
                function.put("name", call.getName());
                // Arguments travel as a JSON-encoded string on this API
                function.put("arguments", call.getArguments() != null ? call.getArguments().toString() : "{}");

                ObjectNode nativeCall = objectMapper.createObjectNode();
                nativeCall.put("id", call.getId());
                nativeCall.put("type", "function");
                nativeCall.set("function", function);
                calls.add(nativeCall);
            }
            nativeMsg.set("tool_calls", calls);
        }
        return nativeMsg;
    }

    private static String roleName(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    @Override
    public CompletionResponse parseResponse(JsonNode response, String model) {
        JsonNode choice = response.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new TransientIOException("openai response has no choices");
        }
        JsonNode message = choice.path("message");

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(ToolCall.builder()
                    .id(call.path("id").asText())
                    .name(function.path("name").asText())
                    .arguments(parseArguments(function.path("arguments").asText("{}")))
                    .build());
        }

        Usage usage = null;
        if (response.has("usage")) {
            JsonNode usageNode = response.get("usage");
            usage = Usage.builder()
                    .promptTokens(usageNode.path("prompt_tokens").asInt(0))
                    .completionTokens(usageNode.path("completion_tokens").asInt(0))
                    .totalTokens(usageNode.path("total_tokens").asInt(0))
                    .build();
        }

        String finishReason = textOrNull(choice, "finish_reason");
        return CompletionResponse.builder()
                .id(response.has("id") ? response.get("id").asText() : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .provider(getName())
                .model(response.has("model") ? response.get("model").asText() : model)
                .content(textOrNull(message, "content"))
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .finishReason(finishReason != null ? finishReason : "stop")
                .usage(usage)
                .build();
    }

    private JsonNode parseArguments(String arguments) {
        try {
            return objectMapper.readTree(arguments.isEmpty() ? "{}" : arguments);
        } catch (JsonProcessingException e) {
            // Models occasionally emit truncated argument JSON; a new attempt usually fixes it
            throw new TransientIOException("openai returned unparsable tool arguments", e);
        }
    }

    @Override
    public Mono<JsonNode> send(JsonNode nativeRequest, String model) {
        log.info("Forwarding request to OpenAI: model={}", model);

        String baseUrl = config != null && config.getBaseUrl() != null ? config.getBaseUrl() : DEFAULT_BASE_URL;
        return postJson(baseUrl + "/chat/completions",
                headers -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey()),
                nativeRequest);
    }
}
