package com.clawd.core.provider;

import com.clawd.core.config.ClawdProperties;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Anthropic (Claude) Messages API adapter.
 */
@Slf4j
@Component
public class AnthropicAdapter extends AbstractProviderAdapter {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com";

    private final AnthropicMessagesTranslator translator;

    public AnthropicAdapter(WebClient webClient, ObjectMapper objectMapper, ClawdProperties properties) {
        super(webClient, objectMapper, properties, "anthropic");
        this.translator = new AnthropicMessagesTranslator(objectMapper, getName());
    }

    @Override
    public String getName() {
        return "anthropic";
    }

    @Override
    public JsonNode buildRequest(CompletionRequest request, String model) {
        ObjectNode body = translator.toNative(request, maxTokensOrDefault(request.getMaxTokens()));
        body.put("model", model);
        return body;
    }

    @Override
    public CompletionResponse parseResponse(JsonNode response, String model) {
        return translator.fromNative(response, model);
    }

    @Override
    public Mono<JsonNode> send(JsonNode nativeRequest, String model) {
        log.info("Forwarding request to Anthropic: model={}", model);

        String baseUrl = config != null && config.getBaseUrl() != null ? config.getBaseUrl() : DEFAULT_BASE_URL;
        return postJson(baseUrl + "/v1/messages", headers -> {
            headers.set("x-api-key", config.getApiKey());
            headers.set("anthropic-version", ANTHROPIC_VERSION);
        }, nativeRequest);
    }
}
