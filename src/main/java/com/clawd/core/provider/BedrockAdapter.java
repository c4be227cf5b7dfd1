package com.clawd.core.provider;

import com.clawd.core.config.ClawdProperties;
import com.clawd.core.exception.PermanentRequestException;
import com.clawd.core.exception.TransientIOException;
import com.clawd.core.exception.UnsupportedCapabilityException;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * AWS Bedrock adapter.
 * Supports Claude models via the Bedrock Runtime InvokeModel API, which takes the Anthropic
 * Messages body plus a Bedrock-specific version marker.
 */
@Slf4j
@Component
public class BedrockAdapter extends AbstractProviderAdapter {

    private static final String BEDROCK_ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private static final Map<String, String> MODEL_IDS = Map.of(
            "claude-3-opus", "anthropic.claude-3-opus-20240229-v1:0",
            "claude-3-sonnet", "anthropic.claude-3-sonnet-20240229-v1:0",
            "claude-3-haiku", "anthropic.claude-3-haiku-20240307-v1:0",
            "claude-3-5-sonnet", "anthropic.claude-3-5-sonnet-20240620-v1:0",
            "claude-3-5-haiku", "anthropic.claude-3-5-haiku-20241022-v1:0",
            "claude-2.1", "anthropic.claude-v2:1",
            "claude-2", "anthropic.claude-v2"
    );

    private final AnthropicMessagesTranslator translator;
    private final BedrockRuntimeAsyncClient bedrockClient;

    @Autowired
    public BedrockAdapter(WebClient webClient, ObjectMapper objectMapper, ClawdProperties properties) {
        super(webClient, objectMapper, properties, "bedrock");
        this.translator = new AnthropicMessagesTranslator(objectMapper, getName());
        this.bedrockClient = initializeBedrockClient();
    }

    BedrockAdapter(ObjectMapper objectMapper, ClawdProperties properties, BedrockRuntimeAsyncClient bedrockClient) {
        super(null, objectMapper, properties, "bedrock");
        this.translator = new AnthropicMessagesTranslator(objectMapper, getName());
        this.bedrockClient = bedrockClient;
    }

    /**
     * Initialize Bedrock async client. The api key, when set, holds
     * {@code ACCESS_KEY_ID:SECRET_ACCESS_KEY}; otherwise the default AWS credential chain applies.
     */
    private BedrockRuntimeAsyncClient initializeBedrockClient() {
        if (!isEnabled()) {
            log.debug("Bedrock provider is disabled, skipping client initialization");
            return null;
        }

        String region = config.getRegion() != null ? config.getRegion() : "us-east-1";

        AwsCredentialsProvider credentialsProvider;
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            String[] credentials = config.getApiKey().split(":", 2);
            if (credentials.length != 2) {
                throw new IllegalStateException(
                        "Invalid Bedrock credentials format. Expected: ACCESS_KEY_ID:SECRET_ACCESS_KEY");
            }
            credentialsProvider = StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(credentials[0], credentials[1]));
        } else {
            credentialsProvider = DefaultCredentialsProvider.create();
        }

        BedrockRuntimeAsyncClient client = BedrockRuntimeAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider)
                .build();

        log.info("Bedrock client initialized for region: {}", region);
        return client;
    }

    @Override
    public String getName() {
        return "bedrock";
    }

    @Override
    public JsonNode buildRequest(CompletionRequest request, String model) {
        String modelId = resolveModelId(model);
        if (!modelId.contains("anthropic.")) {
            throw new UnsupportedCapabilityException(getName(), "model family",
                    modelId + " does not accept the Messages format");
        }

        ObjectNode body = translator.toNative(request, maxTokensOrDefault(request.getMaxTokens()));
        body.put("anthropic_version", BEDROCK_ANTHROPIC_VERSION);
        return body;
    }

    @Override
    public CompletionResponse parseResponse(JsonNode response, String model) {
        CompletionResponse parsed = translator.fromNative(response, model);
        // Bedrock echoes no model; report the one the tier asked for
        parsed.setModel(model);
        return parsed;
    }

    @Override
    public Mono<JsonNode> send(JsonNode nativeRequest, String model) {
        if (!isEnabled() || bedrockClient == null) {
            return Mono.error(new PermanentRequestException(PermanentRequestException.Reason.PROVIDER_CONFIGURATION,
                    "Bedrock provider is not enabled or not configured"));
        }

        String modelId = resolveModelId(model);
        log.info("Forwarding request to Bedrock: model={}", modelId);

        InvokeModelRequest invokeRequest = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromString(nativeRequest.toString(), StandardCharsets.UTF_8))
                .build();

        return Mono.fromFuture(() -> bedrockClient.invokeModel(invokeRequest))
                .timeout(config.getTimeout())
                .map(response -> readBody(response.body().asUtf8String()))
                .onErrorMap(this::classify)
                .doOnSuccess(response -> log.debug("Received response from Bedrock"))
                .doOnError(error -> log.warn("Error invoking Bedrock: {}", error.getMessage()));
    }

    private JsonNode readBody(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransientIOException("bedrock returned an unreadable body", e);
        }
    }

    @Override
    protected Throwable classify(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;

        if (cause instanceof SdkServiceException) {
            SdkServiceException service = (SdkServiceException) cause;
            if (service.statusCode() < 100) {
                // no HTTP response was received
                return new TransientIOException("bedrock service error without status: " + service.getMessage(), service);
            }
            return classifyStatus(HttpStatusCode.valueOf(service.statusCode()), service.getMessage(), service);
        }
        if (cause instanceof SdkClientException) {
            return new TransientIOException("bedrock unreachable: " + cause.getMessage(), cause);
        }
        return super.classify(cause);
    }

    /**
     * Resolve friendly model name to Bedrock model ID. Ids already in Bedrock form, including
     * cross-region inference profiles, pass through unchanged.
     */
    String resolveModelId(String model) {
        String mapped = MODEL_IDS.get(model);
        if (mapped == null) {
            mapped = MODEL_IDS.get(model.replaceAll("-\\d{8}$", ""));
        }
        if (mapped != null) {
            return mapped;
        }
        if (model.contains(".")) {
            return model;
        }
        throw new PermanentRequestException(PermanentRequestException.Reason.PROVIDER_CONFIGURATION,
                "Unknown Bedrock model: " + model);
    }
}
