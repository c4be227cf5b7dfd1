package com.clawd.core.provider;

import com.clawd.core.config.ClawdProperties;
import com.clawd.core.exception.PermanentRequestException;
import com.clawd.core.exception.TransientIOException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Abstract base class for provider adapters with common HTTP plumbing and failure
 * classification.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final ClawdProperties.ProviderConfig config;

    protected AbstractProviderAdapter(
            WebClient webClient,
            ObjectMapper objectMapper,
            ClawdProperties properties,
            String providerName) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = properties.getProviders().get(providerName);
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled();
    }

    /**
     * POST a JSON body and read a JSON response, classifying failures.
     */
    protected Mono<JsonNode> postJson(String uri, Consumer<HttpHeaders> headers, JsonNode body) {
        if (!isEnabled()) {
            return Mono.error(new PermanentRequestException(PermanentRequestException.Reason.PROVIDER_CONFIGURATION,
                    "Provider " + getName() + " is not enabled"));
        }

        return webClient.post()
                .uri(uri)
                .headers(headers)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .onErrorMap(this::classify)
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", getName()))
                .doOnError(error -> log.warn("Request failed for provider {}: {}", getName(), error.getMessage()));
    }

    /**
     * Map a raw client error onto the core's transient/permanent taxonomy.
     */
    protected Throwable classify(Throwable error) {
        if (error instanceof TransientIOException || error instanceof PermanentRequestException) {
            return error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return classifyStatus(response.getStatusCode(), response.getResponseBodyAsString(), error);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return new TransientIOException(getName() + " unreachable: " + error.getMessage(), error);
        }
        return error;
    }

    /**
     * 408, 429 and 5xx are transient; 401/403 are credential problems; 404 means the configured
     * model or endpoint is unknown; any other 4xx is a malformed request.
     */
    protected Throwable classifyStatus(HttpStatusCode status, String body, Throwable cause) {
        int code = status.value();
        String message = getName() + " returned HTTP " + code + (body == null || body.isEmpty() ? "" : ": " + truncate(body));

        if (code == 408 || code == 429 || status.is5xxServerError()) {
            return new TransientIOException(message, cause);
        }
        if (code == 401 || code == 403) {
            return new PermanentRequestException(PermanentRequestException.Reason.AUTHENTICATION, message, cause);
        }
        if (code == 404) {
            return new PermanentRequestException(PermanentRequestException.Reason.PROVIDER_CONFIGURATION, message, cause);
        }
        return new PermanentRequestException(PermanentRequestException.Reason.MALFORMED_REQUEST, message, cause);
    }

    protected int maxTokensOrDefault(Integer maxTokens) {
        return maxTokens != null ? maxTokens : 4096;
    }

    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String truncate(String body) {
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
