package com.clawd.core.provider;

import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Capability interface for one AI-inference provider.
 * Implementations translate the normalized request into the provider's native shape, call the
 * provider, and translate the native response back. The router selects adapters by name from
 * the tier's provider list.
 */
public interface ProviderAdapter {

    /**
     * Get provider name (e.g., "anthropic", "openai", "bedrock").
     *
     * @return provider name, matching the keys under {@code clawd.providers}
     */
    String getName();

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();

    /**
     * Translate a normalized request into the native request body.
     *
     * @param request normalized request
     * @param model   provider model id
     * @return native request
     * @throws com.clawd.core.exception.UnsupportedCapabilityException if any construct of the
     *                                                                 request cannot be expressed
     */
    JsonNode buildRequest(CompletionRequest request, String model);

    /**
     * Translate a native response into the normalized form.
     *
     * @param response native response body
     * @param model    model the request was sent to
     * @return normalized response
     */
    CompletionResponse parseResponse(JsonNode response, String model);

    /**
     * Send a native request. Failures are classified into
     * {@link com.clawd.core.exception.TransientIOException} or
     * {@link com.clawd.core.exception.PermanentRequestException}.
     *
     * @param nativeRequest body produced by {@link #buildRequest}
     * @param model         provider model id
     * @return native response body
     */
    Mono<JsonNode> send(JsonNode nativeRequest, String model);

    /**
     * Build, send and parse one completion.
     */
    default Mono<CompletionResponse> complete(CompletionRequest request, String model) {
        return Mono.fromCallable(() -> buildRequest(request, model))
                .flatMap(nativeRequest -> send(nativeRequest, model))
                .map(nativeResponse -> parseResponse(nativeResponse, model));
    }
}
