package com.clawd.core.controller;

import com.clawd.core.exception.PermanentRequestException;
import com.clawd.core.exception.ProvidersExhaustedException;
import com.clawd.core.exception.RateLimitExceededException;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.FailureKind;
import com.clawd.core.model.ProviderFailure;
import com.clawd.core.model.ProviderTier;
import com.clawd.core.service.CompletionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompletionControllerTest {

    private static final String BODY = "{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}";

    @Mock
    private CompletionService completionService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new CompletionController(completionService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testCompleteOnAliasedTier() {
        CompletionResponse response = CompletionResponse.builder()
                .provider("anthropic")
                .model("claude-3-opus")
                .content("hello")
                .finishReason("stop")
                .build();
        when(completionService.complete(any(CompletionRequest.class), eq(ProviderTier.DEEP), isNull()))
                .thenReturn(Mono.just(response));

        client.post().uri("/v1/completions?tier=smart")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.provider").isEqualTo("anthropic")
                .jsonPath("$.content").isEqualTo("hello")
                .jsonPath("$.finish_reason").isEqualTo("stop");
    }

    @Test
    void testCacheTtlIsParsed() {
        when(completionService.complete(any(CompletionRequest.class), eq(ProviderTier.BALANCED),
                eq(Duration.ofMinutes(10))))
                .thenReturn(Mono.just(CompletionResponse.builder().content("cached?").cached(true).build()));

        client.post().uri("/v1/completions?cacheTtl=PT10M")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.x_cached").isEqualTo(true);
    }

    @Test
    void testInvalidTtlIsBadRequest() {
        client.post().uri("/v1/completions?cacheTtl=ten-minutes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_request");

        verifyNoInteractions(completionService);
    }

    @Test
    void testUnknownTierIsBadRequest() {
        client.post().uri("/v1/completions?tier=turbo")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void testMalformedRequestIsBadRequest() {
        when(completionService.complete(any(CompletionRequest.class), eq(ProviderTier.BALANCED), isNull()))
                .thenReturn(Mono.error(new PermanentRequestException(
                        PermanentRequestException.Reason.MALFORMED_REQUEST, "messages must not be empty")));

        client.post().uri("/v1/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("malformed_request");
    }

    @Test
    void testProvidersExhaustedIsServiceUnavailable() {
        ProviderFailure failure = ProviderFailure.builder()
                .provider("anthropic")
                .model("claude-3-5-sonnet")
                .kind(FailureKind.RETRIES_EXHAUSTED)
                .message("anthropic returned HTTP 529")
                .attempts(2)
                .build();
        when(completionService.complete(any(CompletionRequest.class), eq(ProviderTier.BALANCED), isNull()))
                .thenReturn(Mono.error(new ProvidersExhaustedException(ProviderTier.BALANCED, List.of(failure))));

        client.post().uri("/v1/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("providers_exhausted")
                .jsonPath("$.tier").isEqualTo("BALANCED")
                .jsonPath("$.failures[0].provider").isEqualTo("anthropic")
                .jsonPath("$.failures[0].attempts").isEqualTo(2);
    }

    @Test
    void testRateLimitedCarriesRetryAfter() {
        when(completionService.complete(any(CompletionRequest.class), eq(ProviderTier.FAST), isNull()))
                .thenReturn(Mono.error(new RateLimitExceededException("anthropic_api", Duration.ofMillis(1500))));

        client.post().uri("/v1/completions?tier=fast")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "2")
                .expectBody()
                .jsonPath("$.resource").isEqualTo("anthropic_api");
    }

    @Test
    void testEstimate() {
        when(completionService.estimateTokens(any(CompletionRequest.class))).thenReturn(5);

        client.post().uri("/v1/completions/estimate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.estimated_tokens").isEqualTo(5)
                .jsonPath("$.approximate").isEqualTo(true);
    }
}
