package com.clawd.core.service;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.ProviderTier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completions with optional response caching.
 *
 * <p>Without a cache TTL every call goes to the {@link ProviderRouter}. With one, identical
 * requests on the same tier are answered from the {@value #NAMESPACE} namespace of the
 * {@link CacheStore}; the key is the SHA-256 of the request's canonical JSON (keys sorted
 * recursively) and the tier.</p>
 */
@Slf4j
@Service
public class CompletionService {

    public static final String NAMESPACE = "completion";

    private final ProviderRouter router;
    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;

    public CompletionService(ProviderRouter router, CacheStore cacheStore, ObjectMapper objectMapper) {
        this.router = router;
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
    }

    public Mono<CompletionResponse> complete(CompletionRequest request, ProviderTier tier, Duration cacheTtl) {
        return complete(request, tier, cacheTtl, CancellationSignal.none());
    }

    /**
     * @param cacheTtl how long to keep the response; null bypasses the cache
     */
    public Mono<CompletionResponse> complete(CompletionRequest request,
                                             ProviderTier tier,
                                             Duration cacheTtl,
                                             CancellationSignal cancel) {
        if (cacheTtl == null) {
            return router.complete(request, tier, cancel);
        }

        String key = cacheKey(request, tier);
        AtomicBoolean computed = new AtomicBoolean(false);

        return cacheStore.getOrCompute(NAMESPACE, key, cacheTtl,
                        objectMapper.constructType(CompletionResponse.class),
                        () -> {
                            computed.set(true);
                            return router.complete(request, tier, cancel);
                        },
                        cancel)
                .map(response -> response.toBuilder().cached(!computed.get()).build())
                .doOnNext(response -> {
                    if (Boolean.TRUE.equals(response.getCached())) {
                        log.info("Completion served from cache: tier={}, key={}", tier, key);
                    }
                });
    }

    public int estimateTokens(CompletionRequest request) {
        return router.estimateTokens(request);
    }

    /**
     * Stable key for a request on a tier.
     */
    public String cacheKey(CompletionRequest request, ProviderTier tier) {
        JsonNode canonical = sortKeys(objectMapper.valueToTree(request));
        try {
            return DigestUtils.sha256Hex(objectMapper.writeValueAsString(canonical) + "|" + tier.name());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion request", e);
        }
    }

    private JsonNode sortKeys(JsonNode node) {
        if (node.isObject()) {
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            ObjectNode sorted = objectMapper.createObjectNode();
            for (String fieldName : fieldNames) {
                sorted.set(fieldName, sortKeys(node.get(fieldName)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(element -> array.add(sortKeys(element)));
            return array;
        }
        return node;
    }
}
