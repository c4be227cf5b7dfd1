package com.clawd.core.service;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.exception.RateLimitExceededException;
import com.clawd.core.service.retry.RetryExecutor;
import com.clawd.core.service.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Cached, rate-limited, retried reads from a quota-limited external API.
 *
 * <p>A cache hit returns without touching the limiter. On a miss every fetch attempt first
 * takes one token of {@code resource} (waiting up to {@code maxWait}); a denial counts as a
 * transient failure of that attempt. The fetched value is written back under the namespace TTL
 * or the one given.</p>
 */
@Slf4j
@Service
public class ExternalFetchService {

    static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(5);

    private final CacheStore cacheStore;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;

    public ExternalFetchService(CacheStore cacheStore,
                                RateLimiter rateLimiter,
                                RetryExecutor retryExecutor,
                                ObjectMapper objectMapper) {
        this.cacheStore = cacheStore;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetch with the namespace's TTL, the default retry policy and a five second limiter wait.
     */
    public <T> Mono<T> fetch(String namespace, String key, String resource, Class<T> type, Supplier<Mono<T>> fetcher) {
        return fetch(namespace, key, cacheStore.ttlFor(namespace), resource, DEFAULT_MAX_WAIT,
                RetryPolicy.builder().build(), type, fetcher, CancellationSignal.none());
    }

    public <T> Mono<T> fetch(String namespace,
                             String key,
                             Duration ttl,
                             String resource,
                             Duration maxWait,
                             RetryPolicy policy,
                             Class<T> type,
                             Supplier<Mono<T>> fetcher,
                             CancellationSignal cancel) {
        Supplier<Mono<T>> limitedFetch = () -> rateLimiter.acquire(resource, 1, maxWait, cancel)
                .flatMap(granted -> {
                    if (!granted) {
                        return Mono.<T>error(new RateLimitExceededException(resource, maxWait));
                    }
                    log.debug("Fetching {}:{} from {}", namespace, key, resource);
                    return fetcher.get();
                });

        return cacheStore.getOrCompute(namespace, key, ttl, objectMapper.constructType(type),
                () -> retryExecutor.execute(limitedFetch, policy, cancel), cancel);
    }
}
