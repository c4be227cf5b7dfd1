package com.clawd.core.service;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.config.ClawdProperties;
import com.clawd.core.config.RateLimitRegistry;
import com.clawd.core.exception.LimiterUnavailableException;
import com.clawd.core.exception.StoreUnavailableException;
import com.clawd.core.model.AcquireResult;
import com.clawd.core.model.BucketSnapshot;
import com.clawd.core.model.BucketSpec;
import com.clawd.core.model.TokenBucketState;
import com.clawd.core.repository.KeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Token bucket rate limiter whose bucket state lives in the shared store.
 *
 * <p>Every admission check reads the bucket, refills it lazily by
 * {@code elapsed * refillRate} (capped at capacity) and, if enough tokens are present,
 * writes the decremented state back with compare-and-set. A lost CAS means another process
 * changed the bucket in between, so the check is repeated against the fresh state. Two callers
 * can therefore never both spend the same token.</p>
 *
 * <p>Denials write nothing: the next check refills from the same timestamp and reaches the
 * same token count as an eager update would.</p>
 *
 * <p>The limiter fails closed. If the store cannot be reached the caller gets
 * {@link LimiterUnavailableException}, never an implicit grant.</p>
 */
@Slf4j
@Service
public class RateLimiter {

    private static final String KEY_SEGMENT = "ratelimit:";
    private static final int MAX_CAS_ATTEMPTS = 32;

    private final KeyValueStore store;
    private final RateLimitRegistry registry;
    private final ObjectMapper objectMapper;
    private final ClawdProperties properties;
    private final Clock clock;

    public RateLimiter(KeyValueStore store,
                       RateLimitRegistry registry,
                       ObjectMapper objectMapper,
                       ClawdProperties properties,
                       Clock clock) {
        this.store = store;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Take one token if available, without waiting.
     */
    public Mono<Boolean> tryAcquire(String resource) {
        return tryAcquire(resource, 1);
    }

    /**
     * Take {@code tokens} tokens if available, without waiting.
     *
     * @return true if granted
     */
    public Mono<Boolean> tryAcquire(String resource, int tokens) {
        return consume(resource, tokens).map(AcquireResult::isGranted);
    }

    public Mono<Boolean> acquire(String resource, int tokens, Duration maxWait) {
        return acquire(resource, tokens, maxWait, CancellationSignal.none());
    }

    /**
     * Take {@code tokens} tokens, waiting up to {@code maxWait} for the bucket to refill.
     *
     * <p>On a denial the wait is {@code (tokens - available) / refillRate}. If that exceeds
     * {@code maxWait} the call returns false right away; otherwise it suspends for the wait and
     * checks once more. A cancelled wait fails with
     * {@link com.clawd.core.exception.CancelledException} and leaves the bucket untouched.</p>
     *
     * @return true if granted within {@code maxWait}
     */
    public Mono<Boolean> acquire(String resource, int tokens, Duration maxWait, CancellationSignal cancel) {
        if (maxWait == null || maxWait.isNegative()) {
            return Mono.error(new IllegalArgumentException("maxWait must not be negative (current: " + maxWait + ")"));
        }

        Mono<Boolean> attempt = consume(resource, tokens).flatMap(first -> {
            if (first.isGranted()) {
                return Mono.just(Boolean.TRUE);
            }
            Duration wait = first.getRetryAfter();
            if (wait.compareTo(maxWait) > 0) {
                log.debug("Rate limit wait {}ms for {} exceeds max wait {}ms, denying",
                        wait.toMillis(), resource, maxWait.toMillis());
                return Mono.just(Boolean.FALSE);
            }
            log.debug("Waiting {}ms for {} token(s) of {}", wait.toMillis(), tokens, resource);
            return Mono.delay(wait)
                    .then(consume(resource, tokens))
                    .map(AcquireResult::isGranted);
        });

        return cancel.guard(attempt, "rate limit acquire " + resource);
    }

    /**
     * Current bucket state without consuming anything.
     */
    public Mono<BucketSnapshot> inspect(String resource) {
        BucketSpec spec;
        try {
            spec = registry.get(resource);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }

        return readState(resource)
                .map(existing -> refill(spec, existing.map(Stored::getState).orElse(null)))
                .map(state -> BucketSnapshot.builder()
                        .resource(resource)
                        .capacity(spec.getCapacity())
                        .refillRate(spec.getRefillRate())
                        .availableTokens(state.getTokens())
                        .waitMillis(waitFor(spec, state.getTokens(), 1).toMillis())
                        .build());
    }

    /**
     * One atomic admission check.
     */
    Mono<AcquireResult> consume(String resource, int tokens) {
        BucketSpec spec;
        try {
            spec = registry.get(resource);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        if (tokens <= 0 || tokens > spec.getCapacity()) {
            return Mono.error(new IllegalArgumentException("tokens must be between 1 and " + spec.getCapacity()
                    + " for resource '" + resource + "' (current: " + tokens + ")"));
        }
        return consume(spec, tokens, 1);
    }

    private Mono<AcquireResult> consume(BucketSpec spec, int tokens, int casAttempt) {
        String resource = spec.getResource();

        return readState(resource).flatMap(existing -> {
            TokenBucketState current = refill(spec, existing.map(Stored::getState).orElse(null));

            if (current.getTokens() < tokens) {
                Duration retryAfter = waitFor(spec, current.getTokens(), tokens);
                log.debug("Denied {} token(s) for {} ({} available)", tokens, resource, current.getTokens());
                return Mono.just(AcquireResult.denied(current.getTokens(), retryAfter));
            }

            TokenBucketState updated = current.toBuilder()
                    .tokens(current.getTokens() - tokens)
                    .build();
            byte[] expected = existing.map(Stored::getRaw).orElse(null);

            return store.compareAndSet(buildKey(resource), expected, writeState(updated), stateTtl(spec))
                    .onErrorMap(StoreUnavailableException.class, e -> new LimiterUnavailableException(resource, e))
                    .flatMap(written -> {
                        if (written) {
                            log.debug("Granted {} token(s) for {} ({} left)", tokens, resource, updated.getTokens());
                            return Mono.just(AcquireResult.granted(updated.getTokens()));
                        }
                        if (casAttempt >= MAX_CAS_ATTEMPTS) {
                            return Mono.error(new LimiterUnavailableException(resource, new IllegalStateException(
                                    "bucket update lost " + casAttempt + " races in a row")));
                        }
                        return consume(spec, tokens, casAttempt + 1);
                    });
        });
    }

    private Mono<Optional<Stored>> readState(String resource) {
        return store.get(buildKey(resource))
                .map(raw -> Optional.of(new Stored(raw, parseState(resource, raw))))
                .defaultIfEmpty(Optional.empty())
                .onErrorMap(StoreUnavailableException.class, e -> new LimiterUnavailableException(resource, e));
    }

    /**
     * Lazily refill: {@code min(capacity, tokens + elapsed * refillRate)}. A missing bucket is full.
     *
     * <p>{@code lastRefillAt} never moves backwards. A process whose clock lags the one that last
     * wrote the bucket refills nothing and keeps the stored timestamp, so the same interval is
     * never credited twice.</p>
     */
    private TokenBucketState refill(BucketSpec spec, TokenBucketState state) {
        long now = clock.millis();
        if (state == null) {
            return TokenBucketState.builder().tokens(spec.getCapacity()).lastRefillAt(now).build();
        }
        long refilledAt = Math.max(now, state.getLastRefillAt());
        long elapsedMillis = refilledAt - state.getLastRefillAt();
        double refilled = state.getTokens() + (elapsedMillis / 1000.0) * spec.getRefillRate();
        double tokens = Math.max(0.0, Math.min(spec.getCapacity(), refilled));
        return TokenBucketState.builder().tokens(tokens).lastRefillAt(refilledAt).build();
    }

    private static Duration waitFor(BucketSpec spec, double available, int requested) {
        double missing = requested - available;
        if (missing <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) Math.ceil(missing / spec.getRefillRate() * 1000.0));
    }

    /**
     * An idle bucket refills completely within this time, after which the key can expire.
     */
    private static Duration stateTtl(BucketSpec spec) {
        long fullRefillMillis = (long) Math.ceil(spec.getCapacity() / spec.getRefillRate() * 1000.0);
        return Duration.ofMillis(fullRefillMillis + 1000L);
    }

    private TokenBucketState parseState(String resource, byte[] raw) {
        try {
            return objectMapper.readValue(raw, TokenBucketState.class);
        } catch (IOException e) {
            // a corrupt bucket is replaced by a full one on the next successful write
            log.warn("Unreadable bucket state for {}: {}", resource, e.getMessage());
            return null;
        }
    }

    private byte[] writeState(TokenBucketState state) {
        try {
            return objectMapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize bucket state", e);
        }
    }

    private String buildKey(String resource) {
        return properties.getStore().getKeyPrefix() + KEY_SEGMENT + resource;
    }

    @Value
    private static class Stored {
        byte[] raw;
        TokenBucketState state;
    }
}
