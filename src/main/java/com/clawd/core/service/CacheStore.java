package com.clawd.core.service;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.config.ClawdProperties;
import com.clawd.core.model.CacheEntry;
import com.clawd.core.repository.KeyValueStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * TTL cache over the shared key/value store.
 *
 * <p>Key pattern: {@code {prefix}cache:{namespace}:{key}}. A read at or after an entry's
 * expiry is a miss. Concurrent misses on the same key may both compute; the first write wins
 * and each caller gets its own computed value. A failed or cancelled compute never writes.</p>
 */
@Slf4j
@Service
public class CacheStore {

    private static final String KEY_SEGMENT = "cache:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final ClawdProperties properties;
    private final Clock clock;

    public CacheStore(KeyValueStore store, ObjectMapper objectMapper, ClawdProperties properties, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Get a cached value, computing and storing it on a miss, with the namespace's default TTL.
     */
    public <T> Mono<T> getOrCompute(String namespace, String key, Class<T> type, Supplier<Mono<T>> compute) {
        return getOrCompute(namespace, key, ttlFor(namespace), type, compute);
    }

    public <T> Mono<T> getOrCompute(String namespace, String key, Duration ttl, Class<T> type,
                                    Supplier<Mono<T>> compute) {
        return getOrCompute(namespace, key, ttl, objectMapper.constructType(type), compute, CancellationSignal.none());
    }

    public <T> Mono<T> getOrCompute(String namespace, String key, Duration ttl, TypeReference<T> type,
                                    Supplier<Mono<T>> compute) {
        return getOrCompute(namespace, key, ttl, objectMapper.constructType(type), compute, CancellationSignal.none());
    }

    /**
     * Get a cached value or compute it.
     *
     * @param namespace groups related keys for invalidation
     * @param key       unique within the namespace
     * @param ttl       lifetime of a freshly computed value, must be positive
     * @param type      value type for deserialization
     * @param compute   produces the value on a miss; subscribed at most once per call
     * @param cancel    aborts the lookup or compute; nothing is written once it fires
     * @return the cached or freshly computed value; empty if compute completed empty
     */
    public <T> Mono<T> getOrCompute(String namespace, String key, Duration ttl, JavaType type,
                                    Supplier<Mono<T>> compute, CancellationSignal cancel) {
        requireValidTtl(ttl);
        String storeKey = buildKey(namespace, key);

        Mono<T> lookup = store.get(storeKey)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(raw -> {
                    Optional<CacheEntry> entry = raw.flatMap(bytes -> readEntry(storeKey, bytes));
                    Instant now = clock.instant();
                    if (entry.isPresent() && !entry.get().isExpired(now)) {
                        log.debug("Cache hit: {}", storeKey);
                        return Mono.just(this.<T>readValue(entry.get().getValue(), type));
                    }
                    log.debug("Cache miss: {}", storeKey);
                    return Mono.defer(compute)
                            .flatMap(value -> write(storeKey, raw.orElse(null), value, ttl).thenReturn(value));
                });

        return cancel.guard(lookup, "cache lookup " + storeKey);
    }

    /**
     * Remove one entry immediately.
     *
     * @return true if an entry was removed
     */
    public Mono<Boolean> invalidate(String namespace, String key) {
        String storeKey = buildKey(namespace, key);
        return store.delete(storeKey)
                .doOnNext(removed -> log.info("Invalidated cache entry {} (present={})", storeKey, removed));
    }

    /**
     * Remove every entry of a namespace.
     *
     * @return number of entries removed
     */
    public Mono<Long> invalidateNamespace(String namespace) {
        String prefix = namespacePrefix(namespace);
        return store.deleteByPrefix(prefix)
                .doOnNext(count -> log.info("Invalidated {} cache entries in namespace {}", count, namespace));
    }

    /**
     * Default TTL of a namespace, falling back to the global default.
     */
    public Duration ttlFor(String namespace) {
        Duration ttl = properties.getCache().getNamespaces().get(namespace);
        return ttl != null ? ttl : properties.getCache().getDefaultTtl();
    }

    private <T> Mono<Void> write(String storeKey, byte[] observed, T value, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .key(storeKey)
                .value(writeBytes(value))
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        return store.compareAndSet(storeKey, observed, writeBytes(entry), ttl)
                .doOnNext(written -> {
                    if (written) {
                        log.debug("Stored in cache: key={}, ttl={}", storeKey, ttl);
                    } else {
                        log.debug("Concurrent write won for {}, keeping the stored value", storeKey);
                    }
                })
                .then();
    }

    private Optional<CacheEntry> readEntry(String storeKey, byte[] bytes) {
        try {
            return Optional.of(objectMapper.readValue(bytes, CacheEntry.class));
        } catch (IOException e) {
            // unreadable entries are treated as misses and overwritten by the next compute
            log.warn("Discarding unreadable cache entry {}: {}", storeKey, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T readValue(byte[] bytes, JavaType type) {
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize cached value as " + type, e);
        }
    }

    private byte[] writeBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize value of " + value.getClass(), e);
        }
    }

    private String buildKey(String namespace, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
        return namespacePrefix(namespace) + key;
    }

    private String namespacePrefix(String namespace) {
        if (namespace == null || namespace.isEmpty() || namespace.contains("*")) {
            throw new IllegalArgumentException("Invalid cache namespace: " + namespace);
        }
        return properties.getStore().getKeyPrefix() + KEY_SEGMENT + namespace + ":";
    }

    private static void requireValidTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive (current: " + ttl + ")");
        }
    }
}
