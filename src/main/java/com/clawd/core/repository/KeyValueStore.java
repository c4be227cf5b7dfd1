package com.clawd.core.repository;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared, process-external key/value store holding cache entries and token bucket state.
 *
 * <p>All processes that use the core point at the same store; it is the single source of truth.
 * Implementations report connectivity problems as
 * {@link com.clawd.core.exception.StoreUnavailableException} and never fall back silently.</p>
 */
public interface KeyValueStore {

    /**
     * Read a value.
     *
     * @param key full key
     * @return the stored bytes, or empty when absent or expired
     */
    Mono<byte[]> get(String key);

    /**
     * Unconditionally write a value that expires after {@code ttl}.
     */
    Mono<Void> set(String key, byte[] value, Duration ttl);

    /**
     * Atomic conditional update: write {@code update} only if the current value equals
     * {@code expected} byte-for-byte. A {@code null} expectation means "only if absent".
     *
     * @return true if the write happened
     */
    Mono<Boolean> compareAndSet(String key, byte[] expected, byte[] update, Duration ttl);

    /**
     * @return true if a key was removed
     */
    Mono<Boolean> delete(String key);

    /**
     * Remove every key starting with {@code prefix}.
     *
     * @return number of keys removed
     */
    Mono<Long> deleteByPrefix(String prefix);

    /**
     * @return true when the store answers
     */
    Mono<Boolean> ping();

    /**
     * Short name of the backing technology, for health output.
     */
    String getType();
}
