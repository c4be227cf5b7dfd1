package com.clawd.core.repository;

import com.clawd.core.config.ClawdProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed store for a single process (local development, tests).
 *
 * <p>Entries carry their own deadline and Caffeine expires each one individually. The ticker is
 * driven by the injected {@link Clock}, so expiry follows the same time source as the
 * services. Compare-and-set uses the map's atomic {@code compute}.</p>
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "clawd.store", name = "type", havingValue = "memory")
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Cache<String, StoredValue> cache;
    private final Clock clock;

    @Autowired
    public InMemoryKeyValueStore(ClawdProperties properties, Clock clock) {
        this(properties.getStore().getMaxLocalEntries(), clock);
    }

    public InMemoryKeyValueStore(long maxEntries, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(clockTicker(clock))
                .expireAfter(new DeadlineExpiry())
                .build();
        log.info("Configured in-memory key/value store (max {} entries)", maxEntries);
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromSupplier(() -> {
            StoredValue stored = cache.getIfPresent(key);
            return isLive(stored) ? stored.getBytes() : null;
        });
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        return Mono.fromRunnable(() -> cache.put(key, new StoredValue(value.clone(), deadline(ttl))));
    }

    @Override
    public Mono<Boolean> compareAndSet(String key, byte[] expected, byte[] update, Duration ttl) {
        return Mono.fromSupplier(() -> {
            boolean[] written = new boolean[1];
            cache.asMap().compute(key, (k, current) -> {
                byte[] currentBytes = isLive(current) ? current.getBytes() : null;
                boolean matches = expected == null
                        ? currentBytes == null
                        : currentBytes != null && Arrays.equals(currentBytes, expected);
                if (!matches) {
                    return current;
                }
                written[0] = true;
                return new StoredValue(update.clone(), deadline(ttl));
            });
            return written[0];
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromSupplier(() -> isLive(cache.asMap().remove(key)));
    }

    @Override
    public Mono<Long> deleteByPrefix(String prefix) {
        return Mono.fromSupplier(() -> {
            List<String> keys = cache.asMap().keySet().stream()
                    .filter(k -> k.startsWith(prefix))
                    .toList();
            cache.invalidateAll(keys);
            return (long) keys.size();
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(Boolean.TRUE);
    }

    @Override
    public String getType() {
        return "memory";
    }

    private boolean isLive(StoredValue stored) {
        return stored != null && clock.millis() < stored.getExpiresAtMillis();
    }

    private long deadline(Duration ttl) {
        return clock.millis() + Math.max(1L, ttl.toMillis());
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    @Value
    private static class StoredValue {
        byte[] bytes;
        long expiresAtMillis;
    }

    private static final class DeadlineExpiry implements Expiry<String, StoredValue> {

        @Override
        public long expireAfterCreate(String key, StoredValue value, long currentTime) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long remaining(StoredValue value, long currentTime) {
            return Math.max(0L, TimeUnit.MILLISECONDS.toNanos(value.getExpiresAtMillis()) - currentTime);
        }
    }
}
