package com.clawd.core.repository;

import com.clawd.core.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Redis-backed key/value store.
 *
 * <p>Compare-and-set runs as a Lua script so the read, comparison and write happen in one
 * server-side step. Blocking template calls are shifted onto the bounded elastic scheduler.</p>
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "clawd.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisKeyValueStore implements KeyValueStore {

    private static final byte[] EXPECT_ABSENT = "1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] EXPECT_VALUE = "0".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NO_VALUE = new byte[0];
    private static final long SCAN_BATCH_SIZE = 500;

    // ARGV: 1 = expect-absent flag, 2 = expected value, 3 = new value, 4 = ttl millis
    private static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1])\n" +
            "if ARGV[1] == '1' then\n" +
            "  if current then return 0 end\n" +
            "elseif current ~= ARGV[2] then\n" +
            "  return 0\n" +
            "end\n" +
            "redis.call('SET', KEYS[1], ARGV[3], 'PX', ARGV[4])\n" +
            "return 1",
            Long.class);

    private final RedisTemplate<String, byte[]> redisTemplate;

    public RedisKeyValueStore(RedisTemplate<String, byte[]> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return call("GET " + key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        return call("SET " + key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Boolean> compareAndSet(String key, byte[] expected, byte[] update, Duration ttl) {
        byte[] ttlMillis = String.valueOf(Math.max(1L, ttl.toMillis())).getBytes(StandardCharsets.UTF_8);
        return call("CAS " + key, () -> {
            Long result = redisTemplate.execute(
                    COMPARE_AND_SET,
                    List.of(key),
                    expected == null ? EXPECT_ABSENT : EXPECT_VALUE,
                    expected == null ? NO_VALUE : expected,
                    update,
                    ttlMillis);
            return result != null && result == 1L;
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return call("DEL " + key, () -> Boolean.TRUE.equals(redisTemplate.delete(key)));
    }

    /**
     * Walks the keyspace with {@code SCAN MATCH}, not {@code KEYS}. Glob metacharacters in the
     * prefix are escaped so it matches literally, like a plain {@code startsWith}.
     */
    @Override
    public Mono<Long> deleteByPrefix(String prefix) {
        String pattern = escapeGlob(prefix) + "*";
        return call("SCAN MATCH " + pattern, () -> {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                while (cursor.hasNext()) {
                    String key = cursor.next();
                    if (key.startsWith(prefix)) {
                        keys.add(key);
                    }
                }
            }
            if (keys.isEmpty()) {
                return 0L;
            }
            Long deleted = redisTemplate.delete(keys);
            log.info("Deleted {} keys with prefix {}", deleted, prefix);
            return deleted != null ? deleted : 0L;
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return call("PING", () -> {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        });
    }

    @Override
    public String getType() {
        return "redis";
    }

    static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private <T> Mono<T> call(String operation, Callable<T> command) {
        return Mono.fromCallable(command)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(DataAccessException.class, e -> {
                    log.warn("Redis command failed: {} ({})", operation, e.getMessage());
                    return new StoreUnavailableException("Redis command failed: " + operation, e);
                });
    }
}
