package com.clawd.core.config;

import com.clawd.core.model.ProviderTarget;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Clawd Core. Read once at startup; everything derived from
 * them is immutable for the lifetime of the process.
 */
@Data
@ConfigurationProperties(prefix = "clawd")
public class ClawdProperties {

    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();
    private Map<String, RateLimitConfig> rateLimits = new LinkedHashMap<>();
    private Map<String, ProviderConfig> providers = new HashMap<>();
    private Map<String, List<ProviderTarget>> tiers = new LinkedHashMap<>();

    public enum StoreType {
        REDIS,
        MEMORY
    }

    @Data
    public static class StoreConfig {
        private StoreType type = StoreType.REDIS;
        private String keyPrefix = "clawd:";
        private Duration commandTimeout = Duration.ofSeconds(5);
        private int maxLocalEntries = 100_000;
    }

    @Data
    public static class CacheConfig {
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Map<String, Duration> namespaces = new HashMap<>();
    }

    @Data
    public static class RateLimitConfig {
        private int capacity;
        private double refillRate;
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String region;
        private Duration timeout = Duration.ofSeconds(60);
        private String rateLimitResource;
        private Duration rateLimitWait = Duration.ofSeconds(2);
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 2;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(4);
        private double jitter = 0.2;
    }
}
