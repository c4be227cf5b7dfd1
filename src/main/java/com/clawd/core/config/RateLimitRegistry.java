package com.clawd.core.config;

import com.clawd.core.model.BucketSpec;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable capacity/refill configuration of every rate-limited resource.
 */
public final class RateLimitRegistry {

    private final Map<String, BucketSpec> specs;

    public RateLimitRegistry(Collection<BucketSpec> specs) {
        this.specs = specs.stream()
                .collect(Collectors.toUnmodifiableMap(BucketSpec::getResource, Function.identity()));
    }

    /**
     * @throws IllegalArgumentException if the resource was never configured
     */
    public BucketSpec get(String resource) {
        BucketSpec spec = specs.get(resource);
        if (spec == null) {
            throw new IllegalArgumentException("No rate limit configured for resource: " + resource);
        }
        return spec;
    }

    public boolean contains(String resource) {
        return specs.containsKey(resource);
    }

    public Collection<BucketSpec> all() {
        return specs.values();
    }
}
