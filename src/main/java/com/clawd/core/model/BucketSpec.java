package com.clawd.core.model;

import lombok.Value;

/**
 * Static capacity and refill rate of one named resource.
 */
@Value
public class BucketSpec {

    String resource;
    int capacity;

    /**
     * Tokens per second.
     */
    double refillRate;

    public BucketSpec(String resource, int capacity, double refillRate) {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                    "capacity must be positive for resource '" + resource + "' (current: " + capacity + ")");
        }
        if (refillRate <= 0.0) {
            throw new IllegalArgumentException(
                    "refillRate must be positive for resource '" + resource + "' (current: " + refillRate + ")");
        }
        this.resource = resource;
        this.capacity = capacity;
        this.refillRate = refillRate;
    }
}
