package com.clawd.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope stored for every cached value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    /**
     * Fully qualified key, namespace included.
     */
    private String key;

    /**
     * Serialized value, opaque to the store.
     */
    private byte[] value;

    private Instant createdAt;

    private Instant expiresAt;

    /**
     * An entry read at or after its expiry is a miss.
     */
    public boolean isExpired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
