package com.clawd.core.service;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds cache keys from their parts.
 *
 * <p>Parts are joined with {@code ':'}. Keys longer than {@link #MAX_PLAIN_LENGTH} are replaced
 * by their SHA-256 hex digest so arbitrarily long inputs (URLs, query strings) stay bounded.</p>
 */
public final class CacheKeys {

    static final int MAX_PLAIN_LENGTH = 200;

    private CacheKeys() {
    }

    public static String of(Object... parts) {
        if (parts == null || parts.length == 0) {
            throw new IllegalArgumentException("A cache key needs at least one part");
        }
        String key = Arrays.stream(parts)
                .map(part -> Objects.toString(part, ""))
                .collect(Collectors.joining(":"));
        return key.length() > MAX_PLAIN_LENGTH ? DigestUtils.sha256Hex(key) : key;
    }
}
