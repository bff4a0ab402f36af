package com.redis.resilience.config;

import java.util.Locale;

/**
 * How the application expects to reach Redis.
 */
public enum RedisMode {

    /**
     * Redis is switched off; every operation degrades to its empty result.
     */
    DISABLED,

    /**
     * A Redis instance started for this process alone (local development).
     */
    STANDALONE,

    /**
     * A Redis instance shared with other services.
     */
    SHARED;

    /**
     * Parses a mode name case-insensitively. {@code local} is accepted as an alias of
     * {@link #STANDALONE}.
     */
    public static RedisMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return SHARED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("LOCAL".equals(normalized)) {
            return STANDALONE;
        }
        try {
            return RedisMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown Redis mode: " + value, e);
        }
    }
}
