package com.redis.resilience.cache;

import com.redis.resilience.operations.RedisOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Per-user cache entries stored under {@code user:<userId>:<key>}. Users are isolated by key namespace
 * only; there is no locking beyond the store's own per-key atomicity.
 */
public class UserScopedCache {

    static final String KEY_PREFIX = "user:";

    private final RedisOperations operations;

    public UserScopedCache(RedisOperations operations) {
        this.operations = operations;
    }

    /**
     * @param ttl expiry of the entry, {@code null} for none
     */
    public boolean setUserCache(String userId, String key, String value, Duration ttl) {
        return operations.set(userKey(userId, key), value, ttl);
    }

    public Optional<String> getUserCache(String userId, String key) {
        return operations.get(userKey(userId, key));
    }

    public boolean clearUserCache(String userId, String key) {
        return operations.delete(userKey(userId, key)) > 0;
    }

    /**
     * Lists the cache keys of one user with the {@code user:<userId>:} namespace removed.
     */
    public List<String> getUserKeys(String userId) {
        String namespace = userNamespace(userId);
        List<String> keys = operations.keys(escapeGlob(namespace) + "*");
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> userKeys = new ArrayList<>(keys.size());
        for (String key : keys) {
            if (key.startsWith(namespace)) {
                userKeys.add(key.substring(namespace.length()));
            }
        }
        Collections.sort(userKeys);
        return userKeys;
    }

    static String userKey(String userId, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be blank");
        }
        return userNamespace(userId) + key;
    }

    private static String userNamespace(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id must not be blank");
        }
        return KEY_PREFIX + userId + ":";
    }

    // KEYS treats *, ?, [ and ] as pattern syntax
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
}
