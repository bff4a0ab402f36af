package com.redis.resilience.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redis.resilience.operations.RedisOperations;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores session data as JSON objects under {@code session:<sessionId>}.
 */
public class SessionStore {

    static final String KEY_PREFIX = "session:";

    private static final TypeReference<Map<String, Object>> SESSION_TYPE = new TypeReference<>() {
    };

    private final RedisOperations operations;
    private final ObjectMapper objectMapper;

    public SessionStore(RedisOperations operations) {
        this(operations, new ObjectMapper());
    }

    public SessionStore(RedisOperations operations, ObjectMapper objectMapper) {
        this.operations = operations;
        this.objectMapper = objectMapper;
    }

    /**
     * @param ttlSeconds expiry in seconds; zero or negative stores the session without expiry
     * @throws SessionSerializationException if {@code data} cannot be written as JSON
     */
    public boolean storeSession(String sessionId, Map<String, Object> data, long ttlSeconds) {
        String key = sessionKey(sessionId);
        String payload = encode(data);
        Duration ttl = ttlSeconds > 0 ? Duration.ofSeconds(ttlSeconds) : null;
        return operations.set(key, payload, ttl);
    }

    /**
     * @return the session data, empty if it does not exist or Redis is unavailable
     * @throws SessionSerializationException if the stored value is not a JSON object
     */
    public Optional<Map<String, Object>> getSession(String sessionId) {
        return operations.get(sessionKey(sessionId)).map(payload -> decode(sessionId, payload));
    }

    public boolean deleteSession(String sessionId) {
        return operations.delete(sessionKey(sessionId)) > 0;
    }

    static String sessionKey(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        return KEY_PREFIX + sessionId;
    }

    private String encode(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data != null ? data : Map.of());
        } catch (JsonProcessingException e) {
            throw new SessionSerializationException("Failed to encode session payload", e);
        }
    }

    private Map<String, Object> decode(String sessionId, String payload) {
        Map<String, Object> decoded;
        try {
            decoded = objectMapper.readValue(payload, SESSION_TYPE);
        } catch (JsonProcessingException e) {
            throw new SessionSerializationException("Session " + sessionId + " is not a JSON object", e);
        }
        if (decoded == null) {
            throw new SessionSerializationException("Session " + sessionId + " is not a JSON object");
        }
        return new LinkedHashMap<>(decoded);
    }
}
