package com.redis.resilience.cache;

/**
 * Thrown when session data cannot be written as JSON or the stored value is not a JSON object.
 * Indicates a malformed payload rather than an unavailable store.
 */
public class SessionSerializationException extends RuntimeException {

    public SessionSerializationException(String message) {
        super(message);
    }

    public SessionSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
