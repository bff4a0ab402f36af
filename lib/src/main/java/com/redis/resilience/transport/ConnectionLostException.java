package com.redis.resilience.transport;

/**
 * Thrown by a transport when its connection is known to be unusable.
 */
public class ConnectionLostException extends RuntimeException {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
