package com.redis.resilience.model;

import java.time.Instant;

/**
 * A change in the state of the shared Redis connection.
 */
public class ConnectionEvent {

    private final ConnectionEventType type;
    private final Instant timestamp;
    private final String detail;

    public ConnectionEvent(ConnectionEventType type, Instant timestamp, String detail) {
        this.type = type;
        this.timestamp = timestamp;
        this.detail = detail;
    }

    public ConnectionEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Human readable context, for example the error that caused a connection loss. May be {@code null}.
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return String.format("ConnectionEvent{type=%s, timestamp=%s, detail=%s}", type, timestamp, detail);
    }
}
