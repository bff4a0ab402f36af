package com.redis.resilience.model;

/**
 * Callback interface for connection lifecycle events.
 */
@FunctionalInterface
public interface ConnectionEventListener {
    /**
     * Called for every connection or circuit breaker event.
     *
     * @param event the event
     */
    void onEvent(ConnectionEvent event);
}
