package com.redis.resilience.model;

/**
 * Kinds of connection lifecycle events published by the resilience manager.
 */
public enum ConnectionEventType {
    CONNECTED,
    CONNECTION_LOST,
    RECONNECT_FAILED,
    CIRCUIT_OPENED,
    CIRCUIT_HALF_OPEN,
    CIRCUIT_CLOSED
}
