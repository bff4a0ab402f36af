package com.redis.resilience.model;

/**
 * Circuit breaker state for the shared Redis connection.
 */
public enum CircuitBreakerState {

    /**
     * Circuit breaker is closed - operations are sent to Redis.
     */
    CLOSED,

    /**
     * Circuit breaker is open - operations short-circuit to their empty result until the recovery timeout elapses.
     */
    OPEN,

    /**
     * Circuit breaker is half-open - a single trial operation decides whether to close or reopen.
     */
    HALF_OPEN
}
