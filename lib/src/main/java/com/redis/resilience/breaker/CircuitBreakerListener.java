package com.redis.resilience.breaker;

import com.redis.resilience.model.CircuitBreakerState;

/**
 * Callback for circuit breaker state transitions.
 */
@FunctionalInterface
public interface CircuitBreakerListener {
    /**
     * Called after the breaker moved from one state to another. Invoked on the thread that caused the transition.
     */
    void onStateTransition(CircuitBreakerState from, CircuitBreakerState to);
}
