package com.redis.resilience.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only snapshot of a circuit breaker.
 */
public final class CircuitBreakerStatus {

    private final CircuitBreakerState state;
    private final int failureCount;

    public CircuitBreakerStatus(CircuitBreakerState state, int failureCount) {
        this.state = state;
        this.failureCount = failureCount;
    }

    public CircuitBreakerState getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("state", state.name());
        map.put("failureCount", failureCount);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CircuitBreakerStatus that = (CircuitBreakerStatus) o;
        return failureCount == that.failureCount && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, failureCount);
    }

    @Override
    public String toString() {
        return "CircuitBreakerStatus{state=" + state + ", failureCount=" + failureCount + '}';
    }
}
