package com.redis.resilience.model;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time status of the resilience manager, produced on demand for health and readiness endpoints.
 */
public class ResilienceStatus {

    private final boolean enabled;
    private final boolean connected;
    private final boolean clientAvailable;
    private final int consecutiveFailures;
    private final Duration currentRetryDelay;
    private final int maxReconnectAttempts;
    private final Instant lastHealthCheck;
    private final BackgroundTaskStatus backgroundTasks;
    private final CircuitBreakerStatus circuitBreaker;

    public ResilienceStatus(boolean enabled, boolean connected, boolean clientAvailable, int consecutiveFailures,
                            Duration currentRetryDelay, int maxReconnectAttempts, Instant lastHealthCheck,
                            BackgroundTaskStatus backgroundTasks, CircuitBreakerStatus circuitBreaker) {
        this.enabled = enabled;
        this.connected = connected;
        this.clientAvailable = clientAvailable;
        this.consecutiveFailures = consecutiveFailures;
        this.currentRetryDelay = currentRetryDelay;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.lastHealthCheck = lastHealthCheck;
        this.backgroundTasks = backgroundTasks;
        this.circuitBreaker = circuitBreaker;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isConnected() {
        return connected;
    }

    public boolean isClientAvailable() {
        return clientAvailable;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Duration getCurrentRetryDelay() {
        return currentRetryDelay;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    /**
     * Time of the most recent health probe, or {@code null} if none has run yet.
     */
    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    public BackgroundTaskStatus getBackgroundTasks() {
        return backgroundTasks;
    }

    public CircuitBreakerStatus getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Whether an operation issued now would be sent to Redis.
     */
    public boolean isAvailable() {
        return enabled && clientAvailable && circuitBreaker.getState() != CircuitBreakerState.OPEN;
    }

    /**
     * JSON-friendly view: nested maps of strings, numbers and booleans. The retry delay is expressed in
     * seconds and the last health check as an ISO-8601 string.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("enabled", enabled);
        map.put("connected", connected);
        map.put("clientAvailable", clientAvailable);
        map.put("consecutiveFailures", consecutiveFailures);
        map.put("currentRetryDelay", currentRetryDelay.toMillis() / 1000.0);
        map.put("maxReconnectAttempts", maxReconnectAttempts);
        map.put("lastHealthCheck", lastHealthCheck != null ? lastHealthCheck.toString() : null);
        map.put("backgroundTasks", backgroundTasks.toMap());
        map.put("circuitBreaker", circuitBreaker.toMap());
        return map;
    }

    @Override
    public String toString() {
        return String.format("ResilienceStatus{enabled=%s, connected=%s, clientAvailable=%s, consecutiveFailures=%d, "
                + "currentRetryDelay=%s, lastHealthCheck=%s, %s, %s}",
            enabled, connected, clientAvailable, consecutiveFailures, currentRetryDelay, lastHealthCheck,
            backgroundTasks, circuitBreaker);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private boolean connected = false;
        private boolean clientAvailable = false;
        private int consecutiveFailures = 0;
        private Duration currentRetryDelay = Duration.ZERO;
        private int maxReconnectAttempts = 0;
        private Instant lastHealthCheck;
        private BackgroundTaskStatus backgroundTasks = new BackgroundTaskStatus(false, false);
        private CircuitBreakerStatus circuitBreaker = new CircuitBreakerStatus(CircuitBreakerState.CLOSED, 0);

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder connected(boolean connected) {
            this.connected = connected;
            return this;
        }

        public Builder clientAvailable(boolean clientAvailable) {
            this.clientAvailable = clientAvailable;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder currentRetryDelay(Duration currentRetryDelay) {
            this.currentRetryDelay = currentRetryDelay;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder lastHealthCheck(Instant lastHealthCheck) {
            this.lastHealthCheck = lastHealthCheck;
            return this;
        }

        public Builder backgroundTasks(BackgroundTaskStatus backgroundTasks) {
            this.backgroundTasks = backgroundTasks;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerStatus circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public ResilienceStatus build() {
            return new ResilienceStatus(enabled, connected, clientAvailable, consecutiveFailures,
                currentRetryDelay, maxReconnectAttempts, lastHealthCheck, backgroundTasks, circuitBreaker);
        }
    }
}
