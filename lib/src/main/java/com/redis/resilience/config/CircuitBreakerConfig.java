package com.redis.resilience.config;

import java.time.Duration;

/**
 * Circuit breaker configuration for the shared Redis connection.
 */
public class CircuitBreakerConfig {

    private final int failureThreshold;
    private final Duration recoveryTimeout;

    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
    }

    /**
     * Number of consecutive failures that opens the breaker.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * Time the breaker stays open before a single trial call is allowed.
     */
    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{failureThreshold=%d, recoveryTimeout=%s}",
            failureThreshold, recoveryTimeout);
    }

    public static class Builder {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);

        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }

        public Builder recoveryTimeout(Duration timeout) {
            this.recoveryTimeout = timeout;
            return this;
        }

        public CircuitBreakerConfig build() {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be at least 1, got " + failureThreshold);
            }
            if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
                throw new IllegalArgumentException("recoveryTimeout must be a non-negative duration");
            }
            return new CircuitBreakerConfig(this);
        }
    }
}
