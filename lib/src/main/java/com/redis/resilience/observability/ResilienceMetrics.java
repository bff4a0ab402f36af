package com.redis.resilience.observability;

import com.redis.resilience.model.CircuitBreakerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects metrics for Redis operations, reconnects and circuit breaker transitions.
 */
public class ResilienceMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceMetrics.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_REJECTED = "rejected";

    private final MeterRegistry meterRegistry;
    private final Timer operationLatency;
    private final AtomicLong connected;
    private final AtomicLong consecutiveFailures;

    public ResilienceMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ResilienceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.connected = new AtomicLong(0);
        this.consecutiveFailures = new AtomicLong(0);

        this.operationLatency = Timer.builder("redis.resilience.operation.latency")
            .description("Latency of Redis operations that reached the transport")
            .register(meterRegistry);

        Gauge.builder("redis.resilience.connected", connected, AtomicLong::doubleValue)
            .description("1 while a transport is installed, 0 otherwise")
            .register(meterRegistry);

        Gauge.builder("redis.resilience.consecutive.failures", consecutiveFailures, AtomicLong::doubleValue)
            .description("Transport failures since the last success")
            .register(meterRegistry);

        logger.debug("Resilience metrics registered with {}", meterRegistry.getClass().getSimpleName());
    }

    /**
     * Records an operation that reached the transport.
     */
    public void recordOperation(String operation, Duration latency, boolean success) {
        operationCounter(operation, success ? OUTCOME_SUCCESS : OUTCOME_FAILURE).increment();
        operationLatency.record(latency);
    }

    /**
     * Records an operation that short-circuited: disabled, no transport, or breaker open.
     */
    public void recordRejected(String operation) {
        operationCounter(operation, OUTCOME_REJECTED).increment();
    }

    public void recordReconnectAttempt(boolean success) {
        Counter.builder("redis.resilience.reconnect.attempts")
            .tag("outcome", success ? OUTCOME_SUCCESS : OUTCOME_FAILURE)
            .description("Reconnect attempts")
            .register(meterRegistry)
            .increment();
    }

    public void recordCircuitTransition(CircuitBreakerState to) {
        Counter.builder("redis.resilience.circuit.transitions")
            .tag("to", to.name())
            .description("Circuit breaker state transitions")
            .register(meterRegistry)
            .increment();
    }

    public void updateConnected(boolean isConnected) {
        connected.set(isConnected ? 1 : 0);
    }

    public void updateConsecutiveFailures(int failures) {
        consecutiveFailures.set(failures);
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private Counter operationCounter(String operation, String outcome) {
        return Counter.builder("redis.resilience.operations.total")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .description("Redis operations by outcome")
            .register(meterRegistry);
    }
}
