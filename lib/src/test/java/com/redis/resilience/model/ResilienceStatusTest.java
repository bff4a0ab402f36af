package com.redis.resilience.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the status snapshot and its map view.
 */
class ResilienceStatusTest {

    @Test
    @SuppressWarnings("unchecked")
    void testToMap() {
        ResilienceStatus status = ResilienceStatus.builder()
            .enabled(true)
            .connected(true)
            .clientAvailable(true)
            .consecutiveFailures(2)
            .currentRetryDelay(Duration.ofMillis(1500))
            .maxReconnectAttempts(10)
            .lastHealthCheck(Instant.parse("2024-01-01T00:00:00Z"))
            .backgroundTasks(new BackgroundTaskStatus(true, false))
            .circuitBreaker(new CircuitBreakerStatus(CircuitBreakerState.HALF_OPEN, 1))
            .build();

        Map<String, Object> map = status.toMap();

        assertEquals(true, map.get("connected"));
        assertEquals(true, map.get("clientAvailable"));
        assertEquals(2, map.get("consecutiveFailures"));
        assertEquals(1.5, map.get("currentRetryDelay"));
        assertEquals(10, map.get("maxReconnectAttempts"));
        assertEquals("2024-01-01T00:00:00Z", map.get("lastHealthCheck"));
        assertEquals(Map.of("reconnectTaskActive", true, "healthMonitorActive", false), map.get("backgroundTasks"));
        Map<String, Object> breaker = (Map<String, Object>) map.get("circuitBreaker");
        assertEquals("HALF_OPEN", breaker.get("state"));
        assertEquals(1, breaker.get("failureCount"));
    }

    @Test
    void testLastHealthCheckMayBeAbsent() {
        ResilienceStatus status = ResilienceStatus.builder().build();

        assertTrue(status.toMap().containsKey("lastHealthCheck"));
        assertNull(status.toMap().get("lastHealthCheck"));
    }

    @Test
    void testAvailability() {
        assertTrue(ResilienceStatus.builder().clientAvailable(true).build().isAvailable());
        assertFalse(ResilienceStatus.builder().clientAvailable(false).build().isAvailable());
        assertFalse(ResilienceStatus.builder()
            .clientAvailable(true)
            .circuitBreaker(new CircuitBreakerStatus(CircuitBreakerState.OPEN, 5))
            .build()
            .isAvailable());
        assertFalse(ResilienceStatus.builder().enabled(false).clientAvailable(true).build().isAvailable());
    }
}
