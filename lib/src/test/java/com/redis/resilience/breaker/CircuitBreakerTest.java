package com.redis.resilience.breaker;

import com.redis.resilience.config.CircuitBreakerConfig;
import com.redis.resilience.model.CircuitBreakerState;
import com.redis.resilience.model.CircuitBreakerStatus;
import com.redis.resilience.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the consecutive-failure CircuitBreaker.
 */
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;
    private List<String> transitions;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        circuitBreaker = new CircuitBreaker("test", CircuitBreakerConfig.builder()
            .failureThreshold(3)
            .recoveryTimeout(Duration.ofSeconds(5))
            .build(), clock);
        transitions = new ArrayList<>();
        circuitBreaker.addListener((from, to) -> transitions.add(from + "->" + to));
    }

    @Test
    void testStartsClosed() {
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
        assertEquals(0, circuitBreaker.getFailureCount());
        assertTrue(circuitBreaker.canExecute());
    }

    @Test
    void testOpensAtThreshold() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
        assertTrue(circuitBreaker.canExecute());

        circuitBreaker.recordFailure();

        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());
        assertFalse(circuitBreaker.canExecute());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void testSuccessResetsFailureCount() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordSuccess();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();

        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
        assertEquals(2, circuitBreaker.getFailureCount());
    }

    @Test
    void testStaysOpenUntilRecoveryTimeout() {
        openBreaker();

        clock.advance(Duration.ofMillis(4999));
        assertFalse(circuitBreaker.canExecute());
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());

        clock.advance(Duration.ofMillis(1));
        assertTrue(circuitBreaker.canExecute());
        assertEquals(CircuitBreakerState.HALF_OPEN, circuitBreaker.getState());
    }

    @Test
    void testThreeFailuresThenRecoveryAfterFiveSeconds() {
        for (int i = 0; i < 3; i++) {
            circuitBreaker.recordFailure();
        }
        assertFalse(circuitBreaker.canExecute());

        clock.advance(Duration.ofSeconds(5));

        assertTrue(circuitBreaker.canExecute());
        circuitBreaker.recordSuccess();
        assertEquals(new CircuitBreakerStatus(CircuitBreakerState.CLOSED, 0), circuitBreaker.getStatus());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void testHalfOpenAllowsSingleTrial() {
        openBreaker();
        clock.advance(Duration.ofSeconds(5));

        assertTrue(circuitBreaker.canExecute());
        assertFalse(circuitBreaker.canExecute());
        assertFalse(circuitBreaker.canExecute());
    }

    @Test
    void testFailureInHalfOpenReopensImmediately() {
        openBreaker();
        clock.advance(Duration.ofSeconds(5));
        assertTrue(circuitBreaker.canExecute());

        circuitBreaker.recordFailure();

        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());
        assertFalse(circuitBreaker.canExecute());

        // the recovery timeout restarts from the reopening
        clock.advance(Duration.ofSeconds(4));
        assertFalse(circuitBreaker.canExecute());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(circuitBreaker.canExecute());
    }

    @Test
    void testAbandonedTrialIsGrantedAgainAfterTimeout() {
        openBreaker();
        clock.advance(Duration.ofSeconds(5));
        assertTrue(circuitBreaker.canExecute());

        clock.advance(Duration.ofSeconds(2));
        assertFalse(circuitBreaker.canExecute());

        clock.advance(Duration.ofSeconds(3));
        assertTrue(circuitBreaker.canExecute());
        assertFalse(circuitBreaker.canExecute());
    }

    @Test
    void testFailureWhileOpenDoesNotExtendTimeout() {
        openBreaker();
        clock.advance(Duration.ofSeconds(3));
        circuitBreaker.recordFailure();
        clock.advance(Duration.ofSeconds(2));

        assertTrue(circuitBreaker.canExecute());
    }

    @Test
    void testOnlyOneConcurrentCallerWinsTrial() throws Exception {
        openBreaker();
        clock.advance(Duration.ofSeconds(5));

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    if (circuitBreaker.canExecute()) {
                        granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, granted.get());
        assertEquals(CircuitBreakerState.HALF_OPEN, circuitBreaker.getState());
    }

    @Test
    void testReset() {
        openBreaker();

        circuitBreaker.reset();

        assertEquals(new CircuitBreakerStatus(CircuitBreakerState.CLOSED, 0), circuitBreaker.getStatus());
        assertTrue(circuitBreaker.canExecute());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->CLOSED"), transitions);
    }

    @Test
    void testResetWhenClosedDoesNotNotify() {
        circuitBreaker.recordFailure();
        circuitBreaker.reset();

        assertEquals(0, circuitBreaker.getFailureCount());
        assertTrue(transitions.isEmpty());
    }

    @Test
    void testFailingListenerDoesNotBreakTransition() {
        circuitBreaker.addListener((from, to) -> {
            throw new IllegalStateException("listener failure");
        });

        openBreaker();

        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    private void openBreaker() {
        for (int i = 0; i < 3; i++) {
            circuitBreaker.recordFailure();
        }
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());
    }
}
