package com.redis.resilience.breaker;

import com.redis.resilience.config.CircuitBreakerConfig;
import com.redis.resilience.model.CircuitBreakerState;
import com.redis.resilience.model.CircuitBreakerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consecutive-failure circuit breaker guarding the shared Redis connection.
 * <p>
 * The breaker opens once {@code failureThreshold} failures are recorded without an intervening success.
 * After {@code recoveryTimeout} exactly one caller wins the move to {@link CircuitBreakerState#HALF_OPEN}
 * and performs the trial call; its outcome closes or reopens the breaker. All state changes are
 * compare-and-set on atomics, so {@link #canExecute()} never blocks and never performs I/O.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final long recoveryTimeoutMillis;
    private final Clock clock;
    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(CircuitBreakerState.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicLong openedAt = new AtomicLong();
    private final AtomicLong trialStartedAt = new AtomicLong();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.failureThreshold = config.getFailureThreshold();
        this.recoveryTimeoutMillis = config.getRecoveryTimeout().toMillis();
        this.clock = clock;
    }

    /**
     * Decides whether an operation may go to the transport.
     *
     * @return {@code true} when closed, or for the single caller that takes the half-open trial
     */
    public boolean canExecute() {
        long now = clock.millis();
        switch (state.get()) {
            case CLOSED:
                return true;
            case OPEN:
                if (now - openedAt.get() < recoveryTimeoutMillis) {
                    return false;
                }
                trialStartedAt.set(now);
                if (transition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN)) {
                    return true;
                }
                // another caller won the trial
                return false;
            case HALF_OPEN:
                // a trial whose outcome was never recorded is handed to the next caller
                long started = trialStartedAt.get();
                return now - started >= recoveryTimeoutMillis && trialStartedAt.compareAndSet(started, now);
            default:
                return false;
        }
    }

    public void recordSuccess() {
        failureCount.set(0);
        transition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
    }

    public void recordFailure() {
        int failures = failureCount.incrementAndGet();
        CircuitBreakerState current = state.get();
        if (current == CircuitBreakerState.HALF_OPEN) {
            openedAt.set(clock.millis());
            transition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN);
        } else if (current == CircuitBreakerState.CLOSED && failures >= failureThreshold) {
            openedAt.set(clock.millis());
            if (transition(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN)) {
                logger.warn("Circuit breaker {} opened after {} consecutive failures", name, failures);
            }
        }
    }

    /**
     * Forces the breaker closed with a zero failure count.
     */
    public void reset() {
        failureCount.set(0);
        CircuitBreakerState previous = state.getAndSet(CircuitBreakerState.CLOSED);
        logger.info("Circuit breaker {} has been reset", name);
        if (previous != CircuitBreakerState.CLOSED) {
            notifyListeners(previous, CircuitBreakerState.CLOSED);
        }
    }

    public CircuitBreakerStatus getStatus() {
        return new CircuitBreakerStatus(state.get(), failureCount.get());
    }

    public CircuitBreakerState getState() {
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public String getName() {
        return name;
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(listener);
    }

    private boolean transition(CircuitBreakerState from, CircuitBreakerState to) {
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        logger.info("Circuit breaker {} state transition: {} -> {}", name, from, to);
        notifyListeners(from, to);
        return true;
    }

    private void notifyListeners(CircuitBreakerState from, CircuitBreakerState to) {
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onStateTransition(from, to);
            } catch (RuntimeException e) {
                logger.warn("Circuit breaker {} listener failed on {} -> {}", name, from, to, e);
            }
        }
    }
}
