package com.redis.resilience.monitor;

import com.redis.resilience.config.RedisResilienceConfig;
import com.redis.resilience.transport.RedisTransport;
import com.redis.resilience.transport.RedisTransportFactory;
import com.redis.resilience.transport.TransportHolder;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that restores the transport after a connection loss.
 * <p>
 * While a transport is installed each cycle is a no-op followed by the poll interval. When the slot is
 * empty the loop opens a fresh transport and pings it; failures back off exponentially from the floor
 * to the ceiling delay. Past {@code maxReconnectAttempts} the loop keeps trying at the ceiling delay
 * rather than giving up. The loop runs on its own single thread and observes cancellation between cycles.
 */
public class Reconnector {

    private static final Logger logger = LoggerFactory.getLogger(Reconnector.class);

    private final RedisResilienceConfig config;
    private final RedisTransportFactory transportFactory;
    private final TransportHolder holder;
    private final ReconnectListener listener;
    private final IntervalFunction backoff;
    private final ScheduledExecutorService scheduler;
    private final AtomicInteger failedAttempts = new AtomicInteger();
    private final AtomicBoolean wakeUpRequested = new AtomicBoolean();
    private volatile Duration currentRetryDelay;
    private volatile boolean running = false;
    private volatile boolean attemptLimitLogged = false;
    private ScheduledFuture<?> nextCycle;

    public Reconnector(RedisResilienceConfig config,
                       RedisTransportFactory transportFactory,
                       TransportHolder holder,
                       ReconnectListener listener) {
        this.config = config;
        this.transportFactory = transportFactory;
        this.holder = holder;
        this.listener = listener;
        this.backoff = IntervalFunction.ofExponentialBackoff(
            config.getBackoffFloor().toMillis(), 2.0, config.getBackoffCeiling().toMillis());
        this.currentRetryDelay = config.getBackoffFloor();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "redis-reconnector");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running || scheduler.isShutdown()) {
            return;
        }
        running = true;
        scheduleNext(Duration.ZERO);
        logger.info("Reconnector started with backoff {} .. {}", config.getBackoffFloor(), config.getBackoffCeiling());
    }

    /**
     * Cancels the loop and waits for a running cycle to finish.
     */
    public void stop() {
        synchronized (this) {
            running = false;
            if (nextCycle != null) {
                nextCycle.cancel(false);
                nextCycle = null;
            }
        }
        if (scheduler.isTerminated()) {
            return;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Reconnector stopped");
    }

    /**
     * Runs the next cycle immediately instead of waiting for the poll interval.
     */
    public void wakeUp() {
        if (running) {
            wakeUpRequested.set(true);
            scheduleNext(Duration.ZERO);
        }
    }

    public boolean isActive() {
        return running && !scheduler.isShutdown();
    }

    public Duration getCurrentRetryDelay() {
        return currentRetryDelay;
    }

    public int getFailedAttempts() {
        return failedAttempts.get();
    }

    /**
     * Returns the delay to its floor, after a reconnect that happened outside the loop.
     */
    public void resetBackoff() {
        failedAttempts.set(0);
        currentRetryDelay = config.getBackoffFloor();
        attemptLimitLogged = false;
    }

    void runCycle() {
        if (!running) {
            return;
        }
        wakeUpRequested.set(false);

        Duration delay;
        try {
            delay = holder.isPresent() ? config.getReconnectPollInterval() : attemptReconnect();
        } catch (RuntimeException e) {
            logger.error("Unexpected error in reconnect cycle", e);
            delay = currentRetryDelay;
        }

        if (running) {
            scheduleNext(wakeUpRequested.get() ? Duration.ZERO : delay);
        }
    }

    /**
     * Makes one attempt to open, verify and install a transport.
     *
     * @return the delay before the next cycle
     */
    Duration attemptReconnect() {
        RedisTransport fresh = null;
        try {
            fresh = transportFactory.create();
            String reply = fresh.ping();
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new IllegalStateException("Unexpected ping response: " + reply);
            }
        } catch (RuntimeException e) {
            if (fresh != null) {
                fresh.close();
            }
            return onAttemptFailed(e);
        }

        if (!holder.install(fresh)) {
            // a forced reconnect won the race
            fresh.close();
            return config.getReconnectPollInterval();
        }

        int previousFailures = failedAttempts.getAndSet(0);
        currentRetryDelay = config.getBackoffFloor();
        attemptLimitLogged = false;
        logger.info("Reconnected to Redis at {}:{} after {} failed attempt(s)",
            config.getHost(), config.getPort(), previousFailures);
        listener.onReconnected(fresh);
        return config.getReconnectPollInterval();
    }

    private Duration onAttemptFailed(RuntimeException error) {
        int failures = failedAttempts.incrementAndGet();
        int maxAttempts = config.getMaxReconnectAttempts();
        Duration delay;

        if (maxAttempts > 0 && failures > maxAttempts) {
            delay = config.getBackoffCeiling();
            if (!attemptLimitLogged) {
                attemptLimitLogged = true;
                logger.warn("Redis reconnect exceeded {} attempts; continuing every {} until the store returns",
                    maxAttempts, delay);
            }
        } else {
            delay = Duration.ofMillis(backoff.apply(Math.min(failures + 1, 64)));
            logger.warn("Redis reconnect attempt {} failed: {}; retrying in {}", failures, error.getMessage(), delay);
        }

        currentRetryDelay = delay;
        listener.onReconnectFailed(failures, delay, error);
        return delay;
    }

    private synchronized void scheduleNext(Duration delay) {
        if (!running || scheduler.isShutdown()) {
            return;
        }
        if (nextCycle != null) {
            nextCycle.cancel(false);
        }
        try {
            nextCycle = scheduler.schedule(this::runCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Reconnect cycle not scheduled, executor is shutting down");
        }
    }
}
