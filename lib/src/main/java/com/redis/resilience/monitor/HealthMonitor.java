package com.redis.resilience.monitor;

import com.redis.resilience.config.RedisResilienceConfig;
import com.redis.resilience.transport.RedisTransport;
import com.redis.resilience.transport.TransportHolder;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Periodically pings the current transport so that a silently dead connection is noticed even when no
 * application traffic flows. Each probe is bounded by the health check timeout, which is always shorter
 * than the interval, so probes never overlap.
 */
public class HealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    private final RedisResilienceConfig config;
    private final TransportHolder holder;
    private final HealthCheckListener listener;
    private final Clock clock;
    private final TimeLimiter timeLimiter;
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private volatile Instant lastHealthCheck;
    private ScheduledFuture<?> healthCheckTask;

    public HealthMonitor(RedisResilienceConfig config, TransportHolder holder, HealthCheckListener listener) {
        this(config, holder, listener, Clock.systemUTC());
    }

    public HealthMonitor(RedisResilienceConfig config, TransportHolder holder, HealthCheckListener listener, Clock clock) {
        this.config = config;
        this.holder = holder;
        this.listener = listener;
        this.clock = clock;
        this.timeLimiter = TimeLimiter.of("redis-health-check", TimeLimiterConfig.custom()
            .timeoutDuration(config.getHealthCheckTimeout())
            .cancelRunningFuture(true)
            .build());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "redis-health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running || scheduler.isShutdown()) {
            return;
        }

        running = true;
        Duration interval = config.getHealthCheckInterval();

        healthCheckTask = scheduler.scheduleWithFixedDelay(
            this::performHealthCheck,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        logger.info("Health monitor started with interval: {}, timeout: {}", interval, config.getHealthCheckTimeout());
    }

    /**
     * Cancels the loop and waits for an in-flight probe to finish.
     */
    public void stop() {
        synchronized (this) {
            running = false;
            if (healthCheckTask != null) {
                healthCheckTask.cancel(false);
                healthCheckTask = null;
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

        logger.info("Health monitor stopped");
    }

    public boolean isActive() {
        return running && !scheduler.isShutdown();
    }

    /**
     * @return time of the most recent probe, or {@code null} before the first one
     */
    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    private void performHealthCheck() {
        if (!running) {
            return;
        }
        try {
            checkNow();
        } catch (RuntimeException e) {
            logger.error("Error during health check", e);
        }
    }

    /**
     * Probes the current transport on the calling thread.
     *
     * @return {@code true} if the transport answered PONG in time; {@code false} if it failed or none is installed
     */
    public boolean checkNow() {
        RedisTransport transport = holder.get();
        if (transport == null) {
            logger.debug("Health check skipped, no transport installed");
            return false;
        }

        long startTime = System.currentTimeMillis();
        Throwable failure = null;

        try {
            String result = timeLimiter.executeFutureSupplier(() -> transport.pingAsync().toCompletableFuture());
            if (!"PONG".equalsIgnoreCase(result)) {
                failure = new IllegalStateException("Unexpected ping response: " + result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException e) {
            failure = e;
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        } catch (Exception e) {
            failure = e;
        }

        lastHealthCheck = clock.instant();
        long latency = System.currentTimeMillis() - startTime;

        if (failure == null) {
            logger.debug("Health check passed, latency={}ms", latency);
            listener.onHealthCheckPassed(transport);
            return true;
        }

        logger.warn("Health check failed after {}ms: {}", latency, failure.toString());
        listener.onHealthCheckFailed(transport, failure);
        return false;
    }
}
