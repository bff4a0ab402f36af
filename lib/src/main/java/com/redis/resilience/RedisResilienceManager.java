package com.redis.resilience;

import com.redis.resilience.config.RedisResilienceConfig;
import com.redis.resilience.model.ConnectionEvent;
import com.redis.resilience.model.ConnectionEventListener;
import com.redis.resilience.model.ResilienceStatus;
import com.redis.resilience.operations.RedisOperations;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for cache and session storage backed by one shared Redis connection.
 * <p>
 * The manager gates every call through a circuit breaker, restores the connection in the background
 * after it is lost and probes it periodically while it is idle. Operations never throw because Redis is
 * unavailable; see {@link RedisOperations}. Create one instance per process and share it.
 */
public interface RedisResilienceManager extends RedisOperations, AutoCloseable {

    /**
     * Opens the first connection and starts the background loops. A failed first attempt is left to the
     * reconnector. Calling it again is a no-op, and so is calling it on a disabled manager.
     *
     * @throws IllegalStateException if the manager has been shut down
     */
    void initialize();

    /**
     * Stops the background loops, waits for them to finish and releases the connection. Idempotent.
     */
    void shutdown();

    /**
     * @return whether Redis use is enabled by configuration; fixed for the lifetime of the manager
     */
    boolean isEnabled();

    // Session store
    boolean storeSession(String sessionId, Map<String, Object> data, long ttlSeconds);

    Optional<Map<String, Object>> getSession(String sessionId);

    boolean deleteSession(String sessionId);

    // User-scoped cache
    boolean setUserCache(String userId, String key, String value, Duration ttl);

    Optional<String> getUserCache(String userId, String key);

    boolean clearUserCache(String userId, String key);

    List<String> getUserKeys(String userId);

    // Recovery
    /**
     * Builds and verifies a new connection right away instead of waiting for the reconnect schedule.
     *
     * @return {@code true} if a new connection was installed
     */
    boolean forceReconnect();

    void resetCircuitBreaker();

    /**
     * Snapshot of the current state. Never blocks and never talks to Redis.
     */
    ResilienceStatus getStatus();

    RedisResilienceConfig getConfiguration();

    // Events
    /**
     * Hot stream of connection and circuit breaker events. Subscribers see only events emitted after they subscribe.
     */
    Flux<ConnectionEvent> connectionEvents();

    /**
     * @return Disposable to unsubscribe the listener
     */
    Disposable addConnectionListener(ConnectionEventListener listener);

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    void close();
}
