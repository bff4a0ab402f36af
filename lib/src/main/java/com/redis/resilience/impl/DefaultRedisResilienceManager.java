package com.redis.resilience.impl;

import com.redis.resilience.RedisResilienceManager;
import com.redis.resilience.breaker.CircuitBreaker;
import com.redis.resilience.breaker.CircuitBreakerListener;
import com.redis.resilience.cache.SessionStore;
import com.redis.resilience.cache.UserScopedCache;
import com.redis.resilience.config.RedisResilienceConfig;
import com.redis.resilience.model.BackgroundTaskStatus;
import com.redis.resilience.model.CircuitBreakerState;
import com.redis.resilience.model.ConnectionEvent;
import com.redis.resilience.model.ConnectionEventListener;
import com.redis.resilience.model.ConnectionEventType;
import com.redis.resilience.model.FailureKind;
import com.redis.resilience.model.ResilienceStatus;
import com.redis.resilience.monitor.HealthCheckListener;
import com.redis.resilience.monitor.HealthMonitor;
import com.redis.resilience.monitor.ReconnectListener;
import com.redis.resilience.monitor.Reconnector;
import com.redis.resilience.observability.ConnectionEventPublisher;
import com.redis.resilience.observability.ResilienceMetrics;
import com.redis.resilience.transport.LettuceTransportFactory;
import com.redis.resilience.transport.RedisTransport;
import com.redis.resilience.transport.RedisTransportFactory;
import com.redis.resilience.transport.TransportErrorClassifier;
import com.redis.resilience.transport.TransportHolder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Default implementation of the resilience manager.
 * <p>
 * Every operation follows the same path through {@link #execute}: short-circuit if disabled, shut down,
 * without a transport or denied by the breaker; otherwise call the captured transport and record the
 * outcome. Connection-lost failures remove the captured transport from the slot and wake the reconnector.
 */
public class DefaultRedisResilienceManager implements RedisResilienceManager {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRedisResilienceManager.class);

    private final RedisResilienceConfig configuration;
    private final boolean enabled;
    private final RedisTransportFactory transportFactory;
    private final TransportHolder holder;
    private final CircuitBreaker circuitBreaker;
    private final TransportErrorClassifier errorClassifier;
    private final ResilienceMetrics metrics;
    private final ConnectionEventPublisher eventPublisher;
    private final Reconnector reconnector;
    private final HealthMonitor healthMonitor;
    private final SessionStore sessionStore;
    private final UserScopedCache userCache;
    private final Set<RedisTransport> retiring = ConcurrentHashMap.newKeySet();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public DefaultRedisResilienceManager(RedisResilienceConfig configuration) {
        this(configuration, new LettuceTransportFactory(configuration), new SimpleMeterRegistry(), Clock.systemUTC());
    }

    public DefaultRedisResilienceManager(RedisResilienceConfig configuration,
                                         RedisTransportFactory transportFactory,
                                         MeterRegistry meterRegistry,
                                         Clock clock) {
        this.configuration = configuration;
        this.enabled = configuration.isEnabled();
        this.transportFactory = transportFactory;
        this.holder = new TransportHolder();
        this.errorClassifier = new TransportErrorClassifier();
        this.metrics = new ResilienceMetrics(meterRegistry);
        this.eventPublisher = new ConnectionEventPublisher(clock);
        this.circuitBreaker = new CircuitBreaker("redis", configuration.getCircuitBreakerConfig(), clock);
        this.circuitBreaker.addListener(new BreakerEventBridge());
        this.reconnector = new Reconnector(configuration, transportFactory, holder, new ReconnectHandler());
        this.healthMonitor = new HealthMonitor(configuration, holder, new HealthCheckHandler(), clock);
        this.sessionStore = new SessionStore(this);
        this.userCache = new UserScopedCache(this);

        logger.info("Redis resilience manager created (enabled={}, mode={}, environment={})",
            enabled, configuration.getMode(), configuration.getEnvironment());
    }

    // Lifecycle

    @Override
    public void initialize() {
        if (shutdown.get()) {
            throw new IllegalStateException("Redis resilience manager has been shut down");
        }
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        if (!enabled) {
            logger.info("Redis is disabled by configuration; operations will return empty results");
            return;
        }

        if (!holder.isPresent()) {
            connectInitial();
        }
        reconnector.start();
        healthMonitor.start();
        logger.info("Redis resilience manager initialized (connected={})", holder.isPresent());
    }

    private void connectInitial() {
        RedisTransport fresh = null;
        try {
            fresh = transportFactory.create();
            String reply = fresh.ping();
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new IllegalStateException("Unexpected ping response: " + reply);
            }
        } catch (RuntimeException e) {
            closeQuietly(fresh);
            logger.warn("Initial Redis connection to {}:{} failed, the reconnector will retry: {}",
                configuration.getHost(), configuration.getPort(), e.getMessage());
            return;
        }

        if (holder.install(fresh)) {
            onConnected("initial connection");
        } else {
            closeQuietly(fresh);
        }
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down Redis resilience manager...");

        reconnector.stop();
        healthMonitor.stop();

        closeQuietly(holder.clear());
        for (RedisTransport transport : retiring) {
            if (retiring.remove(transport)) {
                closeQuietly(transport);
            }
        }
        connected.set(false);
        metrics.updateConnected(false);

        try {
            transportFactory.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing Redis transport factory", e);
        }
        eventPublisher.close();

        logger.info("Redis resilience manager shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public RedisResilienceConfig getConfiguration() {
        return configuration;
    }

    // String operations

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute("GET", null, transport -> transport.get(key)));
    }

    @Override
    public boolean set(String key, String value) {
        return execute("SET", false, transport -> "OK".equalsIgnoreCase(transport.set(key, value)));
    }

    @Override
    public boolean set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return set(key, value);
        }
        long seconds = toSeconds(ttl);
        return execute("SETEX", false, transport -> "OK".equalsIgnoreCase(transport.setex(key, seconds, value)));
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0L;
        }
        return execute("DEL", 0L, transport -> transport.del(keys));
    }

    @Override
    public boolean exists(String key) {
        return execute("EXISTS", false, transport -> transport.exists(key));
    }

    @Override
    public List<String> keys(String pattern) {
        return execute("KEYS", Collections.emptyList(), transport -> transport.keys(pattern));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        long seconds = toSeconds(ttl);
        return execute("EXPIRE", false, transport -> transport.expire(key, seconds));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        long seconds = execute("TTL", -2L, transport -> transport.ttl(key));
        return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
    }

    // List operations

    @Override
    public long lpush(String key, String... values) {
        if (values == null || values.length == 0) {
            return 0L;
        }
        return execute("LPUSH", 0L, transport -> transport.lpush(key, values));
    }

    @Override
    public long rpush(String key, String... values) {
        if (values == null || values.length == 0) {
            return 0L;
        }
        return execute("RPUSH", 0L, transport -> transport.rpush(key, values));
    }

    @Override
    public List<String> lrange(String key, long start, long stop) {
        return execute("LRANGE", Collections.emptyList(), transport -> transport.lrange(key, start, stop));
    }

    @Override
    public long llen(String key) {
        return execute("LLEN", 0L, transport -> transport.llen(key));
    }

    // Hash operations

    @Override
    public boolean hset(String key, String field, String value) {
        return execute("HSET", false, transport -> {
            transport.hset(key, field, value);
            return true;
        });
    }

    @Override
    public long hset(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return 0L;
        }
        return execute("HSET", 0L, transport -> transport.hset(key, fields));
    }

    @Override
    public Optional<String> hget(String key, String field) {
        return Optional.ofNullable(execute("HGET", null, transport -> transport.hget(key, field)));
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return execute("HGETALL", Collections.emptyMap(), transport -> transport.hgetall(key));
    }

    @Override
    public long hdel(String key, String... fields) {
        if (fields == null || fields.length == 0) {
            return 0L;
        }
        return execute("HDEL", 0L, transport -> transport.hdel(key, fields));
    }

    // Sorted set operations

    @Override
    public boolean zadd(String key, double score, String member) {
        return execute("ZADD", false, transport -> {
            transport.zadd(key, score, member);
            return true;
        });
    }

    @Override
    public List<String> zrange(String key, long start, long stop) {
        return execute("ZRANGE", Collections.emptyList(), transport -> transport.zrange(key, start, stop));
    }

    @Override
    public long zrem(String key, String... members) {
        if (members == null || members.length == 0) {
            return 0L;
        }
        return execute("ZREM", 0L, transport -> transport.zrem(key, members));
    }

    @Override
    public long zcard(String key) {
        return execute("ZCARD", 0L, transport -> transport.zcard(key));
    }

    @Override
    public boolean ping() {
        return execute("PING", false, transport -> "PONG".equalsIgnoreCase(transport.ping()));
    }

    // Session store and user cache

    @Override
    public boolean storeSession(String sessionId, Map<String, Object> data, long ttlSeconds) {
        return sessionStore.storeSession(sessionId, data, ttlSeconds);
    }

    @Override
    public Optional<Map<String, Object>> getSession(String sessionId) {
        return sessionStore.getSession(sessionId);
    }

    @Override
    public boolean deleteSession(String sessionId) {
        return sessionStore.deleteSession(sessionId);
    }

    @Override
    public boolean setUserCache(String userId, String key, String value, Duration ttl) {
        return userCache.setUserCache(userId, key, value, ttl);
    }

    @Override
    public Optional<String> getUserCache(String userId, String key) {
        return userCache.getUserCache(userId, key);
    }

    @Override
    public boolean clearUserCache(String userId, String key) {
        return userCache.clearUserCache(userId, key);
    }

    @Override
    public List<String> getUserKeys(String userId) {
        return userCache.getUserKeys(userId);
    }

    // Recovery and status

    @Override
    public boolean forceReconnect() {
        if (!enabled || shutdown.get()) {
            return false;
        }

        RedisTransport fresh = null;
        try {
            fresh = transportFactory.create();
            String reply = fresh.ping();
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new IllegalStateException("Unexpected ping response: " + reply);
            }
        } catch (RuntimeException e) {
            closeQuietly(fresh);
            metrics.recordReconnectAttempt(false);
            logger.warn("Forced reconnect to {}:{} failed: {}",
                configuration.getHost(), configuration.getPort(), e.getMessage());
            return false;
        }

        RedisTransport previous = holder.replace(fresh);
        if (previous != null && previous != fresh) {
            retire(previous);
        }
        if (shutdown.get()) {
            // lost a race with shutdown()
            if (holder.discard(fresh)) {
                closeQuietly(fresh);
            }
            return false;
        }

        reconnector.resetBackoff();
        metrics.recordReconnectAttempt(true);
        onConnected("forced reconnect");
        logger.info("Forced reconnect to {}:{} succeeded", configuration.getHost(), configuration.getPort());
        return true;
    }

    @Override
    public void resetCircuitBreaker() {
        circuitBreaker.reset();
    }

    @Override
    public ResilienceStatus getStatus() {
        boolean clientAvailable = holder.isPresent();
        return ResilienceStatus.builder()
            .enabled(enabled)
            .connected(clientAvailable && connected.get())
            .clientAvailable(clientAvailable)
            .consecutiveFailures(consecutiveFailures.get())
            .currentRetryDelay(reconnector.getCurrentRetryDelay())
            .maxReconnectAttempts(configuration.getMaxReconnectAttempts())
            .lastHealthCheck(healthMonitor.getLastHealthCheck())
            .backgroundTasks(new BackgroundTaskStatus(reconnector.isActive(), healthMonitor.isActive()))
            .circuitBreaker(circuitBreaker.getStatus())
            .build();
    }

    @Override
    public Flux<ConnectionEvent> connectionEvents() {
        return eventPublisher.events();
    }

    @Override
    public Disposable addConnectionListener(ConnectionEventListener listener) {
        return eventPublisher.subscribe(listener);
    }

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    Reconnector getReconnector() {
        return reconnector;
    }

    HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    // Gate, call, record

    private <T> T execute(String operation, T fallback, Function<RedisTransport, T> call) {
        if (!enabled || shutdown.get()) {
            return fallback;
        }

        RedisTransport transport = holder.get();
        if (transport == null || !circuitBreaker.canExecute()) {
            metrics.recordRejected(operation);
            return fallback;
        }

        long startTime = System.nanoTime();
        try {
            T result = call.apply(transport);
            metrics.recordOperation(operation, Duration.ofNanos(System.nanoTime() - startTime), true);
            onSuccess();
            return result != null ? result : fallback;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, Duration.ofNanos(System.nanoTime() - startTime), false);
            onFailure(operation, transport, e);
            return fallback;
        }
    }

    private void onSuccess() {
        circuitBreaker.recordSuccess();
        if (consecutiveFailures.getAndSet(0) != 0) {
            metrics.updateConsecutiveFailures(0);
        }
        connected.set(true);
        metrics.updateConnected(true);
    }

    private void onFailure(String operation, RedisTransport transport, Throwable error) {
        circuitBreaker.recordFailure();
        metrics.updateConsecutiveFailures(consecutiveFailures.incrementAndGet());
        connected.set(false);
        metrics.updateConnected(false);

        FailureKind kind = transport.isOpen() ? errorClassifier.classify(error) : FailureKind.CONNECTION_LOST;
        logger.debug("Redis {} failed ({}): {}", operation, kind, error.toString());
        if (kind == FailureKind.CONNECTION_LOST) {
            discard(transport, operation + " failed: " + error.getMessage());
        }
    }

    /**
     * Removes {@code transport} from the slot if it is still current and hands recovery to the reconnector.
     */
    private void discard(RedisTransport transport, String reason) {
        if (!holder.discard(transport)) {
            return;
        }
        closeQuietly(transport);
        metrics.updateConnected(false);
        logger.warn("Redis connection lost: {}", reason);
        eventPublisher.publish(ConnectionEventType.CONNECTION_LOST, reason);
        reconnector.wakeUp();
    }

    /**
     * Closes a replaced transport once calls that captured it before the swap have had one command timeout
     * to finish.
     */
    private void retire(RedisTransport transport) {
        retiring.add(transport);
        long graceMillis = configuration.getCommandTimeout().toMillis();
        CompletableFuture.delayedExecutor(graceMillis, TimeUnit.MILLISECONDS).execute(() -> {
            if (retiring.remove(transport)) {
                closeQuietly(transport);
                logger.debug("Closed replaced Redis transport after {}ms grace period", graceMillis);
            }
        });
    }

    private void onConnected(String detail) {
        consecutiveFailures.set(0);
        metrics.updateConsecutiveFailures(0);
        connected.set(true);
        metrics.updateConnected(true);
        circuitBreaker.recordSuccess();
        eventPublisher.publish(ConnectionEventType.CONNECTED, detail);
    }

    private static long toSeconds(Duration ttl) {
        // Redis expiry has one-second resolution; never round a positive ttl down to zero
        long seconds = ttl.getSeconds();
        return ttl.getNano() > 0 ? seconds + 1 : seconds;
    }

    private static void closeQuietly(RedisTransport transport) {
        if (transport != null) {
            transport.close();
        }
    }

    /**
     * Feeds reconnect outcomes into the breaker, metrics and event stream.
     */
    private class ReconnectHandler implements ReconnectListener {

        @Override
        public void onReconnected(RedisTransport transport) {
            metrics.recordReconnectAttempt(true);
            onConnected("reconnected");
        }

        @Override
        public void onReconnectFailed(int failedAttempts, Duration nextDelay, Throwable error) {
            metrics.recordReconnectAttempt(false);
            eventPublisher.publish(ConnectionEventType.RECONNECT_FAILED,
                "attempt " + failedAttempts + " failed, next in " + nextDelay + ": " + error.getMessage());
        }
    }

    private class HealthCheckHandler implements HealthCheckListener {

        @Override
        public void onHealthCheckPassed(RedisTransport transport) {
            onSuccess();
        }

        @Override
        public void onHealthCheckFailed(RedisTransport transport, Throwable error) {
            circuitBreaker.recordFailure();
            metrics.updateConsecutiveFailures(consecutiveFailures.incrementAndGet());
            connected.set(false);
            discard(transport, "health check failed: " + error.getMessage());
        }
    }

    private class BreakerEventBridge implements CircuitBreakerListener {

        @Override
        public void onStateTransition(CircuitBreakerState from, CircuitBreakerState to) {
            metrics.recordCircuitTransition(to);
            switch (to) {
                case OPEN -> eventPublisher.publish(ConnectionEventType.CIRCUIT_OPENED, from + " -> " + to);
                case HALF_OPEN -> eventPublisher.publish(ConnectionEventType.CIRCUIT_HALF_OPEN, from + " -> " + to);
                case CLOSED -> eventPublisher.publish(ConnectionEventType.CIRCUIT_CLOSED, from + " -> " + to);
            }
        }
    }
}
