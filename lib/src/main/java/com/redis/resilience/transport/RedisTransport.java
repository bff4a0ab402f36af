package com.redis.resilience.transport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * A live connection to the backing Redis store.
 * <p>
 * Implementations issue raw commands and report failures as unchecked exceptions; they do not retry,
 * reconnect or swallow errors. Each call is bounded by the command timeout of the underlying client.
 * A transport is never repaired in place: once it fails with a connection-level error it is closed and
 * replaced by a fresh one from a {@link RedisTransportFactory}.
 */
public interface RedisTransport extends AutoCloseable {

    // String operations
    String get(String key);

    String set(String key, String value);

    String setex(String key, long seconds, String value);

    long del(String... keys);

    boolean exists(String key);

    List<String> keys(String pattern);

    boolean expire(String key, long seconds);

    /**
     * Remaining time to live in seconds; {@code -1} for no expiry, {@code -2} for a missing key.
     */
    long ttl(String key);

    // List operations
    long lpush(String key, String... values);

    long rpush(String key, String... values);

    List<String> lrange(String key, long start, long stop);

    long llen(String key);

    // Hash operations
    boolean hset(String key, String field, String value);

    long hset(String key, Map<String, String> fields);

    String hget(String key, String field);

    Map<String, String> hgetall(String key);

    long hdel(String key, String... fields);

    // Sorted set operations
    long zadd(String key, double score, String member);

    List<String> zrange(String key, long start, long stop);

    long zrem(String key, String... members);

    long zcard(String key);

    // Connection
    String ping();

    /**
     * Issues a PING without blocking the caller, so that a probe can be abandoned after its own timeout.
     */
    CompletionStage<String> pingAsync();

    boolean isOpen();

    /**
     * Closes the connection. Must not throw.
     */
    @Override
    void close();
}
