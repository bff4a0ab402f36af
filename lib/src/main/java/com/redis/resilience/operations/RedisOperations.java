package com.redis.resilience.operations;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis operations that never fail because the store is unavailable.
 * <p>
 * When Redis is disabled, the circuit breaker is open, no connection is installed or the call itself fails,
 * every operation returns its empty result: {@link Optional#empty()}, {@code false}, {@code 0} or an empty
 * collection. Callers therefore handle "value present" versus "value absent" and never wrap calls in
 * try/catch for availability.
 */
public interface RedisOperations {

    // String operations
    Optional<String> get(String key);

    boolean set(String key, String value);

    /**
     * Stores a value that expires after {@code ttl}. A {@code null}, zero or negative ttl stores without expiry.
     */
    boolean set(String key, String value, Duration ttl);

    /**
     * @return number of keys removed
     */
    long delete(String... keys);

    boolean exists(String key);

    /**
     * @param pattern a Redis glob pattern such as {@code session:*}
     */
    List<String> keys(String pattern);

    boolean expire(String key, Duration ttl);

    /**
     * Remaining time to live of a key. Redis answers -1 for a key without expiry and -2 for a missing key;
     * both map to empty, as does an unavailable store. Use {@link #exists(String)} to tell a persistent key
     * from an absent one.
     *
     * @return remaining time to live, or empty if there is none to report
     */
    Optional<Duration> ttl(String key);

    // List operations
    long lpush(String key, String... values);

    long rpush(String key, String... values);

    List<String> lrange(String key, long start, long stop);

    long llen(String key);

    // Hash operations
    /**
     * @return {@code true} if the field was written, whether it was new or updated
     */
    boolean hset(String key, String field, String value);

    long hset(String key, Map<String, String> fields);

    Optional<String> hget(String key, String field);

    Map<String, String> hgetAll(String key);

    long hdel(String key, String... fields);

    // Sorted set operations
    /**
     * @return {@code true} if the member was written, whether it was new or had its score updated
     */
    boolean zadd(String key, double score, String member);

    List<String> zrange(String key, long start, long stop);

    long zrem(String key, String... members);

    long zcard(String key);

    // Connection
    boolean ping();
}
