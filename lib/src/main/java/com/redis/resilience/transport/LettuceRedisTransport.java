package com.redis.resilience.transport;

import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * {@link RedisTransport} over a single Lettuce connection.
 * Lettuce connections are thread-safe, so one instance is shared by all callers.
 */
public class LettuceRedisTransport implements RedisTransport {

    private static final Logger logger = LoggerFactory.getLogger(LettuceRedisTransport.class);

    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;

    public LettuceRedisTransport(StatefulRedisConnection<String, String> connection) {
        this.connection = connection;
        this.commands = connection.sync();
    }

    @Override
    public String get(String key) {
        return commands.get(key);
    }

    @Override
    public String set(String key, String value) {
        return commands.set(key, value);
    }

    @Override
    public String setex(String key, long seconds, String value) {
        return commands.setex(key, seconds, value);
    }

    @Override
    public long del(String... keys) {
        return commands.del(keys);
    }

    @Override
    public boolean exists(String key) {
        return commands.exists(key) > 0;
    }

    @Override
    public List<String> keys(String pattern) {
        return commands.keys(pattern);
    }

    @Override
    public boolean expire(String key, long seconds) {
        return Boolean.TRUE.equals(commands.expire(key, seconds));
    }

    @Override
    public long ttl(String key) {
        return commands.ttl(key);
    }

    @Override
    public long lpush(String key, String... values) {
        return commands.lpush(key, values);
    }

    @Override
    public long rpush(String key, String... values) {
        return commands.rpush(key, values);
    }

    @Override
    public List<String> lrange(String key, long start, long stop) {
        return commands.lrange(key, start, stop);
    }

    @Override
    public long llen(String key) {
        return commands.llen(key);
    }

    @Override
    public boolean hset(String key, String field, String value) {
        return Boolean.TRUE.equals(commands.hset(key, field, value));
    }

    @Override
    public long hset(String key, Map<String, String> fields) {
        return commands.hset(key, fields);
    }

    @Override
    public String hget(String key, String field) {
        return commands.hget(key, field);
    }

    @Override
    public Map<String, String> hgetall(String key) {
        return commands.hgetall(key);
    }

    @Override
    public long hdel(String key, String... fields) {
        return commands.hdel(key, fields);
    }

    @Override
    public long zadd(String key, double score, String member) {
        return commands.zadd(key, score, member);
    }

    @Override
    public List<String> zrange(String key, long start, long stop) {
        return commands.zrange(key, start, stop);
    }

    @Override
    public long zrem(String key, String... members) {
        return commands.zrem(key, members);
    }

    @Override
    public long zcard(String key) {
        return commands.zcard(key);
    }

    @Override
    public String ping() {
        return commands.ping();
    }

    @Override
    public CompletionStage<String> pingAsync() {
        return connection.async().ping();
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (Exception e) {
            logger.warn("Error closing Redis connection", e);
        }
    }
}
