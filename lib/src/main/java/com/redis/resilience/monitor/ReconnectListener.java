package com.redis.resilience.monitor;

import com.redis.resilience.transport.RedisTransport;

import java.time.Duration;

/**
 * Receives the outcome of each reconnect attempt.
 */
public interface ReconnectListener {

    /**
     * A fresh transport passed its PING and was installed.
     */
    void onReconnected(RedisTransport transport);

    /**
     * An attempt failed; the next one runs after {@code nextDelay}.
     */
    void onReconnectFailed(int failedAttempts, Duration nextDelay, Throwable error);
}
