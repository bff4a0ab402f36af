package com.redis.resilience.monitor;

import com.redis.resilience.transport.RedisTransport;

/**
 * Receives the outcome of each health probe.
 */
public interface HealthCheckListener {

    void onHealthCheckPassed(RedisTransport transport);

    /**
     * The probe failed or timed out against {@code transport}.
     */
    void onHealthCheckFailed(RedisTransport transport, Throwable error);
}
