package com.redis.resilience;

import com.redis.resilience.config.RedisResilienceConfig;
import com.redis.resilience.impl.DefaultRedisResilienceManager;
import com.redis.resilience.transport.LettuceTransportFactory;
import com.redis.resilience.transport.RedisTransportFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;

/**
 * Builder for creating RedisResilienceManager instances.
 */
public class RedisResilienceManagerBuilder {

    private RedisResilienceConfig configuration = RedisResilienceConfig.defaultConfig();
    private RedisTransportFactory transportFactory;
    private MeterRegistry meterRegistry;
    private Clock clock = Clock.systemUTC();

    /**
     * Create a new manager with the given configuration, connecting through Lettuce.
     * The manager is not initialized yet.
     */
    public static RedisResilienceManager create(RedisResilienceConfig configuration) {
        return new DefaultRedisResilienceManager(configuration);
    }

    public static RedisResilienceManagerBuilder builder() {
        return new RedisResilienceManagerBuilder();
    }

    public RedisResilienceManagerBuilder configuration(RedisResilienceConfig configuration) {
        this.configuration = configuration;
        return this;
    }

    /**
     * Overrides how connections are opened. Defaults to a {@link LettuceTransportFactory} for the configuration.
     */
    public RedisResilienceManagerBuilder transportFactory(RedisTransportFactory transportFactory) {
        this.transportFactory = transportFactory;
        return this;
    }

    public RedisResilienceManagerBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }

    public RedisResilienceManagerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public RedisResilienceManager build() {
        if (configuration == null) {
            throw new IllegalArgumentException("Configuration is required");
        }
        RedisTransportFactory factory = transportFactory != null
            ? transportFactory
            : new LettuceTransportFactory(configuration);
        MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        return new DefaultRedisResilienceManager(configuration, factory, registry, clock);
    }
}
