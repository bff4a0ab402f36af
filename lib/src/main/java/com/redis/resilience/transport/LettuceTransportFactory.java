package com.redis.resilience.transport;

import com.redis.resilience.config.RedisResilienceConfig;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates Lettuce-backed transports for the configured Redis endpoint.
 * <p>
 * Lettuce's built-in auto-reconnect is switched off and commands on a disconnected connection are
 * rejected immediately: reconnection is owned by the resilience layer, which discards a dead transport
 * and asks this factory for a new one.
 */
public class LettuceTransportFactory implements RedisTransportFactory {

    private static final Logger logger = LoggerFactory.getLogger(LettuceTransportFactory.class);

    private final RedisResilienceConfig config;
    private final Object lock = new Object();
    private ClientResources clientResources;
    private RedisClient client;
    private volatile boolean closed = false;

    public LettuceTransportFactory(RedisResilienceConfig config) {
        this.config = config;
    }

    @Override
    public RedisTransport create() {
        if (closed) {
            throw new IllegalStateException("LettuceTransportFactory is closed");
        }
        RedisClient redisClient = getOrCreateClient();
        StatefulRedisConnection<String, String> connection = redisClient.connect(buildRedisURI());

        logger.debug("Created connection to Redis at {}:{}", config.getHost(), config.getPort());
        return new LettuceRedisTransport(connection);
    }

    private RedisClient getOrCreateClient() {
        synchronized (lock) {
            if (client == null) {
                clientResources = DefaultClientResources.builder()
                    .ioThreadPoolSize(Math.max(2, Runtime.getRuntime().availableProcessors()))
                    .computationThreadPoolSize(Math.max(2, Runtime.getRuntime().availableProcessors()))
                    .build();
                client = RedisClient.create(clientResources);
                client.setOptions(buildClientOptions());
                logger.debug("Created Redis client for {}:{}", config.getHost(), config.getPort());
            }
            return client;
        }
    }

    RedisURI buildRedisURI() {
        RedisURI.Builder uriBuilder = RedisURI.builder()
            .withHost(config.getHost())
            .withPort(config.getPort())
            .withDatabase(config.getDatabase())
            .withTimeout(config.getCommandTimeout());

        if (config.getPassword() != null) {
            if (config.getUsername() != null) {
                uriBuilder.withAuthentication(config.getUsername(), config.getPassword().toCharArray());
            } else {
                uriBuilder.withPassword(config.getPassword().toCharArray());
            }
        }

        if (config.isSsl()) {
            uriBuilder.withSsl(true);
        }

        return uriBuilder.build();
    }

    ClientOptions buildClientOptions() {
        SocketOptions socketOptions = SocketOptions.builder()
            .connectTimeout(config.getConnectionTimeout())
            .keepAlive(true)
            .tcpNoDelay(true)
            .build();

        TimeoutOptions timeoutOptions = TimeoutOptions.builder()
            .fixedTimeout(config.getCommandTimeout())
            .build();

        return ClientOptions.builder()
            .autoReconnect(false)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .socketOptions(socketOptions)
            .timeoutOptions(timeoutOptions)
            .build();
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;

            if (client != null) {
                try {
                    client.shutdown();
                } catch (Exception e) {
                    logger.warn("Error closing Redis client", e);
                }
                client = null;
            }
            if (clientResources != null) {
                try {
                    clientResources.shutdown();
                } catch (Exception e) {
                    logger.warn("Error shutting down client resources", e);
                }
                clientResources = null;
            }
        }
        logger.info("LettuceTransportFactory closed");
    }
}
