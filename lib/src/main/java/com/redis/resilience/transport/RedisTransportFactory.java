package com.redis.resilience.transport;

/**
 * Opens new transports to the backing store.
 */
public interface RedisTransportFactory extends AutoCloseable {

    /**
     * Opens a new connection.
     *
     * @return a connected transport
     * @throws RuntimeException if the store cannot be reached
     */
    RedisTransport create();

    /**
     * Releases resources shared by all transports created by this factory.
     */
    @Override
    default void close() {
    }
}
