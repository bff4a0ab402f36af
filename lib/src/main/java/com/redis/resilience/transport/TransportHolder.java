package com.redis.resilience.transport;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The single mutable slot holding the current transport.
 * <p>
 * Every change is a reference swap. A caller that captured a transport keeps using it for its in-flight
 * call even if the slot has moved on; a discard only succeeds against the exact instance the caller saw,
 * so a stale failure can never remove a transport that the reconnector has just installed.
 */
public class TransportHolder {

    private final AtomicReference<RedisTransport> current = new AtomicReference<>();

    /**
     * @return the current transport, or {@code null} if none is installed
     */
    public RedisTransport get() {
        return current.get();
    }

    public boolean isPresent() {
        return current.get() != null;
    }

    /**
     * Installs a transport into an empty slot.
     *
     * @return {@code false} if another transport was installed first
     */
    public boolean install(RedisTransport transport) {
        return current.compareAndSet(null, transport);
    }

    /**
     * Unconditionally installs a transport.
     *
     * @return the transport that was replaced, or {@code null}
     */
    public RedisTransport replace(RedisTransport transport) {
        return current.getAndSet(transport);
    }

    /**
     * Empties the slot if it still holds {@code expected}.
     *
     * @return {@code true} if this call removed it
     */
    public boolean discard(RedisTransport expected) {
        return expected != null && current.compareAndSet(expected, null);
    }

    /**
     * Empties the slot.
     *
     * @return the transport that was removed, or {@code null}
     */
    public RedisTransport clear() {
        return current.getAndSet(null);
    }
}
