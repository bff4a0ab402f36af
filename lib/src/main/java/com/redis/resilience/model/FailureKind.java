package com.redis.resilience.model;

/**
 * Classification of a failed transport call.
 */
public enum FailureKind {

    /**
     * Timeout or temporary error. The transport handle is kept for the next call.
     */
    TRANSIENT,

    /**
     * The handle is dead (closed socket, rejected credentials). It is discarded and rebuilt by the reconnector.
     */
    CONNECTION_LOST
}
