package com.redis.resilience.transport;

import com.redis.resilience.model.FailureKind;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Sorts transport errors into {@link FailureKind#TRANSIENT} and {@link FailureKind#CONNECTION_LOST}.
 * <p>
 * Timeouts are always transient. Connection, socket and authentication failures mean the handle is dead.
 * Anything else (a command error, an unexpected reply) is treated as transient so that one bad
 * command does not tear down a healthy connection.
 */
public class TransportErrorClassifier {

    private static final List<String> CONNECTION_LOST_MARKERS = List.of(
        "noauth",
        "wrongpass",
        "noperm",
        "connection closed",
        "connection is closed",
        "disconnected state",
        "connection reset",
        "not connected",
        "broken pipe"
    );

    public FailureKind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof RedisCommandTimeoutException || current instanceof TimeoutException) {
                return FailureKind.TRANSIENT;
            }
            if (current instanceof ConnectionLostException
                    || current instanceof RedisConnectionException
                    || current instanceof IOException) {
                return FailureKind.CONNECTION_LOST;
            }
            if (hasConnectionLostMarker(current.getMessage())) {
                return FailureKind.CONNECTION_LOST;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return FailureKind.TRANSIENT;
    }

    private static boolean hasConnectionLostMarker(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String marker : CONNECTION_LOST_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
