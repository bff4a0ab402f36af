package com.redis.resilience.observability;

import com.redis.resilience.model.ConnectionEvent;
import com.redis.resilience.model.ConnectionEventListener;
import com.redis.resilience.model.ConnectionEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes connection lifecycle events as a hot stream. Events emitted while nobody is subscribed are
 * dropped; subscribers only see what happens after they subscribe.
 */
public class ConnectionEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionEventPublisher.class);

    private final Sinks.Many<ConnectionEvent> eventSink;
    private final Clock clock;
    private final AtomicInteger subscriberCount = new AtomicInteger();

    public ConnectionEventPublisher() {
        this(Clock.systemUTC());
    }

    public ConnectionEventPublisher(Clock clock) {
        this.eventSink = Sinks.many().multicast().directBestEffort();
        this.clock = clock;
    }

    /**
     * Publishes an event. Safe to call from any thread; emissions are serialized.
     */
    public synchronized void publish(ConnectionEventType type, String detail) {
        ConnectionEvent event = new ConnectionEvent(type, clock.instant(), detail);

        Sinks.EmitResult result = eventSink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.trace("No subscribers for connection event {}", type);
        } else if (result.isFailure()) {
            logger.warn("Failed to publish connection event {}: {}", type, result);
        } else {
            logger.debug("Published connection event: {}", event);
        }
    }

    /**
     * Subscribes a listener to connection events.
     *
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(ConnectionEventListener listener) {
        return eventSink.asFlux()
            .doOnSubscribe(subscription -> logger.debug("Connection event subscription activated (total {})",
                subscriberCount.incrementAndGet()))
            .doOnCancel(() -> logger.debug("Connection event subscription cancelled (remaining {})",
                subscriberCount.decrementAndGet()))
            .subscribe(
                listener::onEvent,
                error -> logger.error("Connection event subscriber error", error)
            );
    }

    public Flux<ConnectionEvent> events() {
        return eventSink.asFlux();
    }

    /**
     * Completes the stream for all subscribers.
     */
    public synchronized void close() {
        eventSink.tryEmitComplete();
        logger.debug("ConnectionEventPublisher closed");
    }
}
