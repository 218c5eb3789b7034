package com.ryuqq.conductor.core.spi;

/**
 * In-process broadcast channel from workers to any number of subscribers.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish and subscribe may be called from any thread</li>
 *   <li>Bounded: each subscriber has a fixed-capacity buffer</li>
 *   <li>Drop-oldest: on overflow the oldest buffered event is discarded and counted</li>
 *   <li>Non-blocking: a stalled subscriber never blocks a publisher</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface EventBus extends EventPublisher {

    /**
     * Opens a new subscription that sees every event published from now on.
     *
     * @return new receiver
     */
    EventReceiver subscribe();

    /**
     * Number of live (not closed) subscriptions, for diagnostics.
     *
     * @return subscriber count
     */
    int subscriberCount();
}
