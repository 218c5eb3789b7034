package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.event.OperationEvent;

/**
 * Publishing side of the event bus, the only bus capability handed to workers.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * Fans the event out to every live subscriber.
     *
     * <p>Never blocks on a slow subscriber and never fails because of one. With no subscribers
     * the event is simply dropped.</p>
     *
     * @param event event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(OperationEvent event);
}
