package com.ryuqq.conductor.core.event;

/**
 * Message delivered to an event subscriber.
 *
 * <p>A subscriber either receives an {@link OperationEvent} or, when its bounded buffer
 * overflowed, a {@link Lagged} marker reporting how many events were dropped before the
 * next surviving one.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public sealed interface BusMessage permits OperationEvent, Lagged {
}
