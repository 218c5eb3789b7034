package com.ryuqq.conductor.core.event;

/**
 * Overflow marker for a subscriber that fell behind.
 *
 * <p>Delivered in place of the dropped events, immediately before the oldest event that
 * survived in the buffer. Events that are delivered keep their publication order.</p>
 *
 * @param missed number of events dropped since the previous delivery (always positive)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Lagged(long missed) implements BusMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if missed is not positive
     */
    public Lagged {
        if (missed <= 0) {
            throw new IllegalArgumentException("missed must be positive (current: " + missed + ")");
        }
    }
}
