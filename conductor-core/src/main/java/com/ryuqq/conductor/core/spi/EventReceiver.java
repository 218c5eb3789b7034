package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.event.BusMessage;

import java.util.Optional;

/**
 * Receive end of a single bus subscription.
 *
 * <p>Owned by one consumer (typically the render loop), which drains it once per frame:</p>
 * <pre>
 * Optional&lt;BusMessage&gt; next;
 * while ((next = receiver.tryNext()).isPresent()) {
 *     render(next.get());
 * }
 * </pre>
 *
 * <p><strong>Delivery guarantees:</strong></p>
 * <ul>
 *   <li>Events of one operation are delivered in publish order.</li>
 *   <li>If the buffer overflowed, the oldest events were dropped and a
 *       {@link com.ryuqq.conductor.core.event.Lagged} marker precedes the next surviving event.</li>
 *   <li>Events published before the subscription was created are never delivered.</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface EventReceiver extends AutoCloseable {

    /**
     * Returns the next buffered message without blocking.
     *
     * @return next message, or empty if nothing is buffered or the receiver is closed
     */
    Optional<BusMessage> tryNext();

    /**
     * Unsubscribes. Buffered messages are discarded; calling twice is a no-op.
     */
    @Override
    void close();

    /**
     * @return true once {@link #close()} has been called
     */
    boolean isClosed();
}
