package com.ryuqq.conductor.adapter.inmemory.bus;

import com.ryuqq.conductor.core.event.BusMessage;
import com.ryuqq.conductor.core.event.Lagged;
import com.ryuqq.conductor.core.event.OperationEvent;
import com.ryuqq.conductor.core.spi.EventBus;
import com.ryuqq.conductor.core.spi.EventReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link EventBus} SPI.
 *
 * <p>Each subscription owns a bounded {@link ArrayDeque} guarded by its own lock, so
 * publishers contend only per subscriber and only for O(1) deque work. A publisher never
 * waits for a consumer: when a buffer is full the oldest event is dropped and counted.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Subscribers:</strong> CopyOnWriteArrayList&lt;Subscription&gt; - publish iterates a snapshot without locking</li>
 *   <li><strong>Buffer:</strong> ArrayDeque&lt;OperationEvent&gt; per subscription - FIFO, capacity fixed at construction</li>
 *   <li><strong>Lag counter:</strong> events dropped since the last delivery, reported as one {@link Lagged}</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>publish:</strong> O(S) where S = subscriber count</li>
 *   <li><strong>tryNext:</strong> O(1)</li>
 *   <li><strong>subscribe/close:</strong> O(S) - copy-on-write</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventBus bus = new InMemoryEventBus();      // 1000 events per subscriber
 * EventReceiver ui = bus.subscribe();
 *
 * bus.publish(OperationEvent.now(id, kind, new EventPayload.Progress("Connecting...")));
 *
 * ui.tryNext().ifPresent(message -&gt; {
 *     if (message instanceof Lagged) {
 *         // some events were dropped, refresh from getStatus()
 *     }
 * });
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    /**
     * Default per-subscriber capacity, same as the broadcast channel of the original tool.
     */
    public static final int DEFAULT_CAPACITY = 1000;

    /**
     * Live subscriptions. Closed subscriptions remove themselves.
     */
    private final List<Subscription> subscribers;

    /**
     * Per-subscriber buffer capacity.
     */
    private final int capacity;

    /**
     * Creates a bus with {@link #DEFAULT_CAPACITY}.
     */
    public InMemoryEventBus() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a bus with a custom per-subscriber capacity.
     *
     * @param capacity buffer capacity per subscriber
     * @throws IllegalArgumentException if capacity is not positive
     */
    public InMemoryEventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, but was: " + capacity);
        }
        this.capacity = capacity;
        this.subscribers = new CopyOnWriteArrayList<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Iterates a copy-on-write snapshot, so subscribe/close during publish is safe</li>
     *   <li>A subscription closed concurrently ignores the event</li>
     * </ul>
     */
    @Override
    public void publish(OperationEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        for (Subscription subscription : subscribers) {
            subscription.offer(event);
        }
    }

    @Override
    public EventReceiver subscribe() {
        Subscription subscription = new Subscription();
        subscribers.add(subscription);
        log.debug("Subscriber added (total: {})", subscribers.size());
        return subscription;
    }

    @Override
    public int subscriberCount() {
        return subscribers.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Receive end of one subscription.
     */
    private final class Subscription implements EventReceiver {

        private final ReentrantLock lock = new ReentrantLock();
        private final ArrayDeque<OperationEvent> buffer = new ArrayDeque<>();
        private long missed;
        private boolean closed;

        void offer(OperationEvent event) {
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                if (buffer.size() == capacity) {
                    buffer.pollFirst();
                    missed++;
                    if (missed == 1) {
                        log.warn("Subscriber buffer full (capacity {}), dropping oldest events", capacity);
                    }
                }
                buffer.addLast(event);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public Optional<BusMessage> tryNext() {
            lock.lock();
            try {
                if (closed) {
                    return Optional.empty();
                }
                if (missed > 0) {
                    Lagged lagged = new Lagged(missed);
                    missed = 0;
                    return Optional.of(lagged);
                }
                return Optional.ofNullable(buffer.pollFirst());
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                if (closed) {
                    return;
                }
                closed = true;
                buffer.clear();
            } finally {
                lock.unlock();
            }
            subscribers.remove(this);
            log.debug("Subscriber closed (remaining: {})", subscribers.size());
        }

        @Override
        public boolean isClosed() {
            lock.lock();
            try {
                return closed;
            } finally {
                lock.unlock();
            }
        }
    }
}
