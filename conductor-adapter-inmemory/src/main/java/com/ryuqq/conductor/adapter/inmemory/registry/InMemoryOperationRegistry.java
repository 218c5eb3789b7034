package com.ryuqq.conductor.adapter.inmemory.registry;

import com.ryuqq.conductor.core.error.AlreadyRunningException;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.RunningOperation;
import com.ryuqq.conductor.core.spi.OperationRecord;
import com.ryuqq.conductor.core.spi.OperationRegistry;
import com.ryuqq.conductor.core.statemachine.OperationState;
import com.ryuqq.conductor.core.statemachine.StateTransition;
import com.ryuqq.conductor.core.status.Cancelled;
import com.ryuqq.conductor.core.status.Completed;
import com.ryuqq.conductor.core.status.Failed;
import com.ryuqq.conductor.core.status.OperationStatus;
import com.ryuqq.conductor.core.status.Pending;
import com.ryuqq.conductor.core.status.Running;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link OperationRegistry} SPI.
 *
 * <p>Reads are lock-free on a {@link ConcurrentHashMap} of immutable records; every mutation
 * runs under the registry monitor and does O(1) map work, so the render loop calling
 * {@link #getStatus(OperationId)} is never delayed by I/O.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>records:</strong> ConcurrentHashMap&lt;OperationId, OperationRecord&gt; - latest snapshot per operation</li>
 *   <li><strong>activeByKind:</strong> EnumMap&lt;OperationKind, OperationId&gt; - single-flight index, guarded by the monitor</li>
 *   <li><strong>terminatedOrder:</strong> LinkedHashSet&lt;OperationId&gt; - termination order of the entries still held</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>register: check-and-insert under one monitor acquisition</li>
 *   <li>transitions: validated by {@link StateTransition}, rejected transitions return false</li>
 *   <li>getStatus/find/listRunning: no locking, may observe a status one transition old</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryOperationRegistry implements OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationRegistry.class);

    /**
     * Operation records by id. Values are immutable and replaced on every transition.
     */
    private final ConcurrentHashMap<OperationId, OperationRecord> records;

    /**
     * Non-terminal operation per kind. Mutated only under the monitor.
     */
    private final Map<OperationKind, OperationId> activeByKind;

    /**
     * Ids in the order they reached a terminal status. Holds exactly the terminal ids
     * present in {@code records}.
     */
    private final LinkedHashSet<OperationId> terminatedOrder;

    private final Clock clock;

    /**
     * Creates a registry using the system UTC clock.
     */
    public InMemoryOperationRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a registry with a custom clock (for tests).
     *
     * @param clock time source for createdAt/terminatedAt
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryOperationRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.records = new ConcurrentHashMap<>();
        this.activeByKind = new EnumMap<>(OperationKind.class);
        this.terminatedOrder = new LinkedHashSet<>();
    }

    @Override
    public synchronized OperationId register(OperationKind kind) throws AlreadyRunningException {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        OperationId active = activeByKind.get(kind);
        if (active != null) {
            throw new AlreadyRunningException(kind, active);
        }
        OperationId id = OperationId.generate();
        records.put(id, OperationRecord.active(kind, new Pending(), clock.instant()));
        activeByKind.put(kind, id);
        log.debug("Registered {} as {}", kind, id);
        return id;
    }

    @Override
    public synchronized boolean markRunning(OperationId id, String message) {
        OperationRecord current = records.get(id);
        if (current == null || !StateTransition.isAllowed(current.status().state(), OperationState.RUNNING)) {
            return false;
        }
        records.put(id, current.withStatus(new Running(message == null ? "" : message, clock.instant())));
        return true;
    }

    @Override
    public synchronized boolean updateProgress(OperationId id, String message) {
        OperationRecord current = records.get(id);
        if (current == null || !(current.status() instanceof Running) || message == null) {
            return false;
        }
        Running running = (Running) current.status();
        records.put(id, current.withStatus(running.withMessage(message)));
        return true;
    }

    @Override
    public boolean complete(OperationId id, String result) {
        return terminate(id, new Completed(result == null ? "" : result));
    }

    @Override
    public boolean fail(OperationId id, String message) {
        return terminate(id, new Failed(message));
    }

    @Override
    public boolean cancel(OperationId id) {
        return terminate(id, new Cancelled());
    }

    @Override
    public Optional<OperationStatus> getStatus(OperationId id) {
        if (id == null) {
            return Optional.empty();
        }
        OperationRecord record = records.get(id);
        return record == null ? Optional.empty() : Optional.of(record.status());
    }

    @Override
    public Optional<OperationRecord> find(OperationId id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<RunningOperation> listRunning() {
        List<RunningOperation> running = new ArrayList<>();
        records.forEach((id, record) -> {
            if (!record.isTerminal()) {
                running.add(new RunningOperation(record.kind(), id));
            }
        });
        return running;
    }

    @Override
    public synchronized boolean remove(OperationId id) {
        OperationRecord current = records.get(id);
        if (current == null) {
            return false;
        }
        if (!current.isTerminal()) {
            throw new IllegalStateException(
                "Cannot remove operation " + id + " in non-terminal state " + current.status().state());
        }
        records.remove(id);
        terminatedOrder.remove(id);
        return true;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Walks {@code terminatedOrder} from the oldest entry and stops at the first entry
     *       that is not old enough, or after {@code batchSize} removals</li>
     *   <li>Each step is O(1), so one call does at most {@code batchSize} units of work</li>
     * </ul>
     */
    @Override
    public synchronized int sweepTerminatedBefore(Instant cutoff, int batchSize) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        int removed = 0;
        Iterator<OperationId> oldestFirst = terminatedOrder.iterator();
        while (removed < batchSize && oldestFirst.hasNext()) {
            OperationId head = oldestFirst.next();
            OperationRecord record = records.get(head);
            if (!record.terminatedAt().isBefore(cutoff)) {
                break;
            }
            oldestFirst.remove();
            records.remove(head);
            removed++;
        }
        return removed;
    }

    /**
     * Number of entries currently held, terminal or not.
     *
     * @return entry count
     */
    public int size() {
        return records.size();
    }

    /**
     * Number of terminal entries waiting for {@link #remove} or a sweep.
     *
     * @return terminal entry count
     */
    public synchronized int terminatedCount() {
        return terminatedOrder.size();
    }

    private synchronized boolean terminate(OperationId id, OperationStatus terminal) {
        OperationRecord current = records.get(id);
        if (current == null || !StateTransition.isAllowed(current.status().state(), terminal.state())) {
            return false;
        }
        records.put(id, current.terminate(terminal, clock.instant()));
        activeByKind.remove(current.kind(), id);
        terminatedOrder.add(id);
        log.debug("{} {} → {}", current.kind(), id, terminal.state());
        return true;
    }
}
