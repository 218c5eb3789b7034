package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.error.AlreadyRunningException;
import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.RunningOperation;
import com.ryuqq.conductor.core.status.OperationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operation status registry SPI.
 *
 * <p>Keeps the latest {@link OperationStatus} for every known operation and enforces the
 * single-flight rule: at most one non-terminal (pending or running) operation per
 * {@link OperationKind}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic: {@link #register(OperationKind)} checks and inserts under one critical section</li>
 *   <li>Monotonic: no method ever moves an entry out of a terminal status</li>
 *   <li>Cheap: every method is O(1) map work (sweep is bounded by its batch size), no I/O</li>
 *   <li>Idempotent: terminal transitions on a terminal or unknown id return false, never throw</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * register()         → PENDING
 * markRunning()      → RUNNING
 * updateProgress()   → RUNNING (new message)
 * complete/fail()    → COMPLETED / FAILED
 * cancel()           → CANCELLED (from PENDING or RUNNING)
 * remove()/sweep     → evicted
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface OperationRegistry {

    /**
     * Registers a new operation of the given kind in PENDING status.
     *
     * @param kind operation kind
     * @return fresh operation id
     * @throws AlreadyRunningException if a non-terminal operation of this kind exists
     * @throws IllegalArgumentException if kind is null
     */
    OperationId register(OperationKind kind) throws AlreadyRunningException;

    /**
     * Moves a PENDING entry to RUNNING.
     *
     * @param id operation id
     * @param message initial running message
     * @return true if the transition happened; false if the entry is unknown or not PENDING
     */
    boolean markRunning(OperationId id, String message);

    /**
     * Replaces the message of a RUNNING entry. No-op for any other status.
     *
     * @param id operation id
     * @param message progress message
     * @return true if the message was updated
     */
    boolean updateProgress(OperationId id, String message);

    /**
     * Moves a RUNNING entry to COMPLETED.
     *
     * @return true if this call performed the transition
     */
    boolean complete(OperationId id, String result);

    /**
     * Moves a RUNNING entry to FAILED.
     *
     * @return true if this call performed the transition
     */
    boolean fail(OperationId id, String message);

    /**
     * Moves a PENDING or RUNNING entry to CANCELLED.
     *
     * @return true if this call performed the transition
     */
    boolean cancel(OperationId id);

    /**
     * @param id operation id
     * @return status snapshot, or empty if the id is unknown or evicted
     */
    Optional<OperationStatus> getStatus(OperationId id);

    /**
     * @param id operation id
     * @return full record, or empty if the id is unknown or evicted
     */
    Optional<OperationRecord> find(OperationId id);

    /**
     * @return (kind, id) of every non-terminal operation, no particular order
     */
    List<RunningOperation> listRunning();

    /**
     * Evicts a terminal entry.
     *
     * @param id operation id
     * @return true if an entry was removed
     * @throws IllegalStateException if the entry is still pending or running
     */
    boolean remove(OperationId id);

    /**
     * Evicts up to {@code batchSize} terminal entries that terminated before {@code cutoff}.
     *
     * @param cutoff entries with terminatedAt strictly before this instant are eligible
     * @param batchSize maximum number of entries removed by this call (must be positive)
     * @return number of removed entries
     */
    int sweepTerminatedBefore(Instant cutoff, int batchSize);
}
