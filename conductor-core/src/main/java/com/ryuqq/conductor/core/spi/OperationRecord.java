package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.status.OperationStatus;

import java.time.Instant;

/**
 * Registry entry for one operation.
 *
 * @param kind operation kind
 * @param status current status snapshot
 * @param createdAt registration time
 * @param terminatedAt time the entry reached a terminal status, null while non-terminal
 * @author Conductor Team
 * @since 1.0.0
 */
public record OperationRecord(
    OperationKind kind,
    OperationStatus status,
    Instant createdAt,
    Instant terminatedAt
) {

    public OperationRecord {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (status.isTerminal() && terminatedAt == null) {
            throw new IllegalArgumentException("terminatedAt is required for terminal status " + status.state());
        }
        if (!status.isTerminal() && terminatedAt != null) {
            throw new IllegalArgumentException("terminatedAt must be null for status " + status.state());
        }
    }

    /**
     * Creates a new pending-or-running record.
     */
    public static OperationRecord active(OperationKind kind, OperationStatus status, Instant createdAt) {
        return new OperationRecord(kind, status, createdAt, null);
    }

    public OperationRecord withStatus(OperationStatus next) {
        return new OperationRecord(kind, next, createdAt, null);
    }

    public OperationRecord terminate(OperationStatus terminal, Instant at) {
        return new OperationRecord(kind, terminal, createdAt, at);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
