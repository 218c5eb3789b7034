package com.ryuqq.conductor.core.error;

import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;

/**
 * Thrown by {@code start()} when an operation of the same kind is still pending or running.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class AlreadyRunningException extends OperationException {

    private final OperationKind kind;

    /**
     * @param kind the kind that is already in flight
     * @param runningId the in-flight operation
     */
    public AlreadyRunningException(OperationKind kind, OperationId runningId) {
        super("Operation already running for kind " + kind + ": " + runningId, runningId);
        this.kind = kind;
    }

    public OperationKind getKind() {
        return kind;
    }
}
