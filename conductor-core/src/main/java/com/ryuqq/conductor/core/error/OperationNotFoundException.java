package com.ryuqq.conductor.core.error;

import com.ryuqq.conductor.core.model.OperationId;

/**
 * Thrown when an operation id is unknown to the registry (never started, or already evicted).
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class OperationNotFoundException extends OperationException {

    public OperationNotFoundException(OperationId operationId) {
        super("Operation not found: " + operationId, operationId);
    }
}
