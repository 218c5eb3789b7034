package com.ryuqq.conductor.core.error;

import com.ryuqq.conductor.core.model.OperationId;

/**
 * Base class for the synchronous, recoverable errors returned by the dispatcher and
 * query API.
 *
 * <p>These are checked on purpose: every caller of {@code start()} or {@code cancel()} has to
 * decide what to show the user.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public abstract class OperationException extends Exception {

    private final OperationId operationId;

    protected OperationException(String message, OperationId operationId) {
        super(message);
        this.operationId = operationId;
    }

    /**
     * The operation the error refers to.
     *
     * @return operation id, or null when the error is not tied to an existing operation
     */
    public OperationId getOperationId() {
        return operationId;
    }
}
