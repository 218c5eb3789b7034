package com.ryuqq.conductor.core.error;

import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.statemachine.OperationState;

/**
 * Thrown by {@code cancel()} when the operation has already reached a terminal state.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class AlreadyTerminalException extends OperationException {

    private final OperationState state;

    public AlreadyTerminalException(OperationId operationId, OperationState state) {
        super("Operation " + operationId + " is already " + state, operationId);
        this.state = state;
    }

    public OperationState getState() {
        return state;
    }
}
