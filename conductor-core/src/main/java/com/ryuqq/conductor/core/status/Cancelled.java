package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;

/**
 * 취소된 상태.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Cancelled() implements OperationStatus {

    @Override
    public OperationState state() {
        return OperationState.CANCELLED;
    }
}
