package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;

/**
 * 등록되었으나 아직 Worker가 스케줄되지 않은 상태.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Pending() implements OperationStatus {

    @Override
    public OperationState state() {
        return OperationState.PENDING;
    }
}
