package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;

/**
 * 성공적으로 완료된 상태.
 *
 * @param result 결과 텍스트 (null 불가, 빈 문자열 허용)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Completed(
    String result
) implements OperationStatus {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException result가 null인 경우
     */
    public Completed {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    @Override
    public OperationState state() {
        return OperationState.COMPLETED;
    }
}
