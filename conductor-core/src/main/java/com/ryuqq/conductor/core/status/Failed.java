package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;

/**
 * 실패 상태.
 *
 * <p>Worker 단계에서 발생한 이질적인 예외는 모두 이 하나의 메시지로 정규화됩니다.
 * UI에 전달되는 실패 사유는 이 메시지가 유일합니다.</p>
 *
 * @param message 실패 메시지 (null 또는 빈 문자열 불가)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Failed(
    String message
) implements OperationStatus {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public Failed {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public OperationState state() {
        return OperationState.FAILED;
    }
}
