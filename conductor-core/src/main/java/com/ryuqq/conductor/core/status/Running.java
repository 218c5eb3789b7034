package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;

import java.time.Instant;

/**
 * 실행 중 상태.
 *
 * <p>진행 메시지가 바뀌면 같은 startedAt을 가진 새 Running 인스턴스로 교체됩니다.
 * 상태 자체는 바뀌지 않습니다.</p>
 *
 * @param message 최근 진행 메시지 (null 불가)
 * @param startedAt 실행 시작 시각 (null 불가)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Running(
    String message,
    Instant startedAt
) implements OperationStatus {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message 또는 startedAt이 null인 경우
     */
    public Running {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }

    /**
     * 메시지만 변경한 새 인스턴스 생성.
     *
     * @param message 새 진행 메시지
     * @return Running 인스턴스
     */
    public Running withMessage(String message) {
        return new Running(message, startedAt);
    }

    @Override
    public OperationState state() {
        return OperationState.RUNNING;
    }
}
