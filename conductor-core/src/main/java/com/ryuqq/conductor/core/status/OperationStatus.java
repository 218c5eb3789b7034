package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;

/**
 * Operation 상태 스냅샷.
 *
 * <p>OperationStatus는 다섯 가지 가능한 상태를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Pending}: 등록됨, Worker 스케줄 대기</li>
 *   <li>{@link Running}: 실행 중 (최근 진행 메시지, 시작 시각)</li>
 *   <li>{@link Completed}: 성공 (결과)</li>
 *   <li>{@link Failed}: 실패 (사용자에게 보여줄 단일 메시지)</li>
 *   <li>{@link Cancelled}: 취소됨</li>
 * </ul>
 *
 * <p>모든 구현은 불변 record이므로, UI가 매 프레임 조회한 스냅샷을
 * 자유롭게 보관하거나 비교해도 안전합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String line;
 * if (status instanceof Running running) {
 *     line = "⏳ " + running.message();
 * } else if (status instanceof Failed failed) {
 *     line = "❌ " + failed.message();
 * } else {
 *     line = status.state().name();
 * }
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public sealed interface OperationStatus permits Pending, Running, Completed, Failed, Cancelled {

    /**
     * 이 스냅샷에 대응하는 상태 머신 상태.
     *
     * @return OperationState
     */
    OperationState state();

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    default boolean isTerminal() {
        return state().isTerminal();
    }
}
