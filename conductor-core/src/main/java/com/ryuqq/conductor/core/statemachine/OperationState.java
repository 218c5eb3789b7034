package com.ryuqq.conductor.core.statemachine;

/**
 * Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (Worker 스케줄 확인)</li>
 *   <li>PENDING → CANCELLED (Worker가 시작되기 전 취소)</li>
 *   <li>RUNNING → COMPLETED (성공)</li>
 *   <li>RUNNING → FAILED (실패)</li>
 *   <li>RUNNING → CANCELLED (체크포인트에서 취소)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──────────────┐
 *    │                  │
 *    ▼ (스케줄됨)        │ (시작 전 취소)
 * RUNNING               │
 *    │                  │
 *    ├─► COMPLETED      │
 *    ├─► FAILED         │
 *    └─► CANCELLED ◄────┘
 *
 * 금지된 전이:
 * - 종료 상태 → * ❌
 * - RUNNING → PENDING ❌
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public enum OperationState {

    /**
     * 등록됨 (Worker 스케줄 대기).
     */
    PENDING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return COMPLETED, FAILED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
