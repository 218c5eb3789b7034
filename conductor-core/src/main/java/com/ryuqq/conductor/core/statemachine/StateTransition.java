package com.ryuqq.conductor.core.statemachine;

/**
 * 상태 전이 규칙.
 *
 * <p>Registry는 모든 전이 전에 이 규칙을 확인하고, 허용되지 않은 전이는
 * 예외 대신 false로 거부합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → CANCELLED</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 *   <li>RUNNING → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → PENDING)</li>
 * </ul>
 *
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(OperationState from, OperationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case PENDING -> to == OperationState.RUNNING || to == OperationState.CANCELLED;
            case RUNNING -> to.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
