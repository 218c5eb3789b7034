package com.ryuqq.conductor.core.model;

/**
 * 진행 중인 Operation 요약 ({@code listRunning()} 결과 항목).
 *
 * @param kind Operation 종류
 * @param operationId Operation ID
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record RunningOperation(
    OperationKind kind,
    OperationId operationId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 operationId가 null인 경우
     */
    public RunningOperation {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
    }
}
