package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.OperationId;
import com.ryuqq.conductor.core.model.OperationKind;

import java.time.Instant;

/**
 * Worker가 발행하는 Operation 이벤트.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>operationId:</strong> 이벤트가 속한 Operation</li>
 *   <li><strong>kind:</strong> Operation 종류</li>
 *   <li><strong>payload:</strong> Progress | Completed | Failed | Cancelled</li>
 *   <li><strong>timestamp:</strong> 발행 시각</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * OperationEvent event = OperationEvent.now(id, OperationKind.AI_ANALYSIS,
 *     new EventPayload.Progress("Connecting to AI provider..."));
 * </pre>
 *
 * @param operationId Operation ID
 * @param kind Operation 종류
 * @param payload 이벤트 페이로드
 * @param timestamp 발행 시각
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record OperationEvent(
    OperationId operationId,
    OperationKind kind,
    EventPayload payload,
    Instant timestamp
) implements BusMessage {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public OperationEvent {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    /**
     * 현재 시각으로 이벤트 생성.
     *
     * @param operationId Operation ID
     * @param kind Operation 종류
     * @param payload 페이로드
     * @return 생성된 이벤트
     */
    public static OperationEvent now(OperationId operationId, OperationKind kind, EventPayload payload) {
        return new OperationEvent(operationId, kind, payload, Instant.now());
    }

    /**
     * 종료 이벤트인지 확인.
     *
     * @return 종료 페이로드인 경우 true
     */
    public boolean isTerminal() {
        return payload.isTerminal();
    }
}
