package com.ryuqq.conductor.core.event;

/**
 * Operation 이벤트 페이로드.
 *
 * <ul>
 *   <li>{@link Progress}: 진행 상황 텍스트</li>
 *   <li>{@link Completed}: 성공 결과 (종료)</li>
 *   <li>{@link Failed}: 정규화된 실패 메시지 (종료)</li>
 *   <li>{@link Cancelled}: 취소 (종료)</li>
 * </ul>
 *
 * <p>하나의 Operation에 대해 종료 페이로드는 정확히 한 번만 발행됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public sealed interface EventPayload
    permits EventPayload.Progress, EventPayload.Completed, EventPayload.Failed, EventPayload.Cancelled {

    /**
     * 종료 페이로드인지 확인.
     *
     * @return Completed, Failed, Cancelled인 경우 true
     */
    default boolean isTerminal() {
        return !(this instanceof Progress);
    }

    /**
     * 진행 상황.
     *
     * @param text 사람이 읽을 수 있는 상태 문자열
     */
    record Progress(String text) implements EventPayload {
        public Progress {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("text cannot be null or blank");
            }
        }
    }

    /**
     * 성공 결과.
     *
     * @param result 결과 텍스트 (빈 문자열 허용)
     */
    record Completed(String result) implements EventPayload {
        public Completed {
            if (result == null) {
                throw new IllegalArgumentException("result cannot be null");
            }
        }
    }

    /**
     * 실패.
     *
     * @param message 실패 메시지
     */
    record Failed(String message) implements EventPayload {
        public Failed {
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank");
            }
        }
    }

    /**
     * 취소.
     */
    record Cancelled() implements EventPayload {
    }
}
