package com.ryuqq.conductor.core.model;

import java.util.UUID;

/**
 * 백그라운드 Operation의 고유 식별자.
 *
 * <p>OperationId는 {@code Dispatcher.start()} 시점에 생성되며,
 * Registry 조회, 이벤트 상관관계, 취소 요청에 사용됩니다.
 * 호출자에게는 불투명(opaque) 토큰으로 취급됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class OperationId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OperationId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "OperationId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 OperationId 생성.
     *
     * @param value OperationId 값
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * 새로운 OperationId 생성 (UUID 기반).
     *
     * @return 새 OperationId
     */
    public static OperationId generate() {
        return new OperationId(UUID.randomUUID().toString());
    }

    /**
     * OperationId 값 조회.
     *
     * @return OperationId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationId that = (OperationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationId{" + value + '}';
    }
}
