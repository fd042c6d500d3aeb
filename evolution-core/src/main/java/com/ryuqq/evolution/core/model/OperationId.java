package com.ryuqq.evolution.core.model;

import java.util.UUID;

/**
 * Evolution Operation의 안정적인 식별자.
 *
 * <p>Ledger는 이 식별자로 Operation을 색인하며, pending 큐와 ambiguity 집합도
 * Operation 복사본이 아닌 OperationId만 보관합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class OperationId {

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("OperationId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("OperationId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * OperationId 생성.
     *
     * @param value OperationId 값
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * UUID 기반 OperationId 생성.
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
