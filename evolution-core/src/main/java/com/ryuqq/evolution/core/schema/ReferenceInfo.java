package com.ryuqq.evolution.core.schema;

/**
 * 참조(reference)의 읽기 전용 스냅샷.
 *
 * @param name 참조 이름
 * @param type 대상 클래스 이름
 * @param containment 포함(containment) 참조 여부
 * @param lowerBound 하한
 * @param upperBound 상한 ({@link Cardinality#MANY} = 무제한)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record ReferenceInfo(
    String name,
    String type,
    boolean containment,
    int lowerBound,
    int upperBound
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 type이 null이거나 빈 문자열인 경우
     */
    public ReferenceInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
    }

    /**
     * 다중값 참조인지 확인.
     *
     * @return 상한이 무제한이거나 1보다 크면 true
     */
    public boolean isMany() {
        return Cardinality.isMany(upperBound) || upperBound > 1;
    }
}
