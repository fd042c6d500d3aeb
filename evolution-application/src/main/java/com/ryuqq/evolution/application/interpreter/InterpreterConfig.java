package com.ryuqq.evolution.application.interpreter;

import com.ryuqq.evolution.core.schema.Cardinality;
import com.ryuqq.evolution.core.schema.DataTypes;

/**
 * Interpreter 설정 (불변 record).
 *
 * <p>Change Descriptor에 값이 없을 때 적용할 기본값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultAttributeType: 속성 타입 기본값 (기본 "EString")</li>
 *   <li>defaultLowerBound: 하한 기본값 (기본 0)</li>
 *   <li>defaultUpperBound: 상한 기본값 (기본 1, -1 = many)</li>
 *   <li>defaultContainment: 참조 포함 여부 기본값 (기본 false)</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 * @param defaultAttributeType 속성 타입 기본값 (비어있으면 안 됨)
 * @param defaultLowerBound 하한 기본값 (0 이상)
 * @param defaultUpperBound 상한 기본값 (1 이상이면서 하한 이상, 또는 -1)
 * @param defaultContainment 참조 포함 여부 기본값
 */
public record InterpreterConfig(
    String defaultAttributeType,
    int defaultLowerBound,
    int defaultUpperBound,
    boolean defaultContainment
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultAttributeType="EString", defaultLowerBound=0,
     * defaultUpperBound=1, defaultContainment=false</p>
     */
    public InterpreterConfig() {
        this(DataTypes.STRING, Cardinality.DEFAULT_LOWER_BOUND, Cardinality.DEFAULT_UPPER_BOUND, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InterpreterConfig {
        if (defaultAttributeType == null || defaultAttributeType.isBlank()) {
            throw new IllegalArgumentException("defaultAttributeType cannot be null or blank");
        }
        if (!Cardinality.isValid(defaultLowerBound, defaultUpperBound)) {
            throw new IllegalArgumentException(
                "default bounds are invalid (current: [" + defaultLowerBound + ".." + defaultUpperBound + "])"
            );
        }
    }

    /**
     * defaultAttributeType만 변경한 새 인스턴스 생성.
     *
     * @param defaultAttributeType 새로운 속성 타입 기본값
     * @return 새 InterpreterConfig 인스턴스
     */
    public InterpreterConfig withDefaultAttributeType(String defaultAttributeType) {
        return new InterpreterConfig(defaultAttributeType, defaultLowerBound, defaultUpperBound, defaultContainment);
    }

    /**
     * defaultLowerBound만 변경한 새 인스턴스 생성.
     *
     * @param defaultLowerBound 새로운 하한 기본값
     * @return 새 InterpreterConfig 인스턴스
     */
    public InterpreterConfig withDefaultLowerBound(int defaultLowerBound) {
        return new InterpreterConfig(defaultAttributeType, defaultLowerBound, defaultUpperBound, defaultContainment);
    }

    /**
     * defaultUpperBound만 변경한 새 인스턴스 생성.
     *
     * @param defaultUpperBound 새로운 상한 기본값
     * @return 새 InterpreterConfig 인스턴스
     */
    public InterpreterConfig withDefaultUpperBound(int defaultUpperBound) {
        return new InterpreterConfig(defaultAttributeType, defaultLowerBound, defaultUpperBound, defaultContainment);
    }

    /**
     * defaultContainment만 변경한 새 인스턴스 생성.
     *
     * @param defaultContainment 새로운 포함 여부 기본값
     * @return 새 InterpreterConfig 인스턴스
     */
    public InterpreterConfig withDefaultContainment(boolean defaultContainment) {
        return new InterpreterConfig(defaultAttributeType, defaultLowerBound, defaultUpperBound, defaultContainment);
    }
}
