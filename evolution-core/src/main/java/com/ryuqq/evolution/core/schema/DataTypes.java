package com.ryuqq.evolution.core.schema;

import java.util.Set;

/**
 * 속성 타입으로 사용 가능한 기본 데이터 타입 이름.
 *
 * <p>Ecore 계열 메타모델의 기본 데이터 타입 명칭을 따릅니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class DataTypes {

    /**
     * 기본 문자열 타입 (속성 타입 기본값).
     */
    public static final String STRING = "EString";

    public static final String INT = "EInt";

    public static final String BOOLEAN = "EBoolean";

    private static final Set<String> BUILT_IN = Set.of(
        STRING, INT, BOOLEAN,
        "ELong", "EShort", "EByte", "EChar",
        "EFloat", "EDouble",
        "EBigInteger", "EBigDecimal",
        "EDate", "EByteArray", "EJavaObject", "EJavaClass",
        "EIntegerObject", "ELongObject", "EBooleanObject", "EDoubleObject", "EFloatObject"
    );

    private DataTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 제공 데이터 타입인지 확인.
     *
     * @param typeName 타입 이름
     * @return 기본 제공 타입이면 true
     */
    public static boolean isBuiltIn(String typeName) {
        return typeName != null && BUILT_IN.contains(typeName);
    }

    /**
     * 기본 제공 데이터 타입 이름 전체.
     *
     * @return 불변 집합
     */
    public static Set<String> builtIn() {
        return BUILT_IN;
    }
}
