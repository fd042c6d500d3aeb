package com.ryuqq.evolution.core.schema;

/**
 * 다중성(cardinality) 상수.
 *
 * <p>상한 {@link #MANY}(-1)은 "무제한"을 뜻하며, 의도 생성부터 Store 반영까지
 * 그대로 보존되어야 합니다. 큰 유한값으로 정규화하지 않습니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class Cardinality {

    /**
     * 무제한 상한 ("many").
     */
    public static final int MANY = -1;

    /**
     * 기본 하한 (선택적).
     */
    public static final int DEFAULT_LOWER_BOUND = 0;

    /**
     * 기본 상한 (단일값).
     */
    public static final int DEFAULT_UPPER_BOUND = 1;

    private Cardinality() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상한이 무제한인지 확인.
     *
     * @param upperBound 상한
     * @return -1이면 true
     */
    public static boolean isMany(int upperBound) {
        return upperBound == MANY;
    }

    /**
     * 하한/상한 조합이 유효한지 확인.
     *
     * <p>하한은 0 이상, 상한은 {@link #MANY}이거나 1 이상이면서 하한 이상이어야 합니다.</p>
     *
     * @param lowerBound 하한
     * @param upperBound 상한
     * @return 유효하면 true
     */
    public static boolean isValid(int lowerBound, int upperBound) {
        if (lowerBound < 0) {
            return false;
        }
        if (isMany(upperBound)) {
            return true;
        }
        return upperBound >= 1 && upperBound >= lowerBound;
    }
}
