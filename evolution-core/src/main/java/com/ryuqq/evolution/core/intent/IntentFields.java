package com.ryuqq.evolution.core.intent;

/**
 * 변경 의도 필드 이름.
 *
 * <p>모호성 해소 데이터(resolution)는 이 이름을 키로 사용해 의도의 필드를 덮어씁니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class IntentFields {

    public static final String CLASS_NAME = "className";
    public static final String SUPER_TYPES = "superTypes";
    public static final String ABSTRACT = "abstract";
    public static final String INTERFACE = "interface";

    public static final String ATTRIBUTE_NAME = "attributeName";
    public static final String ATTRIBUTE_TYPE = "attributeType";

    public static final String SOURCE_CLASS_NAME = "sourceClassName";
    public static final String TARGET_CLASS_NAME = "targetClassName";
    public static final String REFERENCE_NAME = "referenceName";
    public static final String CONTAINMENT = "containment";

    public static final String LOWER_BOUND = "lowerBound";
    public static final String UPPER_BOUND = "upperBound";

    public static final String NEW_NAME = "newName";
    public static final String NEW_SUPER_TYPES = "newSuperTypes";
    public static final String NEW_ABSTRACT = "newAbstract";
    public static final String NEW_INTERFACE = "newInterface";
    public static final String NEW_TYPE = "newType";
    public static final String NEW_TARGET_CLASS_NAME = "newTargetClassName";
    public static final String NEW_CONTAINMENT = "newContainment";
    public static final String NEW_LOWER_BOUND = "newLowerBound";
    public static final String NEW_UPPER_BOUND = "newUpperBound";

    private IntentFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
