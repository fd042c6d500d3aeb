package com.ryuqq.evolution.core.contract;

/**
 * Change Descriptor {@code details}에서 사용하는 키.
 *
 * <p>요소 종류별로 사용하는 키:</p>
 * <ul>
 *   <li>class: name, superTypes, abstract, interface / newName, newSuperTypes, newAbstract, newInterface</li>
 *   <li>attribute: className, name, type, lowerBound, upperBound / newName, newType, newLowerBound, newUpperBound</li>
 *   <li>reference: sourceClassName, targetClassName, className, name, containment, lowerBound, upperBound /
 *       newName, newTargetClassName, newContainment, newLowerBound, newUpperBound</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class DetailKeys {

    public static final String NAME = "name";
    public static final String CLASS_NAME = "className";
    public static final String SUPER_TYPES = "superTypes";
    public static final String ABSTRACT = "abstract";
    public static final String INTERFACE = "interface";
    public static final String TYPE = "type";
    public static final String SOURCE_CLASS_NAME = "sourceClassName";
    public static final String TARGET_CLASS_NAME = "targetClassName";
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

    private DetailKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
