package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.model.ChangeType;
import com.ryuqq.evolution.core.model.ElementKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 인식 가능한 9가지 (변경 종류, 요소 종류) 조합.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public enum IntentAction {

    ADD_CLASS(ChangeType.ADD, ElementKind.CLASS,
        IntentFields.CLASS_NAME, IntentFields.SUPER_TYPES, IntentFields.ABSTRACT, IntentFields.INTERFACE),
    ADD_ATTRIBUTE(ChangeType.ADD, ElementKind.ATTRIBUTE,
        IntentFields.CLASS_NAME, IntentFields.ATTRIBUTE_NAME, IntentFields.ATTRIBUTE_TYPE,
        IntentFields.LOWER_BOUND, IntentFields.UPPER_BOUND),
    ADD_REFERENCE(ChangeType.ADD, ElementKind.REFERENCE,
        IntentFields.SOURCE_CLASS_NAME, IntentFields.TARGET_CLASS_NAME, IntentFields.REFERENCE_NAME,
        IntentFields.CONTAINMENT, IntentFields.LOWER_BOUND, IntentFields.UPPER_BOUND),
    REMOVE_CLASS(ChangeType.REMOVE, ElementKind.CLASS,
        IntentFields.CLASS_NAME),
    REMOVE_ATTRIBUTE(ChangeType.REMOVE, ElementKind.ATTRIBUTE,
        IntentFields.CLASS_NAME, IntentFields.ATTRIBUTE_NAME),
    REMOVE_REFERENCE(ChangeType.REMOVE, ElementKind.REFERENCE,
        IntentFields.CLASS_NAME, IntentFields.REFERENCE_NAME),
    MODIFY_CLASS(ChangeType.MODIFY, ElementKind.CLASS,
        IntentFields.CLASS_NAME, IntentFields.NEW_NAME, IntentFields.NEW_SUPER_TYPES,
        IntentFields.NEW_ABSTRACT, IntentFields.NEW_INTERFACE),
    MODIFY_ATTRIBUTE(ChangeType.MODIFY, ElementKind.ATTRIBUTE,
        IntentFields.CLASS_NAME, IntentFields.ATTRIBUTE_NAME, IntentFields.NEW_NAME, IntentFields.NEW_TYPE,
        IntentFields.NEW_LOWER_BOUND, IntentFields.NEW_UPPER_BOUND),
    MODIFY_REFERENCE(ChangeType.MODIFY, ElementKind.REFERENCE,
        IntentFields.CLASS_NAME, IntentFields.REFERENCE_NAME, IntentFields.NEW_NAME,
        IntentFields.NEW_TARGET_CLASS_NAME, IntentFields.NEW_CONTAINMENT,
        IntentFields.NEW_LOWER_BOUND, IntentFields.NEW_UPPER_BOUND);

    private final ChangeType changeType;
    private final ElementKind elementKind;
    private final Set<String> resolutionKeys;

    IntentAction(ChangeType changeType, ElementKind elementKind, String... resolutionKeys) {
        this.changeType = changeType;
        this.elementKind = elementKind;
        this.resolutionKeys = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(resolutionKeys)));
    }

    public ChangeType changeType() {
        return changeType;
    }

    public ElementKind elementKind() {
        return elementKind;
    }

    /**
     * 이 조합의 의도가 resolution으로 받을 수 있는 키 ({@link IntentFields}).
     *
     * @return 불변 키 집합 (선언 순서)
     */
    public Set<String> resolutionKeys() {
        return resolutionKeys;
    }

    /**
     * 조합에 해당하는 IntentAction 조회.
     *
     * @param changeType 변경 종류 (null 허용)
     * @param elementKind 요소 종류 (null 허용)
     * @return 해당 IntentAction, 조합이 없으면 empty
     */
    public static Optional<IntentAction> of(ChangeType changeType, ElementKind elementKind) {
        for (IntentAction action : values()) {
            if (action.changeType == changeType && action.elementKind == elementKind) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    /**
     * 원문 문자열 조합에 해당하는 IntentAction 조회.
     *
     * @param changeType 변경 종류 원문
     * @param elementKind 요소 종류 원문
     * @return 해당 IntentAction, 해석할 수 없으면 empty
     */
    public static Optional<IntentAction> parse(String changeType, String elementKind) {
        Optional<ChangeType> type = ChangeType.from(changeType);
        Optional<ElementKind> kind = ElementKind.from(elementKind);
        if (type.isEmpty() || kind.isEmpty()) {
            return Optional.empty();
        }
        return of(type.get(), kind.get());
    }
}
