package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

import java.util.List;

/**
 * 새 클래스 추가 의도.
 *
 * @param className 추가할 클래스 이름 (모호 상태에서는 null 가능)
 * @param superTypes 상위 타입 이름 목록 (null이면 빈 목록)
 * @param abstractClass 추상 클래스 여부
 * @param interfaceClass 인터페이스 여부
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record AddClassIntent(
    String className,
    List<String> superTypes,
    boolean abstractClass,
    boolean interfaceClass
) implements MutationIntent {

    public AddClassIntent {
        superTypes = superTypes == null ? List.of() : List.copyOf(superTypes);
    }

    @Override
    public IntentAction action() {
        return IntentAction.ADD_CLASS;
    }

    @Override
    public AddClassIntent withResolution(Details resolution) {
        return new AddClassIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.names(resolution, IntentFields.SUPER_TYPES, superTypes),
            Overrides.bool(resolution, IntentFields.ABSTRACT, abstractClass),
            Overrides.bool(resolution, IntentFields.INTERFACE, interfaceClass)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitAddClass(this);
    }
}
