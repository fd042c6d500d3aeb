package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 클래스 간 참조 추가 의도.
 *
 * @param sourceClassName 참조를 소유할 클래스 이름
 * @param targetClassName 참조 대상 클래스 이름
 * @param referenceName 참조 이름
 * @param containment 포함 참조 여부
 * @param lowerBound 하한
 * @param upperBound 상한 (-1 = many, 그대로 보존)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record AddReferenceIntent(
    String sourceClassName,
    String targetClassName,
    String referenceName,
    boolean containment,
    int lowerBound,
    int upperBound
) implements MutationIntent {

    @Override
    public IntentAction action() {
        return IntentAction.ADD_REFERENCE;
    }

    @Override
    public AddReferenceIntent withResolution(Details resolution) {
        return new AddReferenceIntent(
            Overrides.string(resolution, IntentFields.SOURCE_CLASS_NAME, sourceClassName),
            Overrides.string(resolution, IntentFields.TARGET_CLASS_NAME, targetClassName),
            Overrides.string(resolution, IntentFields.REFERENCE_NAME, referenceName),
            Overrides.bool(resolution, IntentFields.CONTAINMENT, containment),
            Overrides.integer(resolution, IntentFields.LOWER_BOUND, lowerBound),
            Overrides.integer(resolution, IntentFields.UPPER_BOUND, upperBound)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitAddReference(this);
    }
}
