package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 클래스에 속성 추가 의도.
 *
 * @param className 대상 클래스 이름
 * @param attributeName 속성 이름
 * @param attributeType 데이터 타입 이름
 * @param lowerBound 하한
 * @param upperBound 상한 (-1 = many, 그대로 보존)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record AddAttributeIntent(
    String className,
    String attributeName,
    String attributeType,
    int lowerBound,
    int upperBound
) implements MutationIntent {

    @Override
    public IntentAction action() {
        return IntentAction.ADD_ATTRIBUTE;
    }

    @Override
    public AddAttributeIntent withResolution(Details resolution) {
        return new AddAttributeIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.string(resolution, IntentFields.ATTRIBUTE_NAME, attributeName),
            Overrides.string(resolution, IntentFields.ATTRIBUTE_TYPE, attributeType),
            Overrides.integer(resolution, IntentFields.LOWER_BOUND, lowerBound),
            Overrides.integer(resolution, IntentFields.UPPER_BOUND, upperBound)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitAddAttribute(this);
    }
}
