package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 속성 삭제 의도.
 *
 * @param className 속성을 가진 클래스 이름
 * @param attributeName 삭제할 속성 이름
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record RemoveAttributeIntent(
    String className,
    String attributeName
) implements MutationIntent {

    @Override
    public IntentAction action() {
        return IntentAction.REMOVE_ATTRIBUTE;
    }

    @Override
    public RemoveAttributeIntent withResolution(Details resolution) {
        return new RemoveAttributeIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.string(resolution, IntentFields.ATTRIBUTE_NAME, attributeName)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitRemoveAttribute(this);
    }
}
