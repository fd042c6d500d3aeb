package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 참조 삭제 의도.
 *
 * @param className 참조를 가진 클래스 이름
 * @param referenceName 삭제할 참조 이름
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record RemoveReferenceIntent(
    String className,
    String referenceName
) implements MutationIntent {

    @Override
    public IntentAction action() {
        return IntentAction.REMOVE_REFERENCE;
    }

    @Override
    public RemoveReferenceIntent withResolution(Details resolution) {
        return new RemoveReferenceIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.string(resolution, IntentFields.REFERENCE_NAME, referenceName)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitRemoveReference(this);
    }
}
