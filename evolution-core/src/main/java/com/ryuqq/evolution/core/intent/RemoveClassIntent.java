package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 클래스 삭제 의도.
 *
 * @param className 삭제할 클래스 이름
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record RemoveClassIntent(String className) implements MutationIntent {

    @Override
    public IntentAction action() {
        return IntentAction.REMOVE_CLASS;
    }

    @Override
    public RemoveClassIntent withResolution(Details resolution) {
        return new RemoveClassIntent(Overrides.string(resolution, IntentFields.CLASS_NAME, className));
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitRemoveClass(this);
    }
}
