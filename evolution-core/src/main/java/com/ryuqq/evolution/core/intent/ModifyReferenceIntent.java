package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 참조 수정 의도 (이름 변경, 대상 변경, 포함 여부, 다중성 변경).
 *
 * @param className 참조를 가진 클래스 이름
 * @param referenceName 수정할 참조 이름
 * @param newName 새 이름 (null = 유지)
 * @param newTargetClassName 새 대상 클래스 이름 (null = 유지)
 * @param newContainment 새 포함 여부 (null = 유지)
 * @param newLowerBound 새 하한 (null = 유지)
 * @param newUpperBound 새 상한 (null = 유지, -1 = many)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record ModifyReferenceIntent(
    String className,
    String referenceName,
    String newName,
    String newTargetClassName,
    Boolean newContainment,
    Integer newLowerBound,
    Integer newUpperBound
) implements MutationIntent {

    /**
     * 이름 변경이 요청되었는지 확인.
     *
     * @return newName이 비어있지 않으면 true
     */
    public boolean isRename() {
        return newName != null && !newName.isBlank();
    }

    /**
     * 대상 변경이 요청되었는지 확인.
     *
     * @return newTargetClassName이 비어있지 않으면 true
     */
    public boolean isRetarget() {
        return newTargetClassName != null && !newTargetClassName.isBlank();
    }

    @Override
    public IntentAction action() {
        return IntentAction.MODIFY_REFERENCE;
    }

    @Override
    public ModifyReferenceIntent withResolution(Details resolution) {
        return new ModifyReferenceIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.string(resolution, IntentFields.REFERENCE_NAME, referenceName),
            Overrides.string(resolution, IntentFields.NEW_NAME, newName),
            Overrides.string(resolution, IntentFields.NEW_TARGET_CLASS_NAME, newTargetClassName),
            Overrides.bool(resolution, IntentFields.NEW_CONTAINMENT, newContainment),
            Overrides.integer(resolution, IntentFields.NEW_LOWER_BOUND, newLowerBound),
            Overrides.integer(resolution, IntentFields.NEW_UPPER_BOUND, newUpperBound)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitModifyReference(this);
    }
}
