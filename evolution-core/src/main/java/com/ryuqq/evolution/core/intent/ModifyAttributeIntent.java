package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * 속성 수정 의도 (이름 변경, 타입 변경, 다중성 변경).
 *
 * @param className 속성을 가진 클래스 이름
 * @param attributeName 수정할 속성 이름
 * @param newName 새 이름 (null = 유지)
 * @param newType 새 데이터 타입 (null = 유지)
 * @param newLowerBound 새 하한 (null = 유지)
 * @param newUpperBound 새 상한 (null = 유지, -1 = many)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record ModifyAttributeIntent(
    String className,
    String attributeName,
    String newName,
    String newType,
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

    @Override
    public IntentAction action() {
        return IntentAction.MODIFY_ATTRIBUTE;
    }

    @Override
    public ModifyAttributeIntent withResolution(Details resolution) {
        return new ModifyAttributeIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.string(resolution, IntentFields.ATTRIBUTE_NAME, attributeName),
            Overrides.string(resolution, IntentFields.NEW_NAME, newName),
            Overrides.string(resolution, IntentFields.NEW_TYPE, newType),
            Overrides.integer(resolution, IntentFields.NEW_LOWER_BOUND, newLowerBound),
            Overrides.integer(resolution, IntentFields.NEW_UPPER_BOUND, newUpperBound)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitModifyAttribute(this);
    }
}
