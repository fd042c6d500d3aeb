package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

import java.util.List;

/**
 * 클래스 수정 의도.
 *
 * <p>{@code new*} 필드가 null이면 해당 속성은 변경하지 않습니다.
 * {@code newSuperTypes}가 주어지면 상위 타입 목록 전체를 비우고 다시 구성합니다.</p>
 *
 * @param className 수정할 클래스 이름
 * @param newName 새 이름 (null = 유지)
 * @param newSuperTypes 새 상위 타입 목록 (null = 유지)
 * @param newAbstract 새 추상 여부 (null = 유지)
 * @param newInterface 새 인터페이스 여부 (null = 유지)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record ModifyClassIntent(
    String className,
    String newName,
    List<String> newSuperTypes,
    Boolean newAbstract,
    Boolean newInterface
) implements MutationIntent {

    public ModifyClassIntent {
        if (newSuperTypes != null) {
            newSuperTypes = List.copyOf(newSuperTypes);
        }
    }

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
        return IntentAction.MODIFY_CLASS;
    }

    @Override
    public ModifyClassIntent withResolution(Details resolution) {
        return new ModifyClassIntent(
            Overrides.string(resolution, IntentFields.CLASS_NAME, className),
            Overrides.string(resolution, IntentFields.NEW_NAME, newName),
            Overrides.names(resolution, IntentFields.NEW_SUPER_TYPES, newSuperTypes),
            Overrides.bool(resolution, IntentFields.NEW_ABSTRACT, newAbstract),
            Overrides.bool(resolution, IntentFields.NEW_INTERFACE, newInterface)
        );
    }

    @Override
    public <R> R accept(IntentVisitor<R> visitor) {
        return visitor.visitModifyClass(this);
    }
}
