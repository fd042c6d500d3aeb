package com.ryuqq.evolution.core.intent;

/**
 * 9가지 변경 의도에 대한 이중 디스패치.
 *
 * <p>새 의도 변형이 추가되면 모든 구현체가 컴파일 단계에서 누락을 드러냅니다.</p>
 *
 * @param <R> 방문 결과 타입
 * @author Evolution Team
 * @since 1.0.0
 */
public interface IntentVisitor<R> {

    R visitAddClass(AddClassIntent intent);

    R visitAddAttribute(AddAttributeIntent intent);

    R visitAddReference(AddReferenceIntent intent);

    R visitRemoveClass(RemoveClassIntent intent);

    R visitRemoveAttribute(RemoveAttributeIntent intent);

    R visitRemoveReference(RemoveReferenceIntent intent);

    R visitModifyClass(ModifyClassIntent intent);

    R visitModifyAttribute(ModifyAttributeIntent intent);

    R visitModifyReference(ModifyReferenceIntent intent);
}
