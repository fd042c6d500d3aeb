package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;

/**
 * Store에 수행할 구체적인 스키마 변경 의도.
 *
 * <p>9가지 변형으로 닫힌 sealed 계층입니다. 각 변형은 적용에 필요한 매개변수를
 * 이름 기반으로 보관하며, Store 객체 참조는 보관하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변형은 record이며, 모호성 해소 시에는
 * {@link #withResolution(Details)}로 새 인스턴스를 만들어 교체합니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public sealed interface MutationIntent permits
    AddClassIntent, AddAttributeIntent, AddReferenceIntent,
    RemoveClassIntent, RemoveAttributeIntent, RemoveReferenceIntent,
    ModifyClassIntent, ModifyAttributeIntent, ModifyReferenceIntent {

    /**
     * 이 의도의 (변경 종류, 요소 종류) 조합.
     *
     * @return IntentAction
     */
    IntentAction action();

    /**
     * resolution 데이터를 병합한 새 의도 생성.
     *
     * <p>값이 주어진 필드만 덮어쓰고, 나머지는 기존 값을 유지합니다.
     * 병합 후 재검증은 하지 않습니다.</p>
     *
     * @param resolution 해소 데이터 ({@link IntentFields} 키 사용)
     * @return 병합된 새 의도
     * @throws IllegalArgumentException resolution 값의 형태가 잘못된 경우
     */
    MutationIntent withResolution(Details resolution);

    /**
     * 방문자 디스패치.
     *
     * @param visitor 방문자
     * @param <R> 결과 타입
     * @return 방문 결과
     */
    <R> R accept(IntentVisitor<R> visitor);
}
