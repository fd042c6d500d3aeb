package com.ryuqq.evolution.core.outcome;

/**
 * 적용 실패 분류.
 *
 * <p>FAILED 상태의 Operation에 실패 상세와 함께 기록됩니다.
 * 실패한 Operation은 자동으로 재시도되지 않으며, 호출자가 다시 해석하여 제출해야 합니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public enum FailureCode {

    /**
     * 적용 시점에 이름으로 요소를 찾지 못함 (해석 이후 스키마가 변경된 경우).
     */
    ELEMENT_NOT_FOUND,

    /**
     * Store 제약 위반 (이름 중복, 알 수 없는 데이터 타입, 참조 중인 클래스 삭제 등).
     */
    CONSTRAINT_VIOLATION,

    /**
     * 변경 의도 없이 대기열에 올라온 Operation.
     */
    MISSING_INTENT,

    /**
     * 검증 후 적용 경로에서 현재 스키마와의 충돌 발견.
     */
    REVALIDATION_FAILED
}
