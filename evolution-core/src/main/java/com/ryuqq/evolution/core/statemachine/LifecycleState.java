package com.ryuqq.evolution.core.statemachine;

/**
 * Evolution Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>AMBIGUOUS → PENDING (모호성 해소)</li>
 *   <li>PENDING → APPLIED (적용 성공)</li>
 *   <li>PENDING → FAILED (적용 실패)</li>
 *   <li><strong>종료 상태에서의 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * (해석)
 *    ├─► PENDING ─────────┬─► APPLIED (성공)
 *    │      ▲             │
 *    │      │ (해소)       └─► FAILED (실패)
 *    └─► AMBIGUOUS
 *
 * 금지된 전이:
 * - AMBIGUOUS → APPLIED ❌
 * - AMBIGUOUS → FAILED ❌
 * - PENDING → AMBIGUOUS ❌
 * - APPLIED → * ❌
 * - FAILED → * ❌
 * </pre>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public enum LifecycleState {

    /**
     * 적용 대기 중.
     */
    PENDING,

    /**
     * 외부 해소가 필요한 모호 상태.
     */
    AMBIGUOUS,

    /**
     * 스키마에 적용 완료.
     */
    APPLIED,

    /**
     * 적용 실패 (재시도 없음).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(APPLIED, FAILED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return APPLIED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == APPLIED || this == FAILED;
    }

    /**
     * 해석 직후의 초기 상태인지 확인.
     *
     * @return PENDING 또는 AMBIGUOUS인 경우 true
     */
    public boolean isInitial() {
        return this == PENDING || this == AMBIGUOUS;
    }
}
