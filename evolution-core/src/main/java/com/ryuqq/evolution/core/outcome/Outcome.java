package com.ryuqq.evolution.core.outcome;

/**
 * 단일 Evolution Operation의 적용 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: Store에 반영됨 → APPLIED</li>
 *   <li>{@link Fail}: 반영 실패 → FAILED (자동 재시도 없음)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용된 구현을 컴파일 타임에 제한합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Fail fail) {
 *     operation.markFailed(fail.code(), fail.message());
 * } else {
 *     operation.markApplied();
 * }
 * </pre>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
