package com.ryuqq.evolution.core.outcome;

/**
 * 적용 실패.
 *
 * <p>Store가 이름을 찾지 못했거나 제약을 위반하여 변경을 반영할 수 없는 경우를 나타냅니다.
 * 실패 분류와 메시지는 그대로 Operation의 실패 정보가 됩니다.</p>
 *
 * @param code 실패 분류
 * @param message 실패 상세 (Store가 보고한 메시지)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record Fail(
    FailureCode code,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 message가 비어있는 경우
     */
    public Fail {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fail of(FailureCode code, String message) {
        return new Fail(code, message);
    }
}
