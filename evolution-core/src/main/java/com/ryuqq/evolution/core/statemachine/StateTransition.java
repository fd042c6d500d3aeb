package com.ryuqq.evolution.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>Evolution Operation의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>AMBIGUOUS → PENDING</li>
 *   <li>PENDING → APPLIED</li>
 *   <li>PENDING → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(APPLIED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>AMBIGUOUS에서 곧바로 종료 상태로 전이 불가</li>
 *   <li>PENDING → AMBIGUOUS 자동 역전이 불가</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(LifecycleState from, LifecycleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case AMBIGUOUS -> to == LifecycleState.PENDING;
            case PENDING -> to == LifecycleState.APPLIED || to == LifecycleState.FAILED;
            case APPLIED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static LifecycleState transition(LifecycleState current, LifecycleState next) {
        validate(current, next);
        return next;
    }
}
