package com.ryuqq.evolution.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.evolution.core.statemachine.LifecycleState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>AMBIGUOUS → PENDING → APPLIED / FAILED 정상 전이</li>
 *   <li>AMBIGUOUS → APPLIED / FAILED 직접 전이 불가</li>
 *   <li>종료 상태에서의 전이 불가</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_AmbiguousToPending_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(AMBIGUOUS, PENDING));
    }

    @Test
    void transition_ResolvedFlowToApplied_Succeeds() {
        // Given
        LifecycleState state = AMBIGUOUS;

        // When
        state = StateTransition.transition(state, PENDING);
        state = StateTransition.transition(state, APPLIED);

        // Then
        assertEquals(APPLIED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_PendingToFailed_Succeeds() {
        assertEquals(FAILED, StateTransition.transition(PENDING, FAILED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_AmbiguousToApplied_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(AMBIGUOUS, APPLIED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_AmbiguousToFailed_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(AMBIGUOUS, FAILED));
    }

    @Test
    void validate_PendingToAmbiguous_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PENDING, AMBIGUOUS));
    }

    @Test
    void validate_AppliedToPending_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(APPLIED, PENDING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_FailedToApplied_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(FAILED, APPLIED));
    }

    @Test
    void validate_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, PENDING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(PENDING, null));
    }

    @Test
    void lifecycleState_InitialAndTerminalFlags() {
        assertTrue(PENDING.isInitial());
        assertTrue(AMBIGUOUS.isInitial());
        assertFalse(APPLIED.isInitial());
        assertTrue(FAILED.isTerminal());
        assertFalse(AMBIGUOUS.isTerminal());
    }
}
