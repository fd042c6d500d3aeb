/**
 * Evolution Operation lifecycle state machine package.
 *
 * <p>This package implements the state transition rules for the staged operation lifecycle
 * (pending → ambiguous → resolved → applied/failed).</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.statemachine.LifecycleState} - Operation lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.evolution.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * AMBIGUOUS → PENDING (resolution)
 * PENDING → APPLIED (apply success)
 * PENDING → FAILED (apply failure)
 *
 * Forbidden:
 * - APPLIED → * (terminal state)
 * - FAILED → * (terminal state)
 * - AMBIGUOUS → APPLIED / FAILED (must be resolved first)
 * - PENDING → AMBIGUOUS
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * LifecycleState state = LifecycleState.AMBIGUOUS;
 * state = StateTransition.transition(state, LifecycleState.PENDING);
 * state = StateTransition.transition(state, LifecycleState.APPLIED);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, LifecycleState.PENDING);
 * </pre>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.statemachine;
