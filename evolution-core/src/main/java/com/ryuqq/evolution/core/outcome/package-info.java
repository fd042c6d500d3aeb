/**
 * Per-operation apply outcomes.
 *
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.outcome.Ok} - the intent was applied to the store</li>
 *   <li>{@link com.ryuqq.evolution.core.outcome.Fail} - the intent  could not be applied; carries a {@link com.ryuqq.evolution.core.outcome.FailureCode}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.outcome;
