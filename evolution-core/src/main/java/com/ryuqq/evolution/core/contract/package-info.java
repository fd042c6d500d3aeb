/**
 * Input contract of the evolution pipeline.
 *
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.contract.ChangeDescriptor} - A model-level change as described by the domain expert</li>
 *   <li>{@link com.ryuqq.evolution.core.contract.Details} - Loosely-typed key/value payload with typed accessors</li>
 *   <li>{@link com.ryuqq.evolution.core.contract.DetailKeys} - Recognized descriptor keys</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.contract;
