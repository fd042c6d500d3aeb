/**
 * Mutation intents: the closed set of nine schema changes the pipeline can apply.
 *
 * <h2>Variants</h2>
 * <pre>
 *            CLASS              ATTRIBUTE              REFERENCE
 * ADD     AddClassIntent     AddAttributeIntent     AddReferenceIntent
 * REMOVE  RemoveClassIntent  RemoveAttributeIntent  RemoveReferenceIntent
 * MODIFY  ModifyClassIntent  ModifyAttributeIntent  ModifyReferenceIntent
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Closed hierarchy:</strong> {@link com.ryuqq.evolution.core.intent.MutationIntent} is sealed;
 *       {@link com.ryuqq.evolution.core.intent.IntentVisitor} gives exhaustive dispatch</li>
 *   <li><strong>Names, not handles:</strong> intents bind to schema elements by name only</li>
 *   <li><strong>Immutability:</strong> resolution produces a new intent instance</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.intent;
