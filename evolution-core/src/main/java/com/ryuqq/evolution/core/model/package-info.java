/**
 * Core domain model package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.model.OperationId} - Stable operation identifier</li>
 *   <li>{@link com.ryuqq.evolution.core.model.ChangeType} - add / remove / modify</li>
 *   <li>{@link com.ryuqq.evolution.core.model.ElementKind} - class / attribute / reference</li>
 * </ul>
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.model.EvolutionOperation} - The ledger's unit of record, carrying
 *       the verbatim change, the mutation intent and the lifecycle state</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 *   <li><strong>Guarded transitions:</strong> Every state change goes through the state machine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.model;
