/**
 * Read-only schema views exchanged with the Metamodel Store.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.schema.ClassInfo} - Class snapshot (name, supertypes, flags)</li>
 *   <li>{@link com.ryuqq.evolution.core.schema.AttributeInfo} - Attribute snapshot (type, bounds)</li>
 *   <li>{@link com.ryuqq.evolution.core.schema.ReferenceInfo} - Reference snapshot (target, containment, bounds)</li>
 *   <li>{@link com.ryuqq.evolution.core.schema.Cardinality} - Bound constants, including the "many" sentinel (-1)</li>
 *   <li>{@link com.ryuqq.evolution.core.schema.DataTypes} - Built-in primitive data type names</li>
 * </ul>
 *
 * <p>Snapshots are values, not live handles: the applier re-resolves every name through the
 * store at apply time.</p>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.schema;
