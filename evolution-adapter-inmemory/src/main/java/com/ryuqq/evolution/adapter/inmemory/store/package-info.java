/**
 * In-memory MetamodelStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.evolution.core.spi.MetamodelStore} SPI for tests, demos and
 * single-process tooling.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.adapter.inmemory.store.InMemoryMetamodelStore}:
 *       synchronized, insertion-ordered schema held in memory</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No schema file loading or serialization</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * public class MyStoreContractTest extends AbstractMetamodelStoreContractTest {
 *     {@literal @}Override
 *     protected MetamodelStore createStore() {
 *         return new InMemoryMetamodelStore();
 *     }
 * }
 * </pre>
 *
 * @see com.ryuqq.evolution.core.spi.MetamodelStore
 * @author Evolution Team
 * @since 1.0.0
 */
package com.ryuqq.evolution.adapter.inmemory.store;
