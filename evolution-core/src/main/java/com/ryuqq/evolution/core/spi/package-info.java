/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interface that schema storage adapters implement so the
 * evolution pipeline can read and mutate a metamodel.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.spi.MetamodelStore} - Schema lookup and mutation primitives</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.evolution.core.spi.ElementNotFoundException} - Named element missing at call time</li>
 *   <li>{@link com.ryuqq.evolution.core.spi.SchemaConstraintViolationException} - Mutation would break a schema constraint</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., evolution-adapter-inmemory, or an adapter over an EMF resource set)
 * provide concrete implementations. Loading and saving schema files belongs to the adapter,
 * not to the core.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> The store is injected at construction, never looked up globally</li>
 *   <li><strong>Pluggability:</strong> Tests run against the in-memory store or a Mockito mock</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Evolution Team
 */
package com.ryuqq.evolution.core.spi;
