package com.ryuqq.evolution.core.spi;

/**
 * Thrown by a {@link MetamodelStore} when a mutation would break a schema constraint
 * (duplicate name, unknown data type, invalid bounds, removing a class that is still referenced).
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public class SchemaConstraintViolationException extends RuntimeException {

    public SchemaConstraintViolationException(String message) {
        super(message);
    }
}
