package com.ryuqq.evolution.core.spi;

/**
 * Thrown by a {@link MetamodelStore} when a named class or feature does not exist.
 *
 * <p>At apply time this usually means the schema changed between interpretation and
 * application. The batch applier turns it into a per-operation failure.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public class ElementNotFoundException extends RuntimeException {

    public ElementNotFoundException(String message) {
        super(message);
    }

    /**
     * Missing class.
     *
     * @param className the class name that could not be resolved
     * @return exception instance
     */
    public static ElementNotFoundException forClass(String className) {
        return new ElementNotFoundException("Class " + className + " not found");
    }

    /**
     * Missing attribute.
     *
     * @param className owning class name
     * @param attributeName attribute name that could not be resolved
     * @return exception instance
     */
    public static ElementNotFoundException forAttribute(String className, String attributeName) {
        return new ElementNotFoundException("Attribute " + attributeName + " not found in class " + className);
    }

    /**
     * Missing reference.
     *
     * @param className owning class name
     * @param referenceName reference name that could not be resolved
     * @return exception instance
     */
    public static ElementNotFoundException forReference(String className, String referenceName) {
        return new ElementNotFoundException("Reference " + referenceName + " not found in class " + className);
    }
}
