package com.ryuqq.evolution.core.spi;

import com.ryuqq.evolution.core.schema.AttributeInfo;
import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.schema.ReferenceInfo;

import java.util.List;
import java.util.Optional;

/**
 * Metamodel Store SPI: the schema graph the evolution pipeline reads and mutates.
 *
 * <p>The store owns classes, attributes and references. The core reads it to detect ambiguity
 * at interpretation time and mutates it at apply time. It never holds on to store objects:
 * every call names its target, and the store resolves the name when the call happens.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Class and feature lookup by name</li>
 *   <li>Creation of classes, attributes and references</li>
 *   <li>Removal of classes, attributes and references</li>
 *   <li>In-place modification: rename, retype, rebound, retarget, containment, supertype list replace</li>
 * </ul>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>{@link ElementNotFoundException}: a named class or feature does not exist at call time</li>
 *   <li>{@link SchemaConstraintViolationException}: the mutation would break a schema constraint</li>
 *   <li>{@link IllegalArgumentException}: a required argument is null or blank</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Upper bound -1 ("many") must be stored and reported verbatim</li>
 *   <li>Queries return snapshots; later mutations do not change previously returned objects</li>
 *   <li>Access must be serialized if more than one evolution session shares a store</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public interface MetamodelStore {

    // ========== Queries ==========

    /**
     * Finds a class by name.
     *
     * @param name the class name
     * @return the class snapshot, or empty if no class has that name (or name is null)
     */
    Optional<ClassInfo> findClassByName(String name);

    /**
     * Returns every class in the schema, in declaration order.
     *
     * @return class snapshots (may be empty)
     */
    List<ClassInfo> getAllClasses();

    /**
     * Returns the attributes declared on a class.
     *
     * @param classInfo the class (resolved by name)
     * @return attribute snapshots in declaration order
     * @throws ElementNotFoundException if the class no longer exists
     */
    List<AttributeInfo> getClassAttributes(ClassInfo classInfo);

    /**
     * Returns the references declared on a class.
     *
     * @param classInfo the class (resolved by name)
     * @return reference snapshots in declaration order
     * @throws ElementNotFoundException if the class no longer exists
     */
    List<ReferenceInfo> getClassReferences(ClassInfo classInfo);

    // ========== Creation ==========

    /**
     * Creates a class.
     *
     * @param name class name
     * @param superTypes names of existing supertypes (may be empty)
     * @param abstractClass abstract flag
     * @param interfaceClass interface flag
     * @return the created class
     * @throws SchemaConstraintViolationException if the name is taken
     * @throws ElementNotFoundException if a supertype does not exist
     */
    ClassInfo createClass(String name, List<String> superTypes, boolean abstractClass, boolean interfaceClass);

    /**
     * Adds an attribute to a class.
     *
     * @param className owning class
     * @param attributeName attribute name
     * @param type data type name
     * @param lowerBound lower bound
     * @param upperBound upper bound (-1 = many)
     * @return the created attribute
     * @throws ElementNotFoundException if the class does not exist
     * @throws SchemaConstraintViolationException if the name is taken, the type is unknown or the bounds are invalid
     */
    AttributeInfo addAttribute(String className, String attributeName, String type, int lowerBound, int upperBound);

    /**
     * Adds a reference from one class to another.
     *
     * @param sourceClassName owning class
     * @param targetClassName referenced class
     * @param referenceName reference name
     * @param containment containment flag
     * @param lowerBound lower bound
     * @param upperBound upper bound (-1 = many)
     * @return the created reference
     * @throws ElementNotFoundException if the source or target class does not exist
     * @throws SchemaConstraintViolationException if the name is taken or the bounds are invalid
     */
    ReferenceInfo addReference(String sourceClassName, String targetClassName, String referenceName,
                               boolean containment, int lowerBound, int upperBound);

    // ========== Removal ==========

    /**
     * Removes a class.
     *
     * @param className class to remove
     * @throws ElementNotFoundException if the class does not exist
     * @throws SchemaConstraintViolationException if other classes still reference it
     */
    void removeClass(String className);

    /**
     * Removes an attribute.
     *
     * @param className owning class
     * @param attributeName attribute to remove
     * @throws ElementNotFoundException if the class or attribute does not exist
     */
    void removeAttribute(String className, String attributeName);

    /**
     * Removes a reference.
     *
     * @param className owning class
     * @param referenceName reference to remove
     * @throws ElementNotFoundException if the class or reference does not exist
     */
    void removeReference(String className, String referenceName);

    // ========== Class modification ==========

    /**
     * Renames a class. References and supertype entries naming it follow the rename.
     *
     * @param className current name
     * @param newName new name
     * @throws ElementNotFoundException if the class does not exist
     * @throws SchemaConstraintViolationException if the new name is taken
     */
    void renameClass(String className, String newName);

    void setClassAbstract(String className, boolean abstractClass);

    void setClassInterface(String className, boolean interfaceClass);

    /**
     * Clears the supertype list of a class and rebuilds it from the given names.
     *
     * @param className class to modify
     * @param superTypes names of the new supertypes, in order
     * @throws ElementNotFoundException if the class or any supertype does not exist
     */
    void replaceSuperTypes(String className, List<String> superTypes);

    // ========== Attribute modification ==========

    /**
     * Renames an attribute.
     *
     * @param className owning class
     * @param attributeName current attribute name
     * @param newName new attribute name
     * @throws ElementNotFoundException if the class or attribute does not exist
     * @throws SchemaConstraintViolationException if the new name is taken on the class
     */
    void renameAttribute(String className, String attributeName, String newName);

    /**
     * Changes the data type of an attribute.
     *
     * @param className owning class
     * @param attributeName attribute name
     * @param type new data type name
     * @throws ElementNotFoundException if the class or attribute does not exist
     * @throws SchemaConstraintViolationException if the type is unknown
     */
    void retypeAttribute(String className, String attributeName, String type);

    void setAttributeLowerBound(String className, String attributeName, int lowerBound);

    void setAttributeUpperBound(String className, String attributeName, int upperBound);

    // ========== Reference modification ==========

    void renameReference(String className, String referenceName, String newName);

    /**
     * Points a reference at another class.
     *
     * @param className owning class
     * @param referenceName reference name
     * @param targetClassName new target class
     * @throws ElementNotFoundException if the class, reference or target does not exist
     */
    void retargetReference(String className, String referenceName, String targetClassName);

    void setReferenceContainment(String className, String referenceName, boolean containment);

    void setReferenceLowerBound(String className, String referenceName, int lowerBound);

    void setReferenceUpperBound(String className, String referenceName, int upperBound);
}
