package com.ryuqq.evolution.adapter.inmemory.store;

import com.ryuqq.evolution.core.schema.AttributeInfo;
import com.ryuqq.evolution.core.schema.Cardinality;
import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.schema.DataTypes;
import com.ryuqq.evolution.core.schema.ReferenceInfo;
import com.ryuqq.evolution.core.spi.ElementNotFoundException;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import com.ryuqq.evolution.core.spi.SchemaConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of {@link MetamodelStore} SPI for testing and reference purposes.
 *
 * <p>Holds a single schema as insertion-ordered maps of mutable entries and hands out
 * immutable {@link ClassInfo} / {@link AttributeInfo} / {@link ReferenceInfo} snapshots.
 * Every public method is {@code synchronized}: the store is the only resource shared
 * between evolution sessions.</p>
 *
 * <p><strong>Schema Rules:</strong></p>
 * <ul>
 *   <li>Names are required; a null or blank name is a constraint violation</li>
 *   <li>Class names are unique; attribute and reference names share one namespace per class</li>
 *   <li>Attribute types must be built-in data types ({@link DataTypes})</li>
 *   <li>Reference types and super types must name existing classes</li>
 *   <li>Renaming a class retargets every reference and super type entry naming it</li>
 *   <li>A class still referenced by another class cannot be removed</li>
 *   <li>Removing a class drops it from the super type lists of remaining classes</li>
 *   <li>Upper bound {@link Cardinality#MANY} (-1) is stored verbatim</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No persistence, data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MetamodelStore store = new InMemoryMetamodelStore();
 * store.createClass("Customer", List.of(), false, false);
 * store.addAttribute("Customer", "email", "EString", 0, 1);
 * store.addReference("Customer", "Order", "orders", true, 0, Cardinality.MANY);
 * </pre>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public class InMemoryMetamodelStore implements MetamodelStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMetamodelStore.class);

    /**
     * Class entries keyed by name, in creation order.
     */
    private LinkedHashMap<String, ClassEntry> classes;

    /**
     * Creates a new InMemoryMetamodelStore with an empty schema.
     */
    public InMemoryMetamodelStore() {
        this.classes = new LinkedHashMap<>();
    }

    // ========== Queries ==========

    @Override
    public synchronized Optional<ClassInfo> findClassByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ClassEntry entry = classes.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.toInfo());
    }

    @Override
    public synchronized List<ClassInfo> getAllClasses() {
        List<ClassInfo> result = new ArrayList<>(classes.size());
        for (ClassEntry entry : classes.values()) {
            result.add(entry.toInfo());
        }
        return List.copyOf(result);
    }

    @Override
    public synchronized List<AttributeInfo> getClassAttributes(ClassInfo classInfo) {
        if (classInfo == null) {
            throw new IllegalArgumentException("classInfo cannot be null");
        }
        ClassEntry entry = requireClass(classInfo.name());
        List<AttributeInfo> result = new ArrayList<>(entry.attributes.size());
        for (AttributeEntry attribute : entry.attributes.values()) {
            result.add(attribute.toInfo());
        }
        return List.copyOf(result);
    }

    @Override
    public synchronized List<ReferenceInfo> getClassReferences(ClassInfo classInfo) {
        if (classInfo == null) {
            throw new IllegalArgumentException("classInfo cannot be null");
        }
        ClassEntry entry = requireClass(classInfo.name());
        List<ReferenceInfo> result = new ArrayList<>(entry.references.size());
        for (ReferenceEntry reference : entry.references.values()) {
            result.add(reference.toInfo());
        }
        return List.copyOf(result);
    }

    // ========== Creation ==========

    @Override
    public synchronized ClassInfo createClass(String name, List<String> superTypes,
                                              boolean abstractClass, boolean interfaceClass) {
        requireName(name, "name");
        if (classes.containsKey(name)) {
            throw new SchemaConstraintViolationException("Class " + name + " already exists");
        }
        List<String> resolvedSuperTypes = resolveSuperTypes(name, superTypes);

        ClassEntry entry = new ClassEntry(name, resolvedSuperTypes, abstractClass, interfaceClass);
        classes.put(name, entry);

        log.debug("Created class {} (superTypes={}, abstract={}, interface={})",
            name, resolvedSuperTypes, abstractClass, interfaceClass);
        return entry.toInfo();
    }

    @Override
    public synchronized AttributeInfo addAttribute(String className, String attributeName, String type,
                                                   int lowerBound, int upperBound) {
        requireName(attributeName, "attributeName");
        ClassEntry owner = requireClass(className);
        requireFreeFeatureName(owner, attributeName);
        requireDataType(type);
        requireBounds(lowerBound, upperBound);

        AttributeEntry attribute = new AttributeEntry(attributeName, type, lowerBound, upperBound);
        owner.attributes.put(attributeName, attribute);

        log.debug("Added attribute {}.{} : {} [{}..{}]", className, attributeName, type, lowerBound, upperBound);
        return attribute.toInfo();
    }

    @Override
    public synchronized ReferenceInfo addReference(String sourceClassName, String targetClassName,
                                                   String referenceName, boolean containment,
                                                   int lowerBound, int upperBound) {
        requireName(referenceName, "referenceName");
        ClassEntry source = requireClass(sourceClassName);
        requireClass(targetClassName);
        requireFreeFeatureName(source, referenceName);
        requireBounds(lowerBound, upperBound);

        ReferenceEntry reference = new ReferenceEntry(referenceName, targetClassName, containment, lowerBound, upperBound);
        source.references.put(referenceName, reference);

        log.debug("Added reference {}.{} -> {} (containment={}) [{}..{}]",
            sourceClassName, referenceName, targetClassName, containment, lowerBound, upperBound);
        return reference.toInfo();
    }

    // ========== Removal ==========

    @Override
    public synchronized void removeClass(String className) {
        requireClass(className);

        List<String> referencing = referencingClasses(className);
        if (!referencing.isEmpty()) {
            throw new SchemaConstraintViolationException(
                "Class " + className + " is referenced by: " + String.join(", ", referencing));
        }

        classes.remove(className);
        for (ClassEntry entry : classes.values()) {
            entry.superTypes.remove(className);
        }
        log.debug("Removed class {}", className);
    }

    @Override
    public synchronized void removeAttribute(String className, String attributeName) {
        ClassEntry owner = requireClass(className);
        if (owner.attributes.remove(attributeName) == null) {
            throw ElementNotFoundException.forAttribute(className, attributeName);
        }
        log.debug("Removed attribute {}.{}", className, attributeName);
    }

    @Override
    public synchronized void removeReference(String className, String referenceName) {
        ClassEntry owner = requireClass(className);
        if (owner.references.remove(referenceName) == null) {
            throw ElementNotFoundException.forReference(className, referenceName);
        }
        log.debug("Removed reference {}.{}", className, referenceName);
    }

    // ========== Class modification ==========

    @Override
    public synchronized void renameClass(String className, String newName) {
        requireName(newName, "newName");
        ClassEntry entry = requireClass(className);
        if (className.equals(newName)) {
            return;
        }
        if (classes.containsKey(newName)) {
            throw new SchemaConstraintViolationException("Class " + newName + " already exists");
        }

        entry.name = newName;
        classes = rekey(classes, className, newName);

        // 이름 기반 바인딩이므로 참조 타입과 상위 타입 항목도 함께 변경
        for (ClassEntry other : classes.values()) {
            other.superTypes.replaceAll(superType -> superType.equals(className) ? newName : superType);
            for (ReferenceEntry reference : other.references.values()) {
                if (reference.type.equals(className)) {
                    reference.type = newName;
                }
            }
        }
        log.debug("Renamed class {} to {}", className, newName);
    }

    @Override
    public synchronized void setClassAbstract(String className, boolean abstractClass) {
        requireClass(className).abstractClass = abstractClass;
        log.debug("Set abstract={} on class {}", abstractClass, className);
    }

    @Override
    public synchronized void setClassInterface(String className, boolean interfaceClass) {
        requireClass(className).interfaceClass = interfaceClass;
        log.debug("Set interface={} on class {}", interfaceClass, className);
    }

    @Override
    public synchronized void replaceSuperTypes(String className, List<String> superTypes) {
        ClassEntry entry = requireClass(className);
        List<String> resolved = resolveSuperTypes(className, superTypes);

        entry.superTypes.clear();
        entry.superTypes.addAll(resolved);
        log.debug("Replaced super types of {} with {}", className, resolved);
    }

    // ========== Attribute modification ==========

    @Override
    public synchronized void renameAttribute(String className, String attributeName, String newName) {
        requireName(newName, "newName");
        ClassEntry owner = requireClass(className);
        AttributeEntry attribute = requireAttribute(owner, attributeName);
        if (attributeName.equals(newName)) {
            return;
        }
        requireFreeFeatureName(owner, newName);

        attribute.name = newName;
        owner.attributes = rekey(owner.attributes, attributeName, newName);
        log.debug("Renamed attribute {}.{} to {}", className, attributeName, newName);
    }

    @Override
    public synchronized void retypeAttribute(String className, String attributeName, String type) {
        AttributeEntry attribute = requireAttribute(requireClass(className), attributeName);
        requireDataType(type);
        attribute.type = type;
        log.debug("Retyped attribute {}.{} to {}", className, attributeName, type);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Checks the lower bound alone; the pairing with the upper bound is not re-checked,
     * so bounds can be changed one at a time.</p>
     */
    @Override
    public synchronized void setAttributeLowerBound(String className, String attributeName, int lowerBound) {
        AttributeEntry attribute = requireAttribute(requireClass(className), attributeName);
        requireLowerBound(lowerBound);
        attribute.lowerBound = lowerBound;
        log.debug("Set lowerBound={} on attribute {}.{}", lowerBound, className, attributeName);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Checks the upper bound alone; {@link Cardinality#MANY} is stored verbatim.</p>
     */
    @Override
    public synchronized void setAttributeUpperBound(String className, String attributeName, int upperBound) {
        AttributeEntry attribute = requireAttribute(requireClass(className), attributeName);
        requireUpperBound(upperBound);
        attribute.upperBound = upperBound;
        log.debug("Set upperBound={} on attribute {}.{}", upperBound, className, attributeName);
    }

    // ========== Reference modification ==========

    @Override
    public synchronized void renameReference(String className, String referenceName, String newName) {
        requireName(newName, "newName");
        ClassEntry owner = requireClass(className);
        ReferenceEntry reference = requireReference(owner, referenceName);
        if (referenceName.equals(newName)) {
            return;
        }
        requireFreeFeatureName(owner, newName);

        reference.name = newName;
        owner.references = rekey(owner.references, referenceName, newName);
        log.debug("Renamed reference {}.{} to {}", className, referenceName, newName);
    }

    @Override
    public synchronized void retargetReference(String className, String referenceName, String targetClassName) {
        ReferenceEntry reference = requireReference(requireClass(className), referenceName);
        requireClass(targetClassName);
        reference.type = targetClassName;
        log.debug("Retargeted reference {}.{} to {}", className, referenceName, targetClassName);
    }

    @Override
    public synchronized void setReferenceContainment(String className, String referenceName, boolean containment) {
        requireReference(requireClass(className), referenceName).containment = containment;
        log.debug("Set containment={} on reference {}.{}", containment, className, referenceName);
    }

    @Override
    public synchronized void setReferenceLowerBound(String className, String referenceName, int lowerBound) {
        ReferenceEntry reference = requireReference(requireClass(className), referenceName);
        requireLowerBound(lowerBound);
        reference.lowerBound = lowerBound;
        log.debug("Set lowerBound={} on reference {}.{}", lowerBound, className, referenceName);
    }

    @Override
    public synchronized void setReferenceUpperBound(String className, String referenceName, int upperBound) {
        ReferenceEntry reference = requireReference(requireClass(className), referenceName);
        requireUpperBound(upperBound);
        reference.upperBound = upperBound;
        log.debug("Set upperBound={} on reference {}.{}", upperBound, className, referenceName);
    }

    // ========== Test support ==========

    /**
     * Clears the whole schema (for testing purposes).
     */
    public synchronized void clear() {
        classes.clear();
    }

    /**
     * Returns the number of classes (for testing purposes).
     *
     * @return class count
     */
    public synchronized int size() {
        return classes.size();
    }

    // ========== Internals ==========

    private ClassEntry requireClass(String className) {
        ClassEntry entry = className == null ? null : classes.get(className);
        if (entry == null) {
            throw ElementNotFoundException.forClass(className);
        }
        return entry;
    }

    private static AttributeEntry requireAttribute(ClassEntry owner, String attributeName) {
        AttributeEntry attribute = attributeName == null ? null : owner.attributes.get(attributeName);
        if (attribute == null) {
            throw ElementNotFoundException.forAttribute(owner.name, attributeName);
        }
        return attribute;
    }

    private static ReferenceEntry requireReference(ClassEntry owner, String referenceName) {
        ReferenceEntry reference = referenceName == null ? null : owner.references.get(referenceName);
        if (reference == null) {
            throw ElementNotFoundException.forReference(owner.name, referenceName);
        }
        return reference;
    }

    private static void requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new SchemaConstraintViolationException(field + " cannot be null or blank");
        }
    }

    private static void requireFreeFeatureName(ClassEntry owner, String featureName) {
        if (owner.attributes.containsKey(featureName) || owner.references.containsKey(featureName)) {
            throw new SchemaConstraintViolationException(
                "Feature " + featureName + " already exists in class " + owner.name);
        }
    }

    private static void requireDataType(String type) {
        if (!DataTypes.isBuiltIn(type)) {
            throw new SchemaConstraintViolationException("Unknown data type: " + type);
        }
    }

    private static void requireBounds(int lowerBound, int upperBound) {
        if (!Cardinality.isValid(lowerBound, upperBound)) {
            throw new SchemaConstraintViolationException(
                String.format("Invalid bounds [%d..%d]", lowerBound, upperBound));
        }
    }

    private static void requireLowerBound(int lowerBound) {
        if (lowerBound < 0) {
            throw new SchemaConstraintViolationException("Invalid lower bound: " + lowerBound);
        }
    }

    private static void requireUpperBound(int upperBound) {
        if (!Cardinality.isMany(upperBound) && upperBound < 1) {
            throw new SchemaConstraintViolationException("Invalid upper bound: " + upperBound);
        }
    }

    private List<String> resolveSuperTypes(String className, List<String> superTypes) {
        if (superTypes == null || superTypes.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (String superType : superTypes) {
            if (className.equals(superType)) {
                throw new SchemaConstraintViolationException("Class " + className + " cannot extend itself");
            }
            requireClass(superType);
            resolved.add(superType);
        }
        return new ArrayList<>(resolved);
    }

    private List<String> referencingClasses(String className) {
        List<String> referencing = new ArrayList<>();
        for (ClassEntry entry : classes.values()) {
            if (entry.name.equals(className)) {
                continue;
            }
            for (ReferenceEntry reference : entry.references.values()) {
                if (reference.type.equals(className)) {
                    referencing.add(entry.name);
                    break;
                }
            }
        }
        return referencing;
    }

    /**
     * 키를 바꾸면서 삽입 순서를 유지한 새 맵 생성.
     */
    private static <V> LinkedHashMap<String, V> rekey(Map<String, V> source, String oldKey, String newKey) {
        LinkedHashMap<String, V> result = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : source.entrySet()) {
            result.put(entry.getKey().equals(oldKey) ? newKey : entry.getKey(), entry.getValue());
        }
        return result;
    }

    // ========== Entries ==========

    private static final class ClassEntry {
        String name;
        final List<String> superTypes;
        boolean abstractClass;
        boolean interfaceClass;
        LinkedHashMap<String, AttributeEntry> attributes = new LinkedHashMap<>();
        LinkedHashMap<String, ReferenceEntry> references = new LinkedHashMap<>();

        ClassEntry(String name, List<String> superTypes, boolean abstractClass, boolean interfaceClass) {
            this.name = name;
            this.superTypes = superTypes;
            this.abstractClass = abstractClass;
            this.interfaceClass = interfaceClass;
        }

        ClassInfo toInfo() {
            return new ClassInfo(name, superTypes, abstractClass, interfaceClass);
        }
    }

    private static final class AttributeEntry {
        String name;
        String type;
        int lowerBound;
        int upperBound;

        AttributeEntry(String name, String type, int lowerBound, int upperBound) {
            this.name = name;
            this.type = type;
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
        }

        AttributeInfo toInfo() {
            return new AttributeInfo(name, type, lowerBound, upperBound);
        }
    }

    private static final class ReferenceEntry {
        String name;
        String type;
        boolean containment;
        int lowerBound;
        int upperBound;

        ReferenceEntry(String name, String type, boolean containment, int lowerBound, int upperBound) {
            this.name = name;
            this.type = type;
            this.containment = containment;
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
        }

        ReferenceInfo toInfo() {
            return new ReferenceInfo(name, type, containment, lowerBound, upperBound);
        }
    }
}
