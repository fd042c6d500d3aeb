package com.ryuqq.evolution.testkit.contract;

import com.ryuqq.evolution.core.contract.ChangeDescriptor;
import com.ryuqq.evolution.core.contract.DetailKeys;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.model.ChangeType;
import com.ryuqq.evolution.core.model.ElementKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test fixtures for {@link ChangeDescriptor}.
 *
 * <p>Builds the descriptors a domain-expert tool would send, using the detail keys
 * listed in {@link DetailKeys}. Optional keys are omitted so that interpreter defaults
 * apply.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class ChangeDescriptors {

    private ChangeDescriptors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ChangeDescriptor addClass(String name) {
        return of(ChangeType.ADD, ElementKind.CLASS, DetailKeys.NAME, name);
    }

    public static ChangeDescriptor addClass(String name, List<String> superTypes, boolean abstractClass) {
        return of(ChangeType.ADD, ElementKind.CLASS,
            DetailKeys.NAME, name,
            DetailKeys.SUPER_TYPES, superTypes,
            DetailKeys.ABSTRACT, abstractClass);
    }

    public static ChangeDescriptor addAttribute(String className, String name) {
        return of(ChangeType.ADD, ElementKind.ATTRIBUTE,
            DetailKeys.CLASS_NAME, className,
            DetailKeys.NAME, name);
    }

    public static ChangeDescriptor addAttribute(String className, String name, String type,
                                                int lowerBound, int upperBound) {
        return of(ChangeType.ADD, ElementKind.ATTRIBUTE,
            DetailKeys.CLASS_NAME, className,
            DetailKeys.NAME, name,
            DetailKeys.TYPE, type,
            DetailKeys.LOWER_BOUND, lowerBound,
            DetailKeys.UPPER_BOUND, upperBound);
    }

    public static ChangeDescriptor addReference(String sourceClassName, String targetClassName, String name) {
        return of(ChangeType.ADD, ElementKind.REFERENCE,
            DetailKeys.SOURCE_CLASS_NAME, sourceClassName,
            DetailKeys.TARGET_CLASS_NAME, targetClassName,
            DetailKeys.NAME, name);
    }

    public static ChangeDescriptor addReference(String sourceClassName, String targetClassName, String name,
                                                boolean containment, int lowerBound, int upperBound) {
        return of(ChangeType.ADD, ElementKind.REFERENCE,
            DetailKeys.SOURCE_CLASS_NAME, sourceClassName,
            DetailKeys.TARGET_CLASS_NAME, targetClassName,
            DetailKeys.NAME, name,
            DetailKeys.CONTAINMENT, containment,
            DetailKeys.LOWER_BOUND, lowerBound,
            DetailKeys.UPPER_BOUND, upperBound);
    }

    public static ChangeDescriptor removeClass(String name) {
        return of(ChangeType.REMOVE, ElementKind.CLASS, DetailKeys.NAME, name);
    }

    public static ChangeDescriptor removeAttribute(String className, String name) {
        return of(ChangeType.REMOVE, ElementKind.ATTRIBUTE, DetailKeys.CLASS_NAME, className, DetailKeys.NAME, name);
    }

    public static ChangeDescriptor removeReference(String className, String name) {
        return of(ChangeType.REMOVE, ElementKind.REFERENCE, DetailKeys.CLASS_NAME, className, DetailKeys.NAME, name);
    }

    public static ChangeDescriptor renameClass(String name, String newName) {
        return of(ChangeType.MODIFY, ElementKind.CLASS, DetailKeys.NAME, name, DetailKeys.NEW_NAME, newName);
    }

    public static ChangeDescriptor renameAttribute(String className, String name, String newName) {
        return of(ChangeType.MODIFY, ElementKind.ATTRIBUTE,
            DetailKeys.CLASS_NAME, className,
            DetailKeys.NAME, name,
            DetailKeys.NEW_NAME, newName);
    }

    public static ChangeDescriptor retargetReference(String className, String name, String newTargetClassName) {
        return of(ChangeType.MODIFY, ElementKind.REFERENCE,
            DetailKeys.CLASS_NAME, className,
            DetailKeys.NAME, name,
            DetailKeys.NEW_TARGET_CLASS_NAME, newTargetClassName);
    }

    /**
     * Builds a descriptor from alternating key/value pairs (null values are kept).
     *
     * @param changeType change type
     * @param elementKind element kind
     * @param keyValues alternating keys and values
     * @return ChangeDescriptor
     */
    public static ChangeDescriptor of(ChangeType changeType, ElementKind elementKind, Object... keyValues) {
        return ChangeDescriptor.of(changeType, elementKind, details(keyValues));
    }

    /**
     * Builds Details from alternating key/value pairs (null values are kept).
     *
     * @param keyValues alternating keys and values
     * @return Details
     */
    public static Details details(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain key/value pairs");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Details.of(values);
    }
}
