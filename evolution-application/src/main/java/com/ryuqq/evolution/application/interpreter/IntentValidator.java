package com.ryuqq.evolution.application.interpreter;

import com.ryuqq.evolution.core.intent.AddAttributeIntent;
import com.ryuqq.evolution.core.intent.AddClassIntent;
import com.ryuqq.evolution.core.intent.AddReferenceIntent;
import com.ryuqq.evolution.core.intent.IntentVisitor;
import com.ryuqq.evolution.core.intent.ModifyAttributeIntent;
import com.ryuqq.evolution.core.intent.ModifyClassIntent;
import com.ryuqq.evolution.core.intent.ModifyReferenceIntent;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.intent.RemoveAttributeIntent;
import com.ryuqq.evolution.core.intent.RemoveClassIntent;
import com.ryuqq.evolution.core.intent.RemoveReferenceIntent;
import com.ryuqq.evolution.core.schema.AttributeInfo;
import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.schema.ReferenceInfo;
import com.ryuqq.evolution.core.spi.MetamodelStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 현재 Store 상태 기준의 참조/유일성 검증기.
 *
 * <p>의도별로 고정된 순서로 검사하며, 첫 번째 위반만 모호성 사유로 반환합니다 (short-circuit).
 * 이름은 null이 아니고 공백이 아닐 때 "존재"로 간주합니다.</p>
 *
 * <p><strong>검사 순서:</strong></p>
 * <ul>
 *   <li>AddClass: 이름 → 중복 없음</li>
 *   <li>AddAttribute: 클래스 이름 → 속성 이름 → 클래스 존재 → 속성 중복 없음 → 같은 이름의 참조 없음</li>
 *   <li>AddReference: 소스 이름 → 대상 이름 → 참조 이름 → 소스 존재 → 대상 존재 → 참조 중복 없음 → 같은 이름의 속성 없음</li>
 *   <li>RemoveClass: 이름 → 클래스 존재 → 다른 클래스의 참조 없음</li>
 *   <li>RemoveAttribute / RemoveReference: 클래스 이름 → 요소 이름 → 클래스 존재 → 요소 존재</li>
 *   <li>ModifyClass: 이름 → 클래스 존재 → (이름 변경 시) 새 이름 중복 없음</li>
 *   <li>ModifyAttribute: 클래스 이름 → 속성 이름 → 클래스 존재 → 속성 존재 → (이름 변경 시) 새 이름이 속성/참조와 중복 없음</li>
 *   <li>ModifyReference: 위와 동일 → (대상 변경 시) 새 대상 클래스 존재</li>
 * </ul>
 *
 * <p>속성과 참조는 한 클래스 안에서 하나의 이름 공간을 공유합니다 (Store의 feature 이름 규칙과 동일).
 * 같은 종류의 중복을 먼저 검사하고, 이어서 다른 종류와의 충돌을 검사합니다.</p>
 *
 * <p>Interpreter와 검증 후 적용 경로({@code applyPendingValidated})가 공유합니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class IntentValidator implements IntentVisitor<Optional<String>> {

    static final String CLASS_NAME_REQUIRED = "Class name is required";
    static final String ATTRIBUTE_NAME_REQUIRED = "Attribute name is required";
    static final String REFERENCE_NAME_REQUIRED = "Reference name is required";
    static final String SOURCE_CLASS_NAME_REQUIRED = "Source class name is required";
    static final String TARGET_CLASS_NAME_REQUIRED = "Target class name is required";

    private final MetamodelStore store;

    /**
     * 생성자.
     *
     * @param store 검증 기준 Store
     * @throws IllegalArgumentException store가 null인 경우
     */
    public IntentValidator(MetamodelStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 의도 검증.
     *
     * @param intent 검증할 의도
     * @return 첫 번째 위반 사유, 문제가 없으면 empty
     * @throws IllegalArgumentException intent가 null인 경우
     */
    public Optional<String> validate(MutationIntent intent) {
        if (intent == null) {
            throw new IllegalArgumentException("intent cannot be null");
        }
        return intent.accept(this);
    }

    @Override
    public Optional<String> visitAddClass(AddClassIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (store.findClassByName(intent.className()).isPresent()) {
            return reason("Class " + intent.className() + " already exists");
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitAddAttribute(AddAttributeIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.attributeName())) {
            return reason(ATTRIBUTE_NAME_REQUIRED);
        }
        Optional<ClassInfo> owner = store.findClassByName(intent.className());
        if (owner.isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        if (hasAttribute(owner.get(), intent.attributeName())) {
            return reason(attributeExists(intent.attributeName(), intent.className()));
        }
        if (hasReference(owner.get(), intent.attributeName())) {
            return reason(referenceExists(intent.attributeName(), intent.className()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitAddReference(AddReferenceIntent intent) {
        if (!isPresent(intent.sourceClassName())) {
            return reason(SOURCE_CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.targetClassName())) {
            return reason(TARGET_CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.referenceName())) {
            return reason(REFERENCE_NAME_REQUIRED);
        }
        Optional<ClassInfo> source = store.findClassByName(intent.sourceClassName());
        if (source.isEmpty()) {
            return reason("Source class " + intent.sourceClassName() + " does not exist");
        }
        if (store.findClassByName(intent.targetClassName()).isEmpty()) {
            return reason(targetMissing(intent.targetClassName()));
        }
        if (hasReference(source.get(), intent.referenceName())) {
            return reason(referenceExists(intent.referenceName(), intent.sourceClassName()));
        }
        if (hasAttribute(source.get(), intent.referenceName())) {
            return reason(attributeExists(intent.referenceName(), intent.sourceClassName()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitRemoveClass(RemoveClassIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (store.findClassByName(intent.className()).isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        List<String> referencing = referencingClasses(intent.className());
        if (!referencing.isEmpty()) {
            return reason("Class " + intent.className() + " is referenced by: " + String.join(", ", referencing));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitRemoveAttribute(RemoveAttributeIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.attributeName())) {
            return reason(ATTRIBUTE_NAME_REQUIRED);
        }
        Optional<ClassInfo> owner = store.findClassByName(intent.className());
        if (owner.isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        if (!hasAttribute(owner.get(), intent.attributeName())) {
            return reason(attributeMissing(intent.attributeName(), intent.className()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitRemoveReference(RemoveReferenceIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.referenceName())) {
            return reason(REFERENCE_NAME_REQUIRED);
        }
        Optional<ClassInfo> owner = store.findClassByName(intent.className());
        if (owner.isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        if (!hasReference(owner.get(), intent.referenceName())) {
            return reason(referenceMissing(intent.referenceName(), intent.className()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitModifyClass(ModifyClassIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (store.findClassByName(intent.className()).isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        // 자기 자신의 이름으로 변경하는 경우도 중복으로 취급
        if (intent.isRename() && store.findClassByName(intent.newName()).isPresent()) {
            return reason("Class " + intent.newName() + " already exists");
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitModifyAttribute(ModifyAttributeIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.attributeName())) {
            return reason(ATTRIBUTE_NAME_REQUIRED);
        }
        Optional<ClassInfo> owner = store.findClassByName(intent.className());
        if (owner.isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        if (!hasAttribute(owner.get(), intent.attributeName())) {
            return reason(attributeMissing(intent.attributeName(), intent.className()));
        }
        if (intent.isRename() && hasAttribute(owner.get(), intent.newName())) {
            return reason(attributeExists(intent.newName(), intent.className()));
        }
        if (intent.isRename() && hasReference(owner.get(), intent.newName())) {
            return reason(referenceExists(intent.newName(), intent.className()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> visitModifyReference(ModifyReferenceIntent intent) {
        if (!isPresent(intent.className())) {
            return reason(CLASS_NAME_REQUIRED);
        }
        if (!isPresent(intent.referenceName())) {
            return reason(REFERENCE_NAME_REQUIRED);
        }
        Optional<ClassInfo> owner = store.findClassByName(intent.className());
        if (owner.isEmpty()) {
            return reason(classMissing(intent.className()));
        }
        if (!hasReference(owner.get(), intent.referenceName())) {
            return reason(referenceMissing(intent.referenceName(), intent.className()));
        }
        if (intent.isRename() && hasReference(owner.get(), intent.newName())) {
            return reason(referenceExists(intent.newName(), intent.className()));
        }
        if (intent.isRename() && hasAttribute(owner.get(), intent.newName())) {
            return reason(attributeExists(intent.newName(), intent.className()));
        }
        if (intent.isRetarget() && store.findClassByName(intent.newTargetClassName()).isEmpty()) {
            return reason(targetMissing(intent.newTargetClassName()));
        }
        return Optional.empty();
    }

    // ========== Helpers ==========

    private boolean hasAttribute(ClassInfo owner, String attributeName) {
        for (AttributeInfo attribute : store.getClassAttributes(owner)) {
            if (attribute.name().equals(attributeName)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasReference(ClassInfo owner, String referenceName) {
        for (ReferenceInfo reference : store.getClassReferences(owner)) {
            if (reference.name().equals(referenceName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 대상 클래스를 타입으로 하는 참조를 가진 다른 클래스 이름 (Store 순서, 중복 없음).
     */
    private List<String> referencingClasses(String className) {
        List<String> referencing = new ArrayList<>();
        for (ClassInfo candidate : store.getAllClasses()) {
            if (candidate.name().equals(className)) {
                continue;
            }
            for (ReferenceInfo reference : store.getClassReferences(candidate)) {
                if (reference.type().equals(className)) {
                    referencing.add(candidate.name());
                    break;
                }
            }
        }
        return referencing;
    }

    private static boolean isPresent(String name) {
        return name != null && !name.isBlank();
    }

    private static Optional<String> reason(String message) {
        return Optional.of(message);
    }

    private static String classMissing(String className) {
        return "Class " + className + " does not exist";
    }

    private static String targetMissing(String className) {
        return "Target class " + className + " does not exist";
    }

    private static String attributeExists(String attributeName, String className) {
        return "Attribute " + attributeName + " already exists in class " + className;
    }

    private static String attributeMissing(String attributeName, String className) {
        return "Attribute " + attributeName + " does not exist in class " + className;
    }

    private static String referenceExists(String referenceName, String className) {
        return "Reference " + referenceName + " already exists in class " + className;
    }

    private static String referenceMissing(String referenceName, String className) {
        return "Reference " + referenceName + " does not exist in class " + className;
    }
}
