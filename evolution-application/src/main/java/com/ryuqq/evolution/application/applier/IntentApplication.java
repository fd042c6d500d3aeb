package com.ryuqq.evolution.application.applier;

import com.ryuqq.evolution.core.intent.AddAttributeIntent;
import com.ryuqq.evolution.core.intent.AddClassIntent;
import com.ryuqq.evolution.core.intent.AddReferenceIntent;
import com.ryuqq.evolution.core.intent.IntentVisitor;
import com.ryuqq.evolution.core.intent.ModifyAttributeIntent;
import com.ryuqq.evolution.core.intent.ModifyClassIntent;
import com.ryuqq.evolution.core.intent.ModifyReferenceIntent;
import com.ryuqq.evolution.core.intent.RemoveAttributeIntent;
import com.ryuqq.evolution.core.intent.RemoveClassIntent;
import com.ryuqq.evolution.core.intent.RemoveReferenceIntent;
import com.ryuqq.evolution.core.schema.AttributeInfo;
import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.schema.ReferenceInfo;
import com.ryuqq.evolution.core.spi.ElementNotFoundException;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 의도별 Store 적용 절차.
 *
 * <p>각 절차는 적용 시점에 {@link MetamodelStore#findClassByName(String)}로 이름을 다시
 * 해석합니다. 의도와 Store 사이의 바인딩은 이름뿐입니다.</p>
 *
 * <p>수정 의도는 이름 변경을 먼저 적용하고, 이후 변경은 새 이름 기준으로 적용합니다.
 * 참조하는 클래스 이름은 첫 변경 전에 모두 확인하며, 이후 단계가 Store에서 거부되면
 * 적용 전 스냅샷으로 요소를 되돌립니다. FAILED 작업은 Store에 흔적을 남기지 않습니다.</p>
 */
final class IntentApplication implements IntentVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(IntentApplication.class);

    private final MetamodelStore store;

    IntentApplication(MetamodelStore store) {
        this.store = store;
    }

    @Override
    public Void visitAddClass(AddClassIntent intent) {
        store.createClass(intent.className(), intent.superTypes(), intent.abstractClass(), intent.interfaceClass());
        return null;
    }

    @Override
    public Void visitAddAttribute(AddAttributeIntent intent) {
        ClassInfo owner = requireClass(intent.className());
        store.addAttribute(owner.name(), intent.attributeName(), intent.attributeType(),
            intent.lowerBound(), intent.upperBound());
        return null;
    }

    @Override
    public Void visitAddReference(AddReferenceIntent intent) {
        ClassInfo source = requireClass(intent.sourceClassName());
        ClassInfo target = requireClass(intent.targetClassName());
        store.addReference(source.name(), target.name(), intent.referenceName(),
            intent.containment(), intent.lowerBound(), intent.upperBound());
        return null;
    }

    @Override
    public Void visitRemoveClass(RemoveClassIntent intent) {
        store.removeClass(requireClass(intent.className()).name());
        return null;
    }

    @Override
    public Void visitRemoveAttribute(RemoveAttributeIntent intent) {
        store.removeAttribute(requireClass(intent.className()).name(), intent.attributeName());
        return null;
    }

    @Override
    public Void visitRemoveReference(RemoveReferenceIntent intent) {
        store.removeReference(requireClass(intent.className()).name(), intent.referenceName());
        return null;
    }

    @Override
    public Void visitModifyClass(ModifyClassIntent intent) {
        ClassInfo before = requireClass(intent.className());
        if (intent.newSuperTypes() != null) {
            for (String superType : intent.newSuperTypes()) {
                requireClass(superType);
            }
        }

        String className = before.name();
        if (intent.isRename()) {
            store.renameClass(className, intent.newName());
            className = intent.newName();
        }
        try {
            if (intent.newAbstract() != null) {
                store.setClassAbstract(className, intent.newAbstract());
            }
            if (intent.newInterface() != null) {
                store.setClassInterface(className, intent.newInterface());
            }
            if (intent.newSuperTypes() != null) {
                store.replaceSuperTypes(className, intent.newSuperTypes());
            }
        } catch (RuntimeException e) {
            restoreClass(before, className, e);
            throw e;
        }
        return null;
    }

    @Override
    public Void visitModifyAttribute(ModifyAttributeIntent intent) {
        ClassInfo owner = requireClass(intent.className());
        AttributeInfo before = store.getClassAttributes(owner).stream()
            .filter(attribute -> attribute.name().equals(intent.attributeName()))
            .findFirst()
            .orElseThrow(() -> ElementNotFoundException.forAttribute(owner.name(), intent.attributeName()));

        String className = owner.name();
        String attributeName = before.name();
        if (intent.isRename()) {
            store.renameAttribute(className, attributeName, intent.newName());
            attributeName = intent.newName();
        }
        try {
            if (intent.newType() != null) {
                store.retypeAttribute(className, attributeName, intent.newType());
            }
            if (intent.newLowerBound() != null) {
                store.setAttributeLowerBound(className, attributeName, intent.newLowerBound());
            }
            if (intent.newUpperBound() != null) {
                store.setAttributeUpperBound(className, attributeName, intent.newUpperBound());
            }
        } catch (RuntimeException e) {
            restoreAttribute(className, before, attributeName, e);
            throw e;
        }
        return null;
    }

    @Override
    public Void visitModifyReference(ModifyReferenceIntent intent) {
        ClassInfo owner = requireClass(intent.className());
        ReferenceInfo before = store.getClassReferences(owner).stream()
            .filter(reference -> reference.name().equals(intent.referenceName()))
            .findFirst()
            .orElseThrow(() -> ElementNotFoundException.forReference(owner.name(), intent.referenceName()));
        String newTarget = intent.isRetarget() ? requireClass(intent.newTargetClassName()).name() : null;

        String className = owner.name();
        String referenceName = before.name();
        if (intent.isRename()) {
            store.renameReference(className, referenceName, intent.newName());
            referenceName = intent.newName();
        }
        try {
            if (newTarget != null) {
                store.retargetReference(className, referenceName, newTarget);
            }
            if (intent.newContainment() != null) {
                store.setReferenceContainment(className, referenceName, intent.newContainment());
            }
            if (intent.newLowerBound() != null) {
                store.setReferenceLowerBound(className, referenceName, intent.newLowerBound());
            }
            if (intent.newUpperBound() != null) {
                store.setReferenceUpperBound(className, referenceName, intent.newUpperBound());
            }
        } catch (RuntimeException e) {
            restoreReference(className, before, referenceName, e);
            throw e;
        }
        return null;
    }

    // ========== Restore (실패한 수정 의도의 되돌림) ==========

    private void restoreClass(ClassInfo before, String currentName, RuntimeException failure) {
        try {
            store.setClassAbstract(currentName, before.abstractClass());
            store.setClassInterface(currentName, before.interfaceClass());
            store.replaceSuperTypes(currentName, before.superTypes());
            if (!currentName.equals(before.name())) {
                store.renameClass(currentName, before.name());
            }
        } catch (RuntimeException restoreFailure) {
            restoreFailed("class " + before.name(), failure, restoreFailure);
        }
    }

    private void restoreAttribute(String className, AttributeInfo before, String currentName,
                                  RuntimeException failure) {
        try {
            store.retypeAttribute(className, currentName, before.type());
            store.setAttributeLowerBound(className, currentName, before.lowerBound());
            store.setAttributeUpperBound(className, currentName, before.upperBound());
            if (!currentName.equals(before.name())) {
                store.renameAttribute(className, currentName, before.name());
            }
        } catch (RuntimeException restoreFailure) {
            restoreFailed("attribute " + className + "." + before.name(), failure, restoreFailure);
        }
    }

    private void restoreReference(String className, ReferenceInfo before, String currentName,
                                  RuntimeException failure) {
        try {
            store.retargetReference(className, currentName, before.type());
            store.setReferenceContainment(className, currentName, before.containment());
            store.setReferenceLowerBound(className, currentName, before.lowerBound());
            store.setReferenceUpperBound(className, currentName, before.upperBound());
            if (!currentName.equals(before.name())) {
                store.renameReference(className, currentName, before.name());
            }
        } catch (RuntimeException restoreFailure) {
            restoreFailed("reference " + className + "." + before.name(), failure, restoreFailure);
        }
    }

    private static void restoreFailed(String element, RuntimeException failure, RuntimeException restoreFailure) {
        failure.addSuppressed(restoreFailure);
        log.error("Could not restore {} after a failed modification", element, restoreFailure);
    }

    private ClassInfo requireClass(String className) {
        return store.findClassByName(className)
            .orElseThrow(() -> ElementNotFoundException.forClass(className));
    }
}
