package com.ryuqq.evolution.testkit.contract;

import com.ryuqq.evolution.core.schema.AttributeInfo;
import com.ryuqq.evolution.core.schema.Cardinality;
import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.schema.ReferenceInfo;
import com.ryuqq.evolution.core.spi.ElementNotFoundException;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import com.ryuqq.evolution.core.spi.SchemaConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Abstract base class for {@link MetamodelStore} Contract Tests.
 *
 * <p>Every Store adapter extends this class and supplies a fresh, empty store through
 * {@link #createStore()}. The inherited tests pin down the behavior the evolution pipeline
 * relies on at apply time: name-based lookup, insertion order, the many sentinel,
 * rename propagation and referential integrity on removal.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractMetamodelStoreContractTest {
 *     {@literal @}Override
 *     protected MetamodelStore createStore() {
 *         return new MyStore();
 *     }
 * }
 * </pre>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public abstract class AbstractMetamodelStoreContractTest {

    protected MetamodelStore store;

    /**
     * Creates a new, empty store under test.
     *
     * @return empty MetamodelStore
     */
    protected abstract MetamodelStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // ========== Creation & Lookup ==========

    @Test
    void createClass_ThenFindByName() {
        // when
        store.createClass("Customer", List.of(), true, false);

        // then
        assertThat(store.findClassByName("Customer"))
            .hasValueSatisfying(info -> {
                assertThat(info.abstractClass()).isTrue();
                assertThat(info.interfaceClass()).isFalse();
            });
        assertThat(store.findClassByName("Order")).isEmpty();
    }

    @Test
    void getAllClasses_KeepsCreationOrder() {
        store.createClass("B", List.of(), false, false);
        store.createClass("A", List.of(), false, false);
        store.createClass("C", List.of("A"), false, false);

        assertThat(store.getAllClasses()).extracting(ClassInfo::name).containsExactly("B", "A", "C");
    }

    @Test
    void createClass_DuplicateName_IsConstraintViolation() {
        store.createClass("Customer", List.of(), false, false);

        assertThatThrownBy(() -> store.createClass("Customer", List.of(), false, false))
            .isInstanceOf(SchemaConstraintViolationException.class);
    }

    @Test
    void createClass_UnknownSuperType_IsNotFound() {
        assertThatThrownBy(() -> store.createClass("Customer", List.of("Person"), false, false))
            .isInstanceOf(ElementNotFoundException.class)
            .hasMessageContaining("Person");
    }

    @Test
    void features_PreserveManySentinel() {
        // given
        store.createClass("Order", List.of(), false, false);
        store.createClass("Item", List.of(), false, false);

        // when
        store.addAttribute("Order", "tags", "EString", 0, Cardinality.MANY);
        store.addReference("Order", "Item", "items", true, 1, Cardinality.MANY);

        // then
        ClassInfo order = store.findClassByName("Order").orElseThrow();
        assertThat(store.getClassAttributes(order))
            .extracting(AttributeInfo::name, AttributeInfo::type, AttributeInfo::lowerBound, AttributeInfo::upperBound)
            .containsExactly(tuple("tags", "EString", 0, -1));
        assertThat(store.getClassReferences(order))
            .extracting(ReferenceInfo::name, ReferenceInfo::type, ReferenceInfo::containment,
                ReferenceInfo::lowerBound, ReferenceInfo::upperBound)
            .containsExactly(tuple("items", "Item", true, 1, -1));
    }

    @Test
    void addAttribute_MissingClass_IsNotFound() {
        assertThatThrownBy(() -> store.addAttribute("Ghost", "name", "EString", 0, 1))
            .isInstanceOf(ElementNotFoundException.class)
            .hasMessage("Class Ghost not found");
    }

    @Test
    void addReference_MissingTarget_IsNotFound() {
        store.createClass("Order", List.of(), false, false);

        assertThatThrownBy(() -> store.addReference("Order", "Ghost", "ghost", false, 0, 1))
            .isInstanceOf(ElementNotFoundException.class);
        assertThat(store.getClassReferences(ClassInfo.of("Order"))).isEmpty();
    }

    // ========== Removal ==========

    @Test
    void removeClass_StillReferenced_IsConstraintViolation() {
        // given
        store.createClass("Customer", List.of(), false, false);
        store.createClass("Order", List.of(), false, false);
        store.addReference("Order", "Customer", "customer", false, 1, 1);

        // when & then
        assertThatThrownBy(() -> store.removeClass("Customer"))
            .isInstanceOf(SchemaConstraintViolationException.class)
            .hasMessageContaining("Order");
        assertThat(store.findClassByName("Customer")).isPresent();
    }

    @Test
    void removeClass_DropsItFromSuperTypeLists() {
        store.createClass("Named", List.of(), true, false);
        store.createClass("Customer", List.of("Named"), false, false);

        store.removeClass("Named");

        assertThat(store.findClassByName("Customer").orElseThrow().superTypes()).isEmpty();
    }

    @Test
    void removeFeature_Missing_IsNotFound() {
        store.createClass("Customer", List.of(), false, false);

        assertThatThrownBy(() -> store.removeAttribute("Customer", "email"))
            .isInstanceOf(ElementNotFoundException.class)
            .hasMessage("Attribute email not found in class Customer");
        assertThatThrownBy(() -> store.removeReference("Customer", "orders"))
            .isInstanceOf(ElementNotFoundException.class)
            .hasMessage("Reference orders not found in class Customer");
    }

    // ========== Modification ==========

    @Test
    void renameClass_RetargetsReferencesAndSuperTypes() {
        // given
        store.createClass("Person", List.of(), false, false);
        store.createClass("Customer", List.of("Person"), false, false);
        store.createClass("Order", List.of(), false, false);
        store.addReference("Order", "Person", "buyer", false, 0, 1);

        // when
        store.renameClass("Person", "Party");

        // then
        assertThat(store.findClassByName("Person")).isEmpty();
        assertThat(store.getAllClasses()).extracting(ClassInfo::name).containsExactly("Party", "Customer", "Order");
        assertThat(store.findClassByName("Customer").orElseThrow().superTypes()).containsExactly("Party");
        assertThat(store.getClassReferences(ClassInfo.of("Order")))
            .extracting(ReferenceInfo::type)
            .containsExactly("Party");
    }

    @Test
    void modifyFeatures_UpdateInPlace() {
        // given
        store.createClass("Customer", List.of(), false, false);
        store.createClass("Address", List.of(), false, false);
        store.createClass("Location", List.of(), false, false);
        store.addAttribute("Customer", "age", "EString", 0, 1);
        store.addReference("Customer", "Address", "address", false, 0, 1);

        // when
        store.renameAttribute("Customer", "age", "yearsOld");
        store.retypeAttribute("Customer", "yearsOld", "EInt");
        store.setAttributeUpperBound("Customer", "yearsOld", Cardinality.MANY);
        store.renameReference("Customer", "address", "location");
        store.retargetReference("Customer", "location", "Location");
        store.setReferenceContainment("Customer", "location", true);
        store.setReferenceLowerBound("Customer", "location", 1);

        // then
        ClassInfo customer = store.findClassByName("Customer").orElseThrow();
        assertThat(store.getClassAttributes(customer))
            .containsExactly(new AttributeInfo("yearsOld", "EInt", 0, -1));
        assertThat(store.getClassReferences(customer))
            .containsExactly(new ReferenceInfo("location", "Location", true, 1, 1));
    }

    @Test
    void replaceSuperTypes_ClearsAndRebuilds() {
        store.createClass("A", List.of(), false, false);
        store.createClass("B", List.of(), false, false);
        store.createClass("C", List.of("A"), false, false);

        store.replaceSuperTypes("C", List.of("B"));

        assertThat(store.findClassByName("C").orElseThrow().superTypes()).containsExactly("B");
    }

    @Test
    void modifyMissingFeature_IsNotFound() {
        store.createClass("Customer", List.of(), false, false);

        assertThatThrownBy(() -> store.renameAttribute("Customer", "ghost", "spirit"))
            .isInstanceOf(ElementNotFoundException.class);
        assertThatThrownBy(() -> store.setReferenceUpperBound("Customer", "ghost", 3))
            .isInstanceOf(ElementNotFoundException.class);
        assertThatThrownBy(() -> store.setClassAbstract("Ghost", true))
            .isInstanceOf(ElementNotFoundException.class);
    }
}
