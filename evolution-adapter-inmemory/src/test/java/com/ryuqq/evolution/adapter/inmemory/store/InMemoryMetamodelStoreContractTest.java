package com.ryuqq.evolution.adapter.inmemory.store;

import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import com.ryuqq.evolution.core.spi.SchemaConstraintViolationException;
import com.ryuqq.evolution.testkit.contract.AbstractMetamodelStoreContractTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Tests for InMemoryMetamodelStore implementation.
 *
 * <p>Runs the shared {@link AbstractMetamodelStoreContractTest} suite plus the
 * constraints specific to the in-memory adapter.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class InMemoryMetamodelStoreContractTest extends AbstractMetamodelStoreContractTest {

    @Override
    protected MetamodelStore createStore() {
        return new InMemoryMetamodelStore();
    }

    @Test
    void addAttribute_UnknownDataType_IsConstraintViolation() {
        store.createClass("Customer", List.of(), false, false);

        assertThatThrownBy(() -> store.addAttribute("Customer", "email", "Text", 0, 1))
            .isInstanceOf(SchemaConstraintViolationException.class)
            .hasMessageContaining("Text");
    }

    @Test
    void addFeature_InvalidBounds_IsConstraintViolation() {
        store.createClass("Customer", List.of(), false, false);

        assertThatThrownBy(() -> store.addAttribute("Customer", "email", "EString", 2, 1))
            .isInstanceOf(SchemaConstraintViolationException.class);

        store.addAttribute("Customer", "email", "EString", 0, 1);
        assertThatThrownBy(() -> store.setAttributeLowerBound("Customer", "email", -1))
            .isInstanceOf(SchemaConstraintViolationException.class);
        assertThatThrownBy(() -> store.setAttributeUpperBound("Customer", "email", 0))
            .isInstanceOf(SchemaConstraintViolationException.class);
    }

    @Test
    void attributesAndReferences_ShareOneNamespace() {
        store.createClass("Customer", List.of(), false, false);
        store.addAttribute("Customer", "address", "EString", 0, 1);

        assertThatThrownBy(() -> store.addReference("Customer", "Customer", "address", false, 0, 1))
            .isInstanceOf(SchemaConstraintViolationException.class)
            .hasMessage("Feature address already exists in class Customer");
    }

    @Test
    void removeClass_SelfReferenceDoesNotBlockRemoval() {
        store.createClass("Node", List.of(), false, false);
        store.addReference("Node", "Node", "children", true, 0, -1);

        store.removeClass("Node");

        assertThat(store.findClassByName("Node")).isEmpty();
    }

    @Test
    void renameClass_ToExistingName_IsConstraintViolation() {
        store.createClass("Customer", List.of(), false, false);
        store.createClass("Client", List.of(), false, false);

        assertThatThrownBy(() -> store.renameClass("Customer", "Client"))
            .isInstanceOf(SchemaConstraintViolationException.class);
        assertThat(store.getAllClasses()).extracting(ClassInfo::name).containsExactly("Customer", "Client");
    }

    @Test
    void clear_RemovesAllClasses() {
        InMemoryMetamodelStore inMemory = (InMemoryMetamodelStore) store;
        inMemory.createClass("Customer", List.of(), false, false);

        inMemory.clear();

        assertThat(inMemory.size()).isZero();
    }
}
