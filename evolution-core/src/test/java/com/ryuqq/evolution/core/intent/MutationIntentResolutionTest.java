package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.schema.Cardinality;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MutationIntent resolution 병합 테스트.
 *
 * <p>값이 주어진 필드만 덮어쓰고 나머지는 유지되는지 검증합니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class MutationIntentResolutionTest {

    @Test
    void addAttribute_주어진_필드만_덮어씀() {
        // given
        AddAttributeIntent intent = new AddAttributeIntent("Customer", null, "EString", 0, 1);

        // when
        AddAttributeIntent resolved = intent.withResolution(Details.of(Map.of(
            IntentFields.ATTRIBUTE_NAME, "email",
            IntentFields.UPPER_BOUND, -1
        )));

        // then
        assertThat(resolved.className()).isEqualTo("Customer");
        assertThat(resolved.attributeName()).isEqualTo("email");
        assertThat(resolved.attributeType()).isEqualTo("EString");
        assertThat(resolved.lowerBound()).isZero();
        assertThat(resolved.upperBound()).isEqualTo(Cardinality.MANY);
        assertThat(intent.attributeName()).isNull();
    }

    @Test
    void addClass_상위타입과_플래그_병합() {
        AddClassIntent intent = new AddClassIntent(null, null, false, false);

        AddClassIntent resolved = intent.withResolution(Details.of(Map.of(
            IntentFields.CLASS_NAME, "Customer",
            IntentFields.SUPER_TYPES, List.of("Person"),
            IntentFields.ABSTRACT, "true"
        )));

        assertThat(resolved.className()).isEqualTo("Customer");
        assertThat(resolved.superTypes()).containsExactly("Person");
        assertThat(resolved.abstractClass()).isTrue();
        assertThat(resolved.interfaceClass()).isFalse();
    }

    @Test
    void modifyReference_빈_resolution이면_동일한_의도() {
        ModifyReferenceIntent intent =
            new ModifyReferenceIntent("Order", "items", null, "Product", null, null, -1);

        ModifyReferenceIntent resolved = intent.withResolution(Details.empty());

        assertThat(resolved).isEqualTo(intent);
        assertThat(resolved.isRetarget()).isTrue();
        assertThat(resolved.isRename()).isFalse();
    }

    @Test
    void modifyClass_resolution_값의_형태가_잘못되면_예외() {
        ModifyClassIntent intent = new ModifyClassIntent("Customer", null, null, null, null);

        assertThatThrownBy(() -> intent.withResolution(Details.of(Map.of(IntentFields.NEW_ABSTRACT, "maybe"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(IntentFields.NEW_ABSTRACT);
    }

    @Test
    void accept_변형별_방문자_메서드로_디스패치() {
        IntentVisitor<String> visitor = new NamingVisitor();

        assertThat(new RemoveClassIntent("A").accept(visitor)).isEqualTo("removeClass");
        assertThat(new RemoveAttributeIntent("A", "x").accept(visitor)).isEqualTo("removeAttribute");
        assertThat(new ModifyAttributeIntent("A", "x", "y", null, null, null).accept(visitor))
            .isEqualTo("modifyAttribute");
    }

    private static final class NamingVisitor implements IntentVisitor<String> {
        @Override public String visitAddClass(AddClassIntent intent) { return "addClass"; }
        @Override public String visitAddAttribute(AddAttributeIntent intent) { return "addAttribute"; }
        @Override public String visitAddReference(AddReferenceIntent intent) { return "addReference"; }
        @Override public String visitRemoveClass(RemoveClassIntent intent) { return "removeClass"; }
        @Override public String visitRemoveAttribute(RemoveAttributeIntent intent) { return "removeAttribute"; }
        @Override public String visitRemoveReference(RemoveReferenceIntent intent) { return "removeReference"; }
        @Override public String visitModifyClass(ModifyClassIntent intent) { return "modifyClass"; }
        @Override public String visitModifyAttribute(ModifyAttributeIntent intent) { return "modifyAttribute"; }
        @Override public String visitModifyReference(ModifyReferenceIntent intent) { return "modifyReference"; }
    }
}
