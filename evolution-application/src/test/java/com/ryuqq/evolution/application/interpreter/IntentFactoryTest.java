package com.ryuqq.evolution.application.interpreter;

import com.ryuqq.evolution.core.contract.DetailKeys;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.intent.AddAttributeIntent;
import com.ryuqq.evolution.core.intent.AddClassIntent;
import com.ryuqq.evolution.core.intent.IntentAction;
import com.ryuqq.evolution.core.intent.ModifyReferenceIntent;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.intent.RemoveReferenceIntent;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IntentFactory 테스트.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class IntentFactoryTest {

    private final IntentFactory factory = new IntentFactory(new InterpreterConfig());

    @Test
    void create_명시적_0과_false는_기본값으로_대체되지_않음() {
        // given
        Details details = Details.of(Map.of(
            DetailKeys.CLASS_NAME, "Customer",
            DetailKeys.NAME, "age",
            DetailKeys.TYPE, "EInt",
            DetailKeys.LOWER_BOUND, 1,
            DetailKeys.UPPER_BOUND, -1
        ));

        // when
        MutationIntent intent = factory.create(IntentAction.ADD_ATTRIBUTE, details);

        // then
        assertThat(intent).isEqualTo(new AddAttributeIntent("Customer", "age", "EInt", 1, -1));
    }

    @Test
    void create_null_값은_없는_키로_취급() {
        // given
        Map<String, Object> raw = new HashMap<>();
        raw.put(DetailKeys.CLASS_NAME, "Customer");
        raw.put(DetailKeys.NAME, "email");
        raw.put(DetailKeys.TYPE, null);
        raw.put(DetailKeys.UPPER_BOUND, null);

        // when
        MutationIntent intent = factory.create(IntentAction.ADD_ATTRIBUTE, Details.of(raw));

        // then
        assertThat(intent).isEqualTo(new AddAttributeIntent("Customer", "email", "EString", 0, 1));
    }

    @Test
    void create_AddClass_상위타입과_플래그() {
        MutationIntent intent = factory.create(IntentAction.ADD_CLASS, Details.of(Map.of(
            DetailKeys.NAME, "Customer",
            DetailKeys.SUPER_TYPES, List.of("Person"),
            DetailKeys.INTERFACE, "true"
        )));

        assertThat(intent).isEqualTo(new AddClassIntent("Customer", List.of("Person"), false, true));
    }

    @Test
    void create_Remove_Modify_Reference_이름_매핑() {
        assertThat(factory.create(IntentAction.REMOVE_REFERENCE, Details.of(Map.of(
            DetailKeys.CLASS_NAME, "Order", DetailKeys.NAME, "items"))))
            .isEqualTo(new RemoveReferenceIntent("Order", "items"));

        assertThat(factory.create(IntentAction.MODIFY_REFERENCE, Details.of(Map.of(
            DetailKeys.CLASS_NAME, "Order",
            DetailKeys.NAME, "items",
            DetailKeys.NEW_CONTAINMENT, true,
            DetailKeys.NEW_UPPER_BOUND, "-1"))))
            .isEqualTo(new ModifyReferenceIntent("Order", "items", null, null, true, null, -1));
    }

    @Test
    void create_형태가_잘못된_값은_예외() {
        assertThatThrownBy(() -> factory.create(IntentAction.ADD_CLASS, Details.of(Map.of(
            DetailKeys.NAME, "Customer",
            DetailKeys.SUPER_TYPES, "Person"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(DetailKeys.SUPER_TYPES);
    }
}
