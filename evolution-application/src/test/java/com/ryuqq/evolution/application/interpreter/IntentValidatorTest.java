package com.ryuqq.evolution.application.interpreter;

import com.ryuqq.evolution.core.intent.AddAttributeIntent;
import com.ryuqq.evolution.core.intent.AddClassIntent;
import com.ryuqq.evolution.core.intent.ModifyAttributeIntent;
import com.ryuqq.evolution.core.intent.RemoveAttributeIntent;
import com.ryuqq.evolution.core.intent.RemoveClassIntent;
import com.ryuqq.evolution.core.intent.RemoveReferenceIntent;
import com.ryuqq.evolution.core.schema.AttributeInfo;
import com.ryuqq.evolution.core.schema.ClassInfo;
import com.ryuqq.evolution.core.schema.ReferenceInfo;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * IntentValidator 유닛 테스트.
 *
 * <p>Store를 Mock으로 대체해 검사 순서와 short-circuit 동작을 검증합니다:</p>
 * <ul>
 *   <li>필수 이름이 없으면 Store를 조회하지 않음</li>
 *   <li>첫 번째 위반만 사유로 반환</li>
 *   <li>위반이 없으면 empty</li>
 * </ul>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class IntentValidatorTest {

    @Mock
    private MetamodelStore store;

    private IntentValidator validator;

    private final ClassInfo customer = ClassInfo.of("Customer");

    @BeforeEach
    void setUp() {
        validator = new IntentValidator(store);
    }

    @Test
    void validate_필수_이름이_없으면_Store_조회없이_사유_반환() {
        // when
        Optional<String> reason = validator.validate(new AddAttributeIntent("Customer", "  ", "EString", 0, 1));

        // then
        assertThat(reason).contains("Attribute name is required");
        verifyNoInteractions(store);
    }

    @Test
    void validate_클래스_이름이_속성_이름보다_먼저_검사됨() {
        assertThat(validator.validate(new RemoveAttributeIntent(null, null))).contains("Class name is required");
        assertThat(validator.validate(new RemoveReferenceIntent("Customer", null))).contains("Reference name is required");
        verifyNoInteractions(store);
    }

    @Test
    void validate_AddClass_위반없으면_empty() {
        // given
        when(store.findClassByName("Customer")).thenReturn(Optional.empty());

        // when
        Optional<String> reason = validator.validate(new AddClassIntent("Customer", List.of(), false, false));

        // then
        assertThat(reason).isEmpty();
    }

    @Test
    void validate_클래스가_없으면_속성을_조회하지_않음() {
        // given
        when(store.findClassByName("Customer")).thenReturn(Optional.empty());

        // when
        Optional<String> reason = validator.validate(new RemoveAttributeIntent("Customer", "email"));

        // then
        assertThat(reason).contains("Class Customer does not exist");
        verify(store, never()).getClassAttributes(any());
    }

    @Test
    void validate_RemoveAttribute_존재하지_않는_속성() {
        // given
        when(store.findClassByName("Customer")).thenReturn(Optional.of(customer));
        when(store.getClassAttributes(customer)).thenReturn(List.of(new AttributeInfo("name", "EString", 0, 1)));

        // when & then
        assertThat(validator.validate(new RemoveAttributeIntent("Customer", "email")))
            .contains("Attribute email does not exist in class Customer");
    }

    @Test
    void validate_ModifyAttribute_이름변경_충돌() {
        // given
        when(store.findClassByName("Customer")).thenReturn(Optional.of(customer));
        when(store.getClassAttributes(customer)).thenReturn(List.of(
            new AttributeInfo("name", "EString", 0, 1),
            new AttributeInfo("fullName", "EString", 0, 1)
        ));

        // when & then
        assertThat(validator.validate(new ModifyAttributeIntent("Customer", "name", "fullName", null, null, null)))
            .contains("Attribute fullName already exists in class Customer");
        assertThat(validator.validate(new ModifyAttributeIntent("Customer", "name", null, "EInt", null, null)))
            .isEmpty();
    }

    @Test
    void validate_속성과_참조는_이름_공간을_공유() {
        // given
        when(store.findClassByName("Customer")).thenReturn(Optional.of(customer));
        when(store.getClassAttributes(customer)).thenReturn(List.of(new AttributeInfo("email", "EString", 0, 1)));
        when(store.getClassReferences(customer)).thenReturn(List.of(new ReferenceInfo("owner", "Customer", false, 0, 1)));

        // when & then
        assertThat(validator.validate(new AddAttributeIntent("Customer", "owner", "EString", 0, 1)))
            .contains("Reference owner already exists in class Customer");
        assertThat(validator.validate(new ModifyAttributeIntent("Customer", "email", "owner", null, null, null)))
            .contains("Reference owner already exists in class Customer");
        assertThat(validator.validate(new RemoveReferenceIntent("Customer", "owner")))
            .isEmpty();
    }

    @Test
    void validate_RemoveClass_참조_클래스를_Store_순서로_중복없이_나열() {
        // given
        ClassInfo order = ClassInfo.of("Order");
        ClassInfo invoice = ClassInfo.of("Invoice");
        when(store.findClassByName("Customer")).thenReturn(Optional.of(customer));
        when(store.getAllClasses()).thenReturn(List.of(invoice, customer, order));
        when(store.getClassReferences(invoice)).thenReturn(List.of(new ReferenceInfo("billTo", "Customer", false, 1, 1)));
        when(store.getClassReferences(order)).thenReturn(List.of(
            new ReferenceInfo("buyer", "Customer", false, 1, 1),
            new ReferenceInfo("payer", "Customer", false, 0, 1)
        ));

        // when
        Optional<String> reason = validator.validate(new RemoveClassIntent("Customer"));

        // then
        assertThat(reason).contains("Class Customer is referenced by: Invoice, Order");
        verify(store, never()).getClassReferences(customer);
    }

    @Test
    void validate_null_의도는_거부() {
        assertThatThrownBy(() -> validator.validate(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
