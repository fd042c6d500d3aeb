package com.ryuqq.evolution.core.contract;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Details 타입별 접근자 테스트.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class DetailsTest {

    @Test
    void getInteger_숫자_표현을_정수로_변환() {
        // given
        Details details = Details.of(Map.of(
            "int", 3,
            "long", 7L,
            "double", 2.0,
            "text", "-1"
        ));

        // then
        assertThat(details.getInteger("int")).isEqualTo(3);
        assertThat(details.getInteger("long")).isEqualTo(7);
        assertThat(details.getInteger("double")).isEqualTo(2);
        assertThat(details.getInteger("text")).isEqualTo(-1);
        assertThat(details.getInteger("missing")).isNull();
    }

    @Test
    void getInteger_정수가_아니면_예외() {
        Details details = Details.of(Map.of("fraction", 1.5, "word", "many"));

        assertThatThrownBy(() -> details.getInteger("fraction"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'fraction'");
        assertThatThrownBy(() -> details.getInteger("word"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expected an integer");
    }

    @Test
    void getBoolean_불리언과_문자열을_허용() {
        Details details = Details.of(Map.of("a", true, "b", "FALSE", "c", "yes"));

        assertThat(details.getBoolean("a")).isTrue();
        assertThat(details.getBoolean("b")).isFalse();
        assertThatThrownBy(() -> details.getBoolean("c"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getStringList_문자열_컬렉션만_허용() {
        Details details = Details.of(Map.of(
            "names", List.of("Named", "Entity"),
            "mixed", Arrays.asList("Named", 3),
            "single", "Named"
        ));

        assertThat(details.getStringList("names")).containsExactly("Named", "Entity");
        assertThatThrownBy(() -> details.getStringList("mixed"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> details.getStringList("single"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getString_문자열이_아니면_예외() {
        Details details = Details.of(Map.of("name", 42));

        assertThatThrownBy(() -> details.getString("name"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid value for 'name': expected text but was '42'");
    }

    @Test
    void null값은_키는_존재하지만_값은_없음() {
        // given
        Map<String, Object> raw = new HashMap<>();
        raw.put("name", null);
        Details details = Details.of(raw);

        // then
        assertThat(details.contains("name")).isTrue();
        assertThat(details.hasValue("name")).isFalse();
        assertThat(details.getString("name")).isNull();
    }

    @Test
    void 생성후_원본_변경의_영향을_받지_않음() {
        // given
        Map<String, Object> raw = new HashMap<>();
        raw.put("name", "Customer");
        Details details = Details.of(raw);

        // when
        raw.put("name", "Order");

        // then
        assertThat(details.getString("name")).isEqualTo("Customer");
        assertThatThrownBy(() -> details.asMap().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void of_null키는_거부() {
        Map<String, Object> raw = new HashMap<>();
        raw.put(null, "value");

        assertThatThrownBy(() -> Details.of(raw))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void changeDescriptor_details가_null이면_빈_Details() {
        ChangeDescriptor descriptor = ChangeDescriptor.of("add", "class", null);

        assertThat(descriptor.details().isEmpty()).isTrue();
    }
}
