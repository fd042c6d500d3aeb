package com.ryuqq.evolution.core.intent;

import com.ryuqq.evolution.core.model.ChangeType;
import com.ryuqq.evolution.core.model.ElementKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentActionTest {

    @Test
    void of_모든_조합이_정확히_하나의_액션에_대응() {
        for (ChangeType type : ChangeType.values()) {
            for (ElementKind kind : ElementKind.values()) {
                IntentAction action = IntentAction.of(type, kind).orElseThrow();
                assertThat(action.changeType()).isEqualTo(type);
                assertThat(action.elementKind()).isEqualTo(kind);
            }
        }
    }

    @Test
    void parse_인식불가_조합이면_empty() {
        assertThat(IntentAction.parse("add", "class")).contains(IntentAction.ADD_CLASS);
        assertThat(IntentAction.parse("MODIFY", "Reference")).contains(IntentAction.MODIFY_REFERENCE);
        assertThat(IntentAction.parse("rename", "class")).isEmpty();
        assertThat(IntentAction.parse("add", "operation")).isEmpty();
        assertThat(IntentAction.parse(null, null)).isEmpty();
    }

    @Test
    void resolutionKeys_의도_필드_이름을_사용() {
        assertThat(IntentAction.ADD_ATTRIBUTE.resolutionKeys()).containsExactly(
            IntentFields.CLASS_NAME, IntentFields.ATTRIBUTE_NAME, IntentFields.ATTRIBUTE_TYPE,
            IntentFields.LOWER_BOUND, IntentFields.UPPER_BOUND);
        assertThat(IntentAction.REMOVE_CLASS.resolutionKeys()).containsExactly(IntentFields.CLASS_NAME);
        assertThat(IntentAction.MODIFY_REFERENCE.resolutionKeys())
            .contains(IntentFields.NEW_TARGET_CLASS_NAME)
            .doesNotContain("name");
    }
}
