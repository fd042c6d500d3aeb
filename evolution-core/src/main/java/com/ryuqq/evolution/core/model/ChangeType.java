package com.ryuqq.evolution.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 모델 수준 변경의 종류.
 *
 * <p>Change Descriptor의 {@code changeType} 문자열은 대소문자를 구분하지 않고
 * 이 enum으로 해석됩니다 (예: "add", "Add", "ADD").</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public enum ChangeType {

    ADD,

    REMOVE,

    MODIFY;

    /**
     * 문자열을 ChangeType으로 해석.
     *
     * @param value 원본 문자열 (null 허용)
     * @return 해석된 ChangeType, 인식할 수 없으면 empty
     */
    public static Optional<ChangeType> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ChangeType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
