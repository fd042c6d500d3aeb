package com.ryuqq.evolution.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 변경 대상 스키마 요소의 종류.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public enum ElementKind {

    CLASS,

    ATTRIBUTE,

    REFERENCE;

    /**
     * 문자열을 ElementKind로 해석 (대소문자 무시).
     *
     * @param value 원본 문자열 (null 허용)
     * @return 해석된 ElementKind, 인식할 수 없으면 empty
     */
    public static Optional<ElementKind> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ElementKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
