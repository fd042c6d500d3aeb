package com.ryuqq.evolution.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationId Value Object 테스트.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class OperationIdTest {

    @Test
    void of_ValidValue_CreatesOperationId() {
        // Given
        String value = "op-12345";

        // When
        OperationId id = OperationId.of(value);

        // Then
        assertEquals(value, id.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of("op 1/2")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void generate_ProducesDistinctValidIds() {
        // When
        OperationId first = OperationId.generate();
        OperationId second = OperationId.generate();

        // Then
        assertNotEquals(first, second);
        assertEquals(first, OperationId.of(first.getValue()));
    }

    @Test
    void equals_SameValue_AreEqualWithSameHashCode() {
        // Given
        OperationId a = OperationId.of("op-1");
        OperationId b = OperationId.of("op-1");

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
