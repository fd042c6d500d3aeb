package com.ryuqq.evolution.application.interpreter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InterpreterConfig 테스트.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class InterpreterConfigTest {

    @Test
    void defaultConstructor_UsesDocumentedDefaults() {
        // When
        InterpreterConfig config = new InterpreterConfig();

        // Then
        assertEquals("EString", config.defaultAttributeType());
        assertEquals(0, config.defaultLowerBound());
        assertEquals(1, config.defaultUpperBound());
        assertFalse(config.defaultContainment());
    }

    @Test
    void withMethods_ReturnNewInstance() {
        // Given
        InterpreterConfig config = new InterpreterConfig();

        // When
        InterpreterConfig changed = config.withDefaultContainment(true).withDefaultLowerBound(1);

        // Then
        assertTrue(changed.defaultContainment());
        assertEquals(1, changed.defaultLowerBound());
        assertFalse(config.defaultContainment());
    }

    @Test
    void constructor_BlankType_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new InterpreterConfig().withDefaultAttributeType(" ")
        );
        assertTrue(exception.getMessage().contains("defaultAttributeType"));
    }

    @Test
    void constructor_InvalidBounds_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InterpreterConfig().withDefaultLowerBound(2));
        assertThrows(IllegalArgumentException.class, () -> new InterpreterConfig().withDefaultUpperBound(0));
        assertDoesNotThrow(() -> new InterpreterConfig().withDefaultUpperBound(-1));
    }
}
