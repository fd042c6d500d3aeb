package com.ryuqq.evolution.core.schema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cardinality 규칙 테스트.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class CardinalityTest {

    @Test
    void isValid_ManyUpperBound_AlwaysValid() {
        assertTrue(Cardinality.isValid(0, Cardinality.MANY));
        assertTrue(Cardinality.isValid(5, Cardinality.MANY));
    }

    @Test
    void isValid_UpperBelowLower_Invalid() {
        assertFalse(Cardinality.isValid(2, 1));
        assertFalse(Cardinality.isValid(0, 0));
        assertFalse(Cardinality.isValid(-1, 1));
    }

    @Test
    void isValid_DefaultBounds_Valid() {
        assertTrue(Cardinality.isValid(Cardinality.DEFAULT_LOWER_BOUND, Cardinality.DEFAULT_UPPER_BOUND));
        assertTrue(Cardinality.isValid(1, 3));
    }

    @Test
    void dataTypes_BuiltInLookup() {
        assertTrue(DataTypes.isBuiltIn("EString"));
        assertFalse(DataTypes.isBuiltIn("Customer"));
        assertFalse(DataTypes.isBuiltIn(null));
    }

    @Test
    void classInfo_BlankName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ClassInfo.of(" "));
    }
}
