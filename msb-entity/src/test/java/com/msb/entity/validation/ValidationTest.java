package com.msb.entity.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationTest {

    @Test
    void checkNonEmptyString_returnsTrimmedValue() {
        assertEquals("alice", Validation.checkNonEmptyString("  alice ", "name"));
    }

    @Test
    void checkNonEmptyString_rejectsBlankNullAndNonStrings() {
        IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
                () -> Validation.checkNonEmptyString("   ", "name"));
        assertTrue(blank.getMessage().startsWith("name"));
        assertThrows(IllegalArgumentException.class, () -> Validation.checkNonEmptyString(null, "name"));
        assertThrows(IllegalArgumentException.class, () -> Validation.checkNonEmptyString(42, "name"));
    }
}
