package com.msb.entity.validation;

/**
 * Argument checks shared by entities, containers and schemas.
 */
public final class Validation {

    private Validation() {
    }

    /**
     * Returns the value trimmed when it is a non-blank string.
     *
     * @param value     value to check
     * @param fieldName name reported in the exception message
     * @throws IllegalArgumentException if value is null, not a string, or blank
     */
    public static String checkNonEmptyString(Object value, String fieldName) {
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException(fieldName + " must be a string, got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        if (s.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return s.trim();
    }
}
