package com.msb.entity.error;

/**
 * Thrown when a value does not satisfy the declared type of an attribute, or when a
 * serialized form names a kind other than the one expected.
 */
public final class TypeMismatchException extends MsbException {

    private final String attribute;
    private final String expectedType;
    private final String actualType;

    public TypeMismatchException(String attribute, String expectedType, String actualType, String path) {
        super(String.format("Type mismatch for '%s': expected %s, got %s", attribute, expectedType, actualType), path);
        this.attribute = attribute;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }
}
