package com.msb.entity.error;

/**
 * Thrown when a type discriminator does not resolve to a registered entity kind.
 */
public final class UnknownTypeException extends MsbException {

    private final String typeName;

    public UnknownTypeException(String typeName, String path) {
        super("Unknown entity type: " + typeName, path);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
