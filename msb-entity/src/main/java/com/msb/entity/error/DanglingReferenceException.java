package com.msb.entity.error;

/**
 * Thrown when a reference marker points at a location where no object was reconstructed.
 */
public final class DanglingReferenceException extends MsbException {

    private final String reference;

    public DanglingReferenceException(String reference, String path) {
        super("Dangling reference " + reference, path);
        this.reference = reference;
    }

    /** The unresolved pointer carried by the marker. */
    public String getReference() {
        return reference;
    }
}
