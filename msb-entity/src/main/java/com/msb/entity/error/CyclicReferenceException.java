package com.msb.entity.error;

/**
 * Thrown while serializing when an object is reached again from itself and cycles are
 * configured as fatal. {@link #getPath()} is where the object was met again;
 * {@link #getFirstOccurrence()} is where it is already being emitted.
 */
public final class CyclicReferenceException extends MsbException {

    private final String firstOccurrence;

    public CyclicReferenceException(String firstOccurrence, String path) {
        super("Cyclic reference to object emitted at " + firstOccurrence, path);
        this.firstOccurrence = firstOccurrence;
    }

    public String getFirstOccurrence() {
        return firstOccurrence;
    }
}
