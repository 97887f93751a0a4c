package com.msb.serializer;

/**
 * How the serializer emits an object reachable along more than one path without a cycle
 * (e.g. a diamond A→B→D, A→C→D).
 */
public enum SharedReferencePolicy {
    /** Emit the object in full on every path; deserialization yields independent equal copies. */
    COPY,
    /** Emit it in full once, then as a reference marker; deserialization yields one shared object. */
    REFERENCE;

    /** Parses a policy name; null, blank or unknown values yield {@code defaultValue}. */
    public static SharedReferencePolicy fromValue(String value, SharedReferencePolicy defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String normalized = value.trim().toUpperCase();
        for (SharedReferencePolicy p : values()) {
            if (p.name().equals(normalized)) return p;
        }
        return defaultValue;
    }
}
