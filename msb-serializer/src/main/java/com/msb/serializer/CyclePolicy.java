package com.msb.serializer;

/**
 * What the serializer does when it reaches an object that is already on the current path.
 */
public enum CyclePolicy {
    /** Emit a reference marker pointing at the open occurrence and continue. */
    BREAK,
    /** Fail with {@link com.msb.entity.error.CyclicReferenceException}. */
    FAIL;

    /** Parses a policy name; null, blank or unknown values yield {@code defaultValue}. */
    public static CyclePolicy fromValue(String value, CyclePolicy defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String normalized = value.trim().toUpperCase();
        for (CyclePolicy p : values()) {
            if (p.name().equals(normalized)) return p;
        }
        return defaultValue;
    }
}
