package com.msb.entity.container;

/**
 * What a container does when it receives an entity whose name it already holds.
 */
public enum DuplicateNamePolicy {
    /** Fail with {@link com.msb.entity.error.DuplicateNameException}; the container is unchanged. */
    REJECT,
    /** Replace the held entity, keeping its position in insertion order. */
    OVERWRITE;

    /** Parses a policy name; null, blank or unknown values yield {@code defaultValue}. */
    public static DuplicateNamePolicy fromValue(String value, DuplicateNamePolicy defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String normalized = value.trim().toUpperCase();
        for (DuplicateNamePolicy p : values()) {
            if (p.name().equals(normalized)) return p;
        }
        return defaultValue;
    }
}
