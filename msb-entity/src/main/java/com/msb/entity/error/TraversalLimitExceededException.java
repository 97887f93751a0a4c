package com.msb.entity.error;

/**
 * Thrown when a traversal visits more graph nodes than allowed. Indicates the limit and the
 * count reached for logging and handling.
 */
public final class TraversalLimitExceededException extends MsbException {

    private final int value;
    private final int limit;

    public TraversalLimitExceededException(int value, int limit, String path) {
        super(String.format("Traversal limit exceeded (value=%d, limit=%d)", value, limit), path);
        this.value = value;
        this.limit = limit;
    }

    public int getValue() {
        return value;
    }

    public int getLimit() {
        return limit;
    }
}
