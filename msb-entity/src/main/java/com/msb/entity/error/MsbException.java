package com.msb.entity.error;

/**
 * Base of all entity, container and serialization failures. Carries the location of the
 * offending value: an entity path such as {@code Person[alice].age} for direct updates, or a
 * document pointer such as {@code #/friend/age} while (de)serializing.
 */
public abstract class MsbException extends RuntimeException {

    private final String path;

    protected MsbException(String message, String path) {
        super(path != null ? message + " at " + path : message);
        this.path = path;
    }

    /** Location of the failure; may be null when no location applies. */
    public String getPath() {
        return path;
    }
}
