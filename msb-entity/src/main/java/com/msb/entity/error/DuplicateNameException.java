package com.msb.entity.error;

/**
 * Thrown when a container that rejects duplicates receives a second entity with a name it
 * already holds.
 */
public final class DuplicateNameException extends MsbException {

    private final String containerName;
    private final String entityName;

    public DuplicateNameException(String containerName, String entityName, String path) {
        super(String.format("Container '%s' already holds an entity named '%s'", containerName, entityName), path);
        this.containerName = containerName;
        this.entityName = entityName;
    }

    public String getContainerName() {
        return containerName;
    }

    public String getEntityName() {
        return entityName;
    }
}
