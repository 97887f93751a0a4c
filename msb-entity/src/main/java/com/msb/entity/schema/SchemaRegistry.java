package com.msb.entity.schema;

import com.msb.entity.Entity;
import com.msb.entity.error.UnknownTypeException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of entity schemas by kind. The serializer resolves {@code type} discriminators
 * here; register every kind that may appear in a serialized form.
 */
public final class SchemaRegistry {

    private final Map<String, EntitySchema> schemasByKind = new ConcurrentHashMap<>();

    /**
     * Registers a schema under its kind.
     *
     * @throws IllegalArgumentException if a schema is already registered for the kind
     */
    public SchemaRegistry register(EntitySchema schema) {
        Objects.requireNonNull(schema, "schema");
        if (schemasByKind.putIfAbsent(schema.getKind(), schema) != null) {
            throw new IllegalArgumentException("Schema already registered for kind " + schema.getKind());
        }
        return this;
    }

    /** Returns the schema for the kind, or null if not registered. */
    public EntitySchema get(String kind) {
        if (kind == null || kind.isBlank()) return null;
        return schemasByKind.get(kind.trim());
    }

    /**
     * Returns the schema for the kind.
     *
     * @param path location reported on failure
     * @throws UnknownTypeException if the kind is not registered
     */
    public EntitySchema require(String kind, String path) {
        EntitySchema schema = get(kind);
        if (schema == null) {
            throw new UnknownTypeException(kind, path);
        }
        return schema;
    }

    public boolean contains(String kind) {
        return get(kind) != null;
    }

    /** Registered kinds, sorted. */
    public Set<String> kinds() {
        return Collections.unmodifiableSet(new TreeSet<>(schemasByKind.keySet()));
    }

    /** Creates an entity of the registered kind. */
    public Entity newEntity(String kind, String name) {
        return require(kind, null).newEntity(name);
    }
}
