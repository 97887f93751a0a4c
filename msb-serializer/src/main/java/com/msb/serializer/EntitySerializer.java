package com.msb.serializer;

import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;
import com.msb.entity.error.CyclicReferenceException;
import com.msb.entity.error.DanglingReferenceException;
import com.msb.entity.error.DuplicateNameException;
import com.msb.entity.error.TraversalLimitExceededException;
import com.msb.entity.error.TypeMismatchException;
import com.msb.entity.error.UnknownTypeException;
import com.msb.entity.schema.SchemaRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Converts entity graphs to the serialized form and back. See {@link SerializedForm} for the
 * layout and reference markers.
 * <p>
 * Each call is synchronous and keeps its own traversal state, so one instance can serve
 * several threads; callers must not mutate a graph while it is being serialized.
 */
public final class EntitySerializer {

    private final SchemaRegistry registry;
    private final SerializerOptions options;

    public EntitySerializer(SchemaRegistry registry) {
        this(registry, SerializerOptions.defaults());
    }

    /**
     * @param registry schemas used to resolve {@code type} discriminators and validate attributes
     * @param options  cycle, sharing, bound and dangling-reference behavior
     */
    public EntitySerializer(SchemaRegistry registry, SerializerOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
    }

    public SchemaRegistry getRegistry() {
        return registry;
    }

    public SerializerOptions getOptions() {
        return options;
    }

    /**
     * Serializes an entity and everything reachable from it.
     *
     * @return ordered map of plain values, nested forms and reference markers
     * @throws CyclicReferenceException        on a cycle when {@link CyclePolicy#FAIL}
     * @throws TraversalLimitExceededException when more than {@link SerializerOptions#getMaxNodes()} nodes are visited
     */
    public Map<String, Object> serialize(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        return new GraphWriter(options).write(entity);
    }

    /** Serializes a container as {@code {"name", "type": "Container", "elementType", "items"}}. */
    public Map<String, Object> serialize(EntityContainer container) {
        Objects.requireNonNull(container, "container");
        return new GraphWriter(options).write(container);
    }

    /**
     * Rebuilds an entity; the kind comes from the form's {@code type}.
     *
     * @throws UnknownTypeException       if the kind is missing or not registered
     * @throws TypeMismatchException      if a value does not fit its declared type
     * @throws DanglingReferenceException if a marker cannot be resolved and dangling references are fatal
     * @throws DuplicateNameException     if a rebuilt container rejects a name
     */
    public Entity deserialize(Map<String, ?> form) {
        return deserialize(form, null);
    }

    /**
     * Rebuilds an entity of the expected kind. A form without {@code type} is read as that kind;
     * a form naming another kind fails with {@link TypeMismatchException}.
     */
    public Entity deserialize(Map<String, ?> form, String expectedKind) {
        Objects.requireNonNull(form, "form");
        return new GraphReader(registry, options).readEntity(form, expectedKind);
    }

    /** Rebuilds a container serialized by {@link #serialize(EntityContainer)}. */
    public EntityContainer deserializeContainer(Map<String, ?> form) {
        Objects.requireNonNull(form, "form");
        return new GraphReader(registry, options).readContainer(form);
    }

    /** Rebuilds whichever the form holds: an {@link EntityContainer} or an {@link Entity}. */
    public Object deserializeAny(Map<String, ?> form) {
        Objects.requireNonNull(form, "form");
        if (SerializedForm.CONTAINER_TYPE.equals(form.get(SerializedForm.TYPE))) {
            return deserializeContainer(form);
        }
        return deserialize(form);
    }
}
