package com.msb.entity;

import com.msb.entity.container.EntityContainer;
import com.msb.entity.error.TypeMismatchException;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.EntitySchema;
import com.msb.entity.validation.Validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named, typed record whose attributes are declared by an {@link EntitySchema}.
 * Every declared attribute always has a value (its default until set); every value
 * satisfies its declaration. Attributes holding other entities are references: the
 * graph they form may share nodes and contain cycles.
 * <p>
 * Not thread-safe.
 */
public final class Entity {

    /** Identity key within a container. */
    public static final String NAME = "name";
    /** Active flag. */
    public static final String ACTIVE = "isactive";
    /** Kind discriminator. */
    public static final String TYPE = "type";

    private final EntitySchema schema;
    private final String name;
    private boolean active;
    private final Map<String, Object> values;

    /**
     * Creates an active entity with every attribute at its default.
     *
     * @throws IllegalArgumentException if name is blank
     */
    public Entity(EntitySchema schema, String name) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.name = Validation.checkNonEmptyString(name, NAME);
        this.active = true;
        this.values = new LinkedHashMap<>(schema.getDefaults());
    }

    public String getName() {
        return name;
    }

    /** Kind name of this entity's schema. */
    public String getType() {
        return schema.getKind();
    }

    public EntitySchema getSchema() {
        return schema;
    }

    public boolean isActive() {
        return active;
    }

    public Entity setActive(boolean active) {
        this.active = active;
        return this;
    }

    public Entity activate() {
        return setActive(true);
    }

    public Entity deactivate() {
        return setActive(false);
    }

    /**
     * Returns the value of a declared attribute (its default when never set).
     *
     * @throws IllegalArgumentException if the attribute is not declared
     */
    public Object get(String attribute) {
        if (!schema.declares(attribute)) {
            throw new IllegalArgumentException("Attribute '" + attribute + "' is not declared by " + schema.getKind());
        }
        return values.get(attribute);
    }

    /** Returns the value cast to the given type; convenience for callers that know the declaration. */
    public <T> T get(String attribute, Class<T> type) {
        return type.cast(get(attribute));
    }

    /** True if the attribute is declared and currently non-null. */
    public boolean has(String attribute) {
        return schema.declares(attribute) && values.get(attribute) != null;
    }

    /**
     * Sets a declared attribute.
     *
     * @throws TypeMismatchException if the attribute is not declared or the value does not fit; state is unchanged
     */
    public Entity set(String attribute, Object value) {
        Object coerced = schema.coerce(attribute, value, path(attribute));
        values.put(attribute, coerced);
        return this;
    }

    /**
     * Applies several changes at once. Every entry is validated before any is applied, so on
     * failure the entity keeps its prior state. Accepts declared attributes and {@value #ACTIVE}.
     *
     * @throws TypeMismatchException on the first entry that does not fit
     */
    public Entity update(Map<String, ?> changes) {
        Objects.requireNonNull(changes, "changes");
        Map<String, Object> validated = new LinkedHashMap<>();
        Boolean newActive = null;
        for (Map.Entry<String, ?> e : changes.entrySet()) {
            String attribute = e.getKey();
            if (ACTIVE.equals(attribute)) {
                if (!(e.getValue() instanceof Boolean b)) {
                    throw new TypeMismatchException(ACTIVE, "BOOLEAN", AttributeDef.describe(e.getValue()), path(ACTIVE));
                }
                newActive = b;
            } else if (NAME.equals(attribute) || TYPE.equals(attribute)) {
                throw new TypeMismatchException(attribute, "writable attribute", "read-only", path(attribute));
            } else {
                validated.put(attribute, schema.coerce(attribute, e.getValue(), path(attribute)));
            }
        }
        values.putAll(validated);
        if (newActive != null) {
            active = newActive;
        }
        return this;
    }

    /** Read-only view of all attribute values in declaration order. */
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(values);
    }

    /** Shallow copy: same name, flag and values; referenced entities are shared, not copied. */
    public Entity copy() {
        Entity copy = new Entity(schema, name);
        copy.active = active;
        copy.values.putAll(values);
        return copy;
    }

    private String path(String attribute) {
        return schema.getKind() + "[" + name + "]." + attribute;
    }

    /** Structural equality over the reachable graph; terminates on cycles. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        return StructuralEquality.equal(this, o);
    }

    /** Hashes plain attribute values only; referenced entities contribute their name. */
    @Override
    public int hashCode() {
        int h = Objects.hash(getType(), name, active);
        for (Object v : values.values()) {
            h = 31 * h + shallowHash(v);
        }
        return h;
    }

    private static int shallowHash(Object v) {
        if (v instanceof Entity e) return Objects.hash(e.getType(), e.getName());
        if (v instanceof EntityContainer c) return Objects.hash(c.getElementKind(), c.size());
        if (v instanceof List<?> list) {
            int h = 1;
            for (Object o : list) h = 31 * h + shallowHash(o);
            return h;
        }
        if (v instanceof Map<?, ?> map) {
            int h = 0;
            for (Map.Entry<?, ?> e : map.entrySet()) h += Objects.hashCode(e.getKey()) ^ shallowHash(e.getValue());
            return h;
        }
        return Objects.hashCode(v);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getType()).append('[').append(name).append(']');
        sb.append(active ? "" : "(inactive)").append('{');
        boolean first = true;
        for (Map.Entry<String, Object> e : values.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            Object v = e.getValue();
            sb.append(e.getKey()).append('=');
            if (v instanceof Entity ref) {
                sb.append(ref.getType()).append('[').append(ref.getName()).append(']');
            } else if (v instanceof EntityContainer c) {
                sb.append("Container<").append(c.getElementKind()).append(">(").append(c.size()).append(')');
            } else if (v instanceof List<?> || v instanceof Map<?, ?>) {
                sb.append(AttributeDef.describe(v));
            } else {
                sb.append(v);
            }
        }
        return sb.append('}').toString();
    }
}
