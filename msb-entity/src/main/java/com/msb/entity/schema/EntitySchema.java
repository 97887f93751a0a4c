package com.msb.entity.schema;

import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;
import com.msb.entity.error.TypeMismatchException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declared shape of one entity kind: the kind name (used as the {@code type} discriminator)
 * and its attributes in declaration order. Construction, update and deserialization all
 * validate against this object.
 */
public final class EntitySchema {

    private final String kind;
    private final Map<String, AttributeDef> attributes;
    private final Map<String, Object> defaults;

    /**
     * @param kind       kind name (non-blank)
     * @param attributes attribute declarations in order
     * @throws IllegalArgumentException listing every problem when the declarations are invalid
     */
    public EntitySchema(String kind, List<AttributeDef> attributes) {
        List<String> errors = new ArrayList<>();
        if (kind == null || kind.isBlank()) {
            errors.add("kind must be non-blank");
        } else if (EntityContainer.TYPE.equals(kind.trim())) {
            errors.add("kind '" + EntityContainer.TYPE + "' is reserved for containers");
        }
        Map<String, AttributeDef> byName = new LinkedHashMap<>();
        Map<String, Object> coercedDefaults = new LinkedHashMap<>();
        for (AttributeDef def : attributes != null ? attributes : List.<AttributeDef>of()) {
            if (def == null) {
                errors.add("attribute declaration must not be null");
                continue;
            }
            List<String> defErrors = def.validate();
            if (!defErrors.isEmpty()) {
                errors.addAll(defErrors);
                continue;
            }
            if (byName.putIfAbsent(def.getName(), def) != null) {
                errors.add("attribute '" + def.getName() + "' is declared twice");
                continue;
            }
            coercedDefaults.put(def.getName(), def.coerce(def.getDefaultValue(), def.getName()));
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid schema " + kind + ": " + String.join("; ", errors));
        }
        this.kind = kind.trim();
        this.attributes = Collections.unmodifiableMap(byName);
        this.defaults = Collections.unmodifiableMap(coercedDefaults);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    /** Kind name; the value of the {@code type} discriminator. */
    public String getKind() {
        return kind;
    }

    /** Attribute declarations in declaration order. */
    public Collection<AttributeDef> getAttributes() {
        return attributes.values();
    }

    /** Declared attribute names in declaration order. */
    public Collection<String> getAttributeNames() {
        return attributes.keySet();
    }

    /** Returns the declaration for the attribute, or null if not declared. */
    public AttributeDef attribute(String name) {
        return name != null ? attributes.get(name) : null;
    }

    public boolean declares(String name) {
        return name != null && attributes.containsKey(name);
    }

    /** Default values (coerced) in declaration order. */
    public Map<String, Object> getDefaults() {
        return defaults;
    }

    /**
     * Coerces a value for the named attribute.
     *
     * @throws TypeMismatchException if the attribute is not declared or the value does not fit
     */
    public Object coerce(String attribute, Object value, String path) {
        AttributeDef def = attribute(attribute);
        if (def == null) {
            throw new TypeMismatchException(attribute, "declared attribute of " + kind, "undeclared", path);
        }
        return def.coerce(value, path);
    }

    /** Creates an active entity of this kind with every attribute at its default. */
    public Entity newEntity(String name) {
        return new Entity(this, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntitySchema that = (EntitySchema) o;
        return kind.equals(that.kind) && List.copyOf(attributes.values()).equals(List.copyOf(that.attributes.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, List.copyOf(attributes.values()));
    }

    @Override
    public String toString() {
        return kind + attributes.values();
    }

    public static final class Builder {
        private final String kind;
        private final List<AttributeDef> attributes = new ArrayList<>();

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder attribute(AttributeDef def) {
            attributes.add(Objects.requireNonNull(def, "def"));
            return this;
        }

        public Builder attribute(String name, AttributeType type) {
            return attribute(AttributeDef.of(name, type));
        }

        public EntitySchema build() {
            return new EntitySchema(kind, attributes);
        }
    }
}
