package com.msb.entity.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;
import com.msb.entity.error.TypeMismatchException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declaration of one entity attribute: name, type, optional kind, nullability and default.
 * <p>
 * {@code kind} names the entity kind for {@link AttributeType#ENTITY} and
 * {@link AttributeType#CONTAINER}; for {@link AttributeType#LIST} and {@link AttributeType#MAP}
 * it makes the collection hold entities of that kind instead of plain values.
 * <p>
 * A null value is accepted when the attribute is nullable or has no default (null then means "unset").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AttributeDef {

    /** Attribute names every entity carries; schemas cannot declare them. */
    public static final Set<String> RESERVED_NAMES = Set.of(Entity.NAME, Entity.ACTIVE, Entity.TYPE);

    private final String name;
    private final AttributeType type;
    private final String kind;
    private final boolean nullable;
    private final Object defaultValue;

    @JsonCreator
    public AttributeDef(
            @JsonProperty("name") String name,
            @JsonProperty("type") AttributeType type,
            @JsonProperty("kind") String kind,
            @JsonProperty("nullable") Boolean nullable,
            @JsonProperty("default") Object defaultValue) {
        this.name = name != null ? name.trim() : null;
        this.type = type != null ? type : AttributeType.UNKNOWN;
        this.kind = kind != null && !kind.isBlank() ? kind.trim() : null;
        this.nullable = Boolean.TRUE.equals(nullable);
        this.defaultValue = defaultValue;
    }

    public static AttributeDef of(String name, AttributeType type) {
        return new AttributeDef(name, type, null, false, null);
    }

    /** Reference to an entity of the given kind. */
    public static AttributeDef entity(String name, String kind) {
        return new AttributeDef(name, AttributeType.ENTITY, kind, true, null);
    }

    /** Container of entities of the given kind. */
    public static AttributeDef container(String name, String kind) {
        return new AttributeDef(name, AttributeType.CONTAINER, kind, true, null);
    }

    /** Ordered list of entities of the given kind. */
    public static AttributeDef listOf(String name, String kind) {
        return new AttributeDef(name, AttributeType.LIST, kind, false, List.of());
    }

    /** String-keyed map of entities of the given kind. */
    public static AttributeDef mapOf(String name, String kind) {
        return new AttributeDef(name, AttributeType.MAP, kind, false, Map.of());
    }

    /** Returns a copy with the given default value. */
    public AttributeDef withDefault(Object value) {
        return new AttributeDef(name, type, kind, nullable, value);
    }

    /** Returns a copy that accepts null. */
    public AttributeDef asNullable() {
        return new AttributeDef(name, type, kind, true, defaultValue);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    /** Declared type. Never null; {@link AttributeType#UNKNOWN} when the source named an unknown type. */
    @JsonProperty("type")
    public AttributeType getType() {
        return type;
    }

    /** Entity kind for ENTITY/CONTAINER, element kind for LIST/MAP of entities; null otherwise. */
    @JsonProperty("kind")
    public String getKind() {
        return kind;
    }

    @JsonProperty("nullable")
    public boolean isNullable() {
        return nullable;
    }

    /** Raw default as declared (not yet coerced). */
    @JsonProperty("default")
    public Object getDefaultValue() {
        return defaultValue;
    }

    /** Human-readable declared type, e.g. {@code INTEGER} or {@code ENTITY<Person>}. */
    public String describeType() {
        return kind != null ? type.name() + "<" + kind + ">" : type.name();
    }

    /**
     * Checks this declaration. Returns the problems found; empty when the declaration is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isEmpty()) {
            errors.add("attribute name must be non-blank");
            return errors;
        }
        if (RESERVED_NAMES.contains(name)) {
            errors.add("attribute '" + name + "' uses a reserved name");
        }
        if (type == AttributeType.UNKNOWN) {
            errors.add("attribute '" + name + "' has an unknown type");
        }
        if (type.requiresKind() && kind == null) {
            errors.add("attribute '" + name + "' of type " + type + " must declare a kind");
        }
        if (kind != null && !type.acceptsKind()) {
            errors.add("attribute '" + name + "' of type " + type + " cannot declare a kind");
        }
        if (defaultValue != null && type.requiresKind()) {
            errors.add("attribute '" + name + "' of type " + type + " cannot declare a default");
        } else if (defaultValue != null && errors.isEmpty()) {
            try {
                coerce(defaultValue, name);
            } catch (TypeMismatchException e) {
                errors.add("attribute '" + name + "' default: " + e.getMessage());
            }
        }
        return errors;
    }

    /**
     * Returns the value converted to this attribute's stored representation.
     *
     * @param value candidate value
     * @param path  location reported on failure
     * @return the coerced value (collections are returned as unmodifiable copies)
     * @throws TypeMismatchException if the value cannot be coerced
     */
    public Object coerce(Object value, String path) {
        if (value == null) {
            if (nullable || defaultValue == null) return null;
            throw mismatch(null, path);
        }
        switch (type) {
            case STRING:
                if (value instanceof CharSequence cs) return cs.toString();
                break;
            case INTEGER: {
                Long l = integral(value);
                if (l != null && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return l.intValue();
                break;
            }
            case LONG: {
                Long l = integral(value);
                if (l != null) return l;
                break;
            }
            case FLOAT:
                if (value instanceof Number n) return n.doubleValue();
                break;
            case BOOLEAN:
                if (value instanceof Boolean) return value;
                break;
            case LIST:
                if (value instanceof List<?> list) return coerceList(list, path);
                break;
            case MAP:
                if (value instanceof Map<?, ?> map) return coerceMap(map, path);
                break;
            case ENTITY:
                if (value instanceof Entity e && kind.equals(e.getType())) return e;
                break;
            case CONTAINER:
                if (value instanceof EntityContainer c && kind.equals(c.getElementKind())) return c;
                break;
            case ANY:
                if (isPlain(value)) return copyPlain(value);
                break;
            default:
                break;
        }
        throw mismatch(value, path);
    }

    private List<Object> coerceList(List<?> list, String path) {
        List<Object> copy = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            copy.add(coerceElement(list.get(i), path + "/" + i));
        }
        return Collections.unmodifiableList(copy);
    }

    private Map<String, Object> coerceMap(Map<?, ?> map, String path) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String key)) {
                throw new TypeMismatchException(name, "string key", describe(e.getKey()), path);
            }
            copy.put(key, coerceElement(e.getValue(), path + "/" + key));
        }
        return Collections.unmodifiableMap(copy);
    }

    private Object coerceElement(Object element, String path) {
        if (kind == null) {
            if (isPlain(element)) return copyPlain(element);
            throw new TypeMismatchException(name, "plain value", describe(element), path);
        }
        if (element instanceof Entity e && kind.equals(e.getType())) return e;
        throw new TypeMismatchException(name, "ENTITY<" + kind + ">", describe(element), path);
    }

    private TypeMismatchException mismatch(Object value, String path) {
        return new TypeMismatchException(name, describeType(), describe(value), path);
    }

    private static Long integral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger b && b.bitLength() < Long.SIZE) {
            return b.longValue();
        }
        return null;
    }

    /** True if the value is interchange-safe: string, number, boolean, null, or lists/maps of those. */
    public static boolean isPlain(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return true;
        }
        if (value instanceof List<?> list) {
            for (Object o : list) {
                if (!isPlain(o)) return false;
            }
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String) || !isPlain(e.getValue())) return false;
            }
            return true;
        }
        return false;
    }

    /** Unmodifiable deep copy of a value accepted by {@link #isPlain(Object)}; scalars are returned as is. */
    static Object copyPlain(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object o : list) {
                copy.add(copyPlain(o));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put((String) e.getKey(), copyPlain(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    /** Short runtime description of a value for error messages. */
    public static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof Entity e) return "ENTITY<" + e.getType() + ">";
        if (value instanceof EntityContainer c) return "CONTAINER<" + c.getElementKind() + ">";
        if (value instanceof List) return "List";
        if (value instanceof Map) return "Map";
        return value.getClass().getSimpleName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeDef that = (AttributeDef) o;
        return nullable == that.nullable && Objects.equals(name, that.name) && type == that.type
                && Objects.equals(kind, that.kind) && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, kind, nullable, defaultValue);
    }

    @Override
    public String toString() {
        return name + ":" + describeType();
    }
}
