package com.msb.entity.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of an entity attribute. Schema catalogs use the enum name as string;
 * unknown values deserialize as {@link #UNKNOWN}, which schemas refuse.
 *
 * @see AttributeDef#getType()
 */
public enum AttributeType {
    STRING,
    /** Integral number in int range; stored as {@link Integer}. */
    INTEGER,
    /** Integral number; stored as {@link Long}. */
    LONG,
    /** Any number; stored as {@link Double}. */
    FLOAT,
    BOOLEAN,
    /** Ordered sequence; of entities when the attribute declares a kind. */
    LIST,
    /** String-keyed mapping; of entities when the attribute declares a kind. */
    MAP,
    /** Reference to another entity of the declared kind. */
    ENTITY,
    /** Container whose elements are of the declared kind. */
    CONTAINER,
    /** Any interchange-safe value (string, number, boolean, null, list, map). */
    ANY,
    /** Used when a catalog contains an unknown type string. */
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static AttributeType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase();
        for (AttributeType t : values()) {
            if (t != UNKNOWN && t.name().equals(normalized)) return t;
        }
        return UNKNOWN;
    }

    /** True for types that require a kind. */
    public boolean requiresKind() {
        return this == ENTITY || this == CONTAINER;
    }

    /** True for types that accept an optional element kind. */
    public boolean acceptsKind() {
        return this == ENTITY || this == CONTAINER || this == LIST || this == MAP;
    }
}
