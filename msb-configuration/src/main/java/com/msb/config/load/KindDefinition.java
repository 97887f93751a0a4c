package com.msb.config.load;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.EntitySchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One kind in a schema catalog: its attribute declarations in order. The kind name is the
 * catalog map key.
 */
public final class KindDefinition {

    private final List<AttributeDef> attributes;

    @JsonCreator
    public KindDefinition(@JsonProperty("attributes") List<AttributeDef> attributes) {
        this.attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }

    public static KindDefinition of(EntitySchema schema) {
        return new KindDefinition(new ArrayList<>(schema.getAttributes()));
    }

    public List<AttributeDef> getAttributes() {
        return attributes;
    }

    /**
     * @throws IllegalArgumentException listing every invalid declaration
     */
    public EntitySchema toSchema(String kind) {
        return new EntitySchema(kind, attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return attributes.equals(((KindDefinition) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }
}
