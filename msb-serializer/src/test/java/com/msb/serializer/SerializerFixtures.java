package com.msb.serializer;

import com.msb.entity.Entity;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.AttributeType;
import com.msb.entity.schema.EntitySchema;
import com.msb.entity.schema.SchemaRegistry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/** Schemas shared by the serializer tests. */
final class SerializerFixtures {

    static final EntitySchema X = EntitySchema.builder("X")
            .attribute("value", AttributeType.INTEGER)
            .build();

    static final EntitySchema PET = EntitySchema.builder("Pet")
            .attribute("species", AttributeType.STRING)
            .build();

    static final EntitySchema PERSON = EntitySchema.builder("Person")
            .attribute("age", AttributeType.INTEGER)
            .attribute(AttributeDef.entity("friend", "Person"))
            .attribute(AttributeDef.listOf("pets", "Pet"))
            .attribute(AttributeDef.mapOf("contacts", "Person"))
            .attribute(AttributeDef.of("tags", AttributeType.LIST).withDefault(List.of()))
            .attribute(AttributeDef.of("extra", AttributeType.ANY))
            .build();

    static final EntitySchema TEAM = EntitySchema.builder("Team")
            .attribute(AttributeDef.container("members", "Person"))
            .attribute(AttributeDef.entity("lead", "Person"))
            .build();

    static final EntitySchema NODE = EntitySchema.builder("Node")
            .attribute("weight", AttributeType.FLOAT)
            .attribute(AttributeDef.entity("left", "Node"))
            .attribute(AttributeDef.entity("right", "Node"))
            .attribute(AttributeDef.entity("next", "Node"))
            .build();

    private SerializerFixtures() {
    }

    static SchemaRegistry registry() {
        return new SchemaRegistry()
                .register(X)
                .register(PET)
                .register(PERSON)
                .register(TEAM)
                .register(NODE);
    }

    static Entity person(String name, int age) {
        return PERSON.newEntity(name).set("age", age);
    }

    /** Counts reference markers anywhere in a serialized form. */
    static int countReferences(Object form) {
        int count = 0;
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(form);
        while (!pending.isEmpty()) {
            Object v = pending.pop();
            if (SerializedForm.isReference(v)) {
                count++;
            } else if (v instanceof Map<?, ?> map) {
                map.values().forEach(x -> { if (x != null) pending.push(x); });
            } else if (v instanceof List<?> list) {
                list.forEach(x -> { if (x != null) pending.push(x); });
            }
        }
        return count;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Object value) {
        return (Map<String, Object>) value;
    }
}
