package com.msb.entity.schema;

import com.msb.entity.Entity;
import com.msb.entity.error.UnknownTypeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaRegistryTest {

    @Test
    void register_rejectsSecondSchemaForSameKind() {
        SchemaRegistry registry = new SchemaRegistry().register(EntitySchema.builder("X").build());
        assertThrows(IllegalArgumentException.class, () -> registry.register(EntitySchema.builder("X").build()));
    }

    @Test
    void require_unknownKindThrowsUnknownType() {
        SchemaRegistry registry = new SchemaRegistry();
        UnknownTypeException e = assertThrows(UnknownTypeException.class, () -> registry.require("Ghost", "#"));
        assertEquals("Ghost", e.getTypeName());
        assertEquals("#", e.getPath());
        assertNull(registry.get("Ghost"));
        assertFalse(registry.contains("Ghost"));
    }

    @Test
    void kinds_areSortedAndNewEntityUsesRegisteredSchema() {
        SchemaRegistry registry = new SchemaRegistry()
                .register(EntitySchema.builder("Zebra").build())
                .register(EntitySchema.builder("Ant").attribute("legs", AttributeType.INTEGER).build());
        assertEquals(List.of("Ant", "Zebra"), List.copyOf(registry.kinds()));
        Entity ant = registry.newEntity("Ant", "a1");
        assertEquals("Ant", ant.getType());
        assertTrue(ant.getSchema().declares("legs"));
    }
}
