package com.msb.entity;

import com.msb.entity.error.TypeMismatchException;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.AttributeType;
import com.msb.entity.schema.EntitySchema;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityTest {

    private static final EntitySchema PERSON = EntitySchema.builder("Person")
            .attribute("age", AttributeType.INTEGER)
            .attribute(AttributeDef.of("email", AttributeType.STRING).withDefault("unknown"))
            .attribute(AttributeDef.entity("friend", "Person"))
            .build();

    @Test
    void newEntity_isActiveWithDefaults() {
        Entity alice = PERSON.newEntity("alice");
        assertEquals("alice", alice.getName());
        assertEquals("Person", alice.getType());
        assertTrue(alice.isActive());
        assertNull(alice.get("age"));
        assertEquals("unknown", alice.get("email"));
        assertFalse(alice.has("age"));
        assertEquals(List.of("age", "email", "friend"), List.copyOf(alice.attributes().keySet()));
    }

    @Test
    void newEntity_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> PERSON.newEntity(" "));
    }

    @Test
    void set_wrongTypeFailsAndKeepsPriorValue() {
        Entity alice = PERSON.newEntity("alice").set("age", 30);
        TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> alice.set("age", "thirty"));
        assertEquals("Person[alice].age", e.getPath());
        assertEquals(30, alice.get("age"));
        assertEquals(30, alice.get("age", Integer.class));
    }

    @Test
    void set_undeclaredAttributeIsTypeMismatch() {
        Entity alice = PERSON.newEntity("alice");
        assertThrows(TypeMismatchException.class, () -> alice.set("height", 170));
        assertThrows(IllegalArgumentException.class, () -> alice.get("height"));
    }

    @Test
    void update_isAllOrNothing() {
        Entity alice = PERSON.newEntity("alice").set("age", 30);
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("email", "alice@example.com");
        changes.put("isactive", false);
        changes.put("age", 31.5);

        assertThrows(TypeMismatchException.class, () -> alice.update(changes));
        assertEquals(30, alice.get("age"));
        assertEquals("unknown", alice.get("email"));
        assertTrue(alice.isActive());

        changes.put("age", 31);
        alice.update(changes);
        assertEquals(31, alice.get("age"));
        assertEquals("alice@example.com", alice.get("email"));
        assertFalse(alice.isActive());
    }

    @Test
    void update_rejectsNameAndType() {
        Entity alice = PERSON.newEntity("alice");
        assertThrows(TypeMismatchException.class, () -> alice.update(Map.of("name", "bob")));
        assertThrows(TypeMismatchException.class, () -> alice.update(Map.of("type", "Robot")));
        assertThrows(TypeMismatchException.class, () -> alice.update(Map.of("isactive", "no")));
    }

    @Test
    void setNullOnAttributeWithDefaultIsRejected() {
        Entity alice = PERSON.newEntity("alice");
        assertThrows(TypeMismatchException.class, () -> alice.set("email", null));
    }

    @Test
    void equals_comparesStructureAndTerminatesOnCycles() {
        Entity a1 = PERSON.newEntity("a").set("age", 1);
        Entity b1 = PERSON.newEntity("b").set("age", 2);
        a1.set("friend", b1);
        b1.set("friend", a1);

        Entity a2 = PERSON.newEntity("a").set("age", 1);
        Entity b2 = PERSON.newEntity("b").set("age", 2);
        a2.set("friend", b2);
        b2.set("friend", a2);

        assertEquals(a1, a2);
        assertEquals(a1.hashCode(), a2.hashCode());

        b2.set("age", 3);
        assertNotEquals(a1, a2);
    }

    @Test
    void equals_distinguishesActiveFlagAndName() {
        assertNotEquals(PERSON.newEntity("a"), PERSON.newEntity("b"));
        assertNotEquals(PERSON.newEntity("a"), PERSON.newEntity("a").deactivate());
        assertEquals(PERSON.newEntity("a"), PERSON.newEntity("a"));
    }

    @Test
    void copy_sharesReferencedEntities() {
        Entity bob = PERSON.newEntity("bob");
        Entity alice = PERSON.newEntity("alice").set("age", 30).set("friend", bob).deactivate();
        Entity copy = alice.copy();

        assertEquals(alice, copy);
        assertSame(bob, copy.get("friend"));
        copy.set("age", 40);
        assertEquals(30, alice.get("age"));
    }

    @Test
    void toString_doesNotRecurseIntoReferences() {
        Entity a = PERSON.newEntity("a");
        a.set("friend", a);
        assertEquals("Person[a]{age=null, email=unknown, friend=Person[a]}", a.toString());
    }
}
