package com.msb.entity.container;

import com.msb.entity.Entity;
import com.msb.entity.error.DuplicateNameException;
import com.msb.entity.error.TypeMismatchException;
import com.msb.entity.schema.AttributeType;
import com.msb.entity.schema.EntitySchema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityContainerTest {

    private static final EntitySchema TASK = EntitySchema.builder("Task")
            .attribute("priority", AttributeType.INTEGER)
            .build();

    private static Entity task(String name, int priority) {
        return TASK.newEntity(name).set("priority", priority);
    }

    @Test
    void add_keepsInsertionOrder() {
        EntityContainer tasks = new EntityContainer("tasks", "Task")
                .add(task("write", 2))
                .add(task("review", 1))
                .add(task("ship", 3));

        assertEquals(List.of("write", "review", "ship"), tasks.names());
        assertEquals(3, tasks.size());
        List<String> iterated = new ArrayList<>();
        for (Entity e : tasks) {
            iterated.add(e.getName());
        }
        assertEquals(tasks.names(), iterated);
    }

    @Test
    void add_rejectsDuplicateNameByDefault() {
        Entity original = task("write", 2);
        EntityContainer tasks = new EntityContainer("tasks", "Task").add(original);

        DuplicateNameException e = assertThrows(DuplicateNameException.class, () -> tasks.add(task("write", 9)));
        assertEquals("tasks", e.getContainerName());
        assertEquals("write", e.getEntityName());
        assertSame(original, tasks.get("write"));
    }

    @Test
    void add_overwritePolicyReplacesInPlace() {
        EntityContainer tasks = new EntityContainer("tasks", "Task", DuplicateNamePolicy.OVERWRITE)
                .add(task("write", 2))
                .add(task("ship", 3));
        Entity replacement = task("write", 9);
        tasks.add(replacement);

        assertEquals(List.of("write", "ship"), tasks.names());
        assertSame(replacement, tasks.get("write"));
    }

    @Test
    void add_rejectsOtherKinds() {
        EntityContainer tasks = new EntityContainer("tasks", "Task");
        Entity note = EntitySchema.builder("Note").build().newEntity("n1");
        TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> tasks.add(note));
        assertEquals("Task", e.getExpectedType());
        assertEquals("Note", e.getActualType());
        assertTrue(tasks.isEmpty());
    }

    @Test
    void addAll_isAllOrNothing() {
        EntityContainer tasks = new EntityContainer("tasks", "Task").add(task("ship", 3));
        assertThrows(DuplicateNameException.class,
                () -> tasks.addAll(List.of(task("write", 1), task("ship", 2))));
        assertEquals(List.of("ship"), tasks.names());

        assertThrows(DuplicateNameException.class,
                () -> tasks.addAll(List.of(task("a", 1), task("a", 2))));
        assertEquals(1, tasks.size());

        tasks.addAll(List.of(task("write", 1), task("review", 2)));
        assertEquals(List.of("ship", "write", "review"), tasks.names());
    }

    @Test
    void getRequireRemoveContains() {
        EntityContainer tasks = new EntityContainer("tasks", "Task").add(task("write", 1));
        assertTrue(tasks.contains("write"));
        assertNull(tasks.get("missing"));
        assertThrows(NoSuchElementException.class, () -> tasks.require("missing"));

        Entity removed = tasks.remove("write");
        assertEquals("write", removed.getName());
        assertFalse(tasks.contains("write"));
        assertNull(tasks.remove("write"));
    }

    @Test
    void filterFindByAndActive() {
        EntityContainer tasks = new EntityContainer("tasks", "Task")
                .add(task("write", 1))
                .add(task("review", 2))
                .add(task("ship", 1).deactivate());

        assertEquals(List.of("write", "ship"), names(tasks.findBy("priority", 1)));
        assertEquals(List.of("review"), names(tasks.findBy("name", "review")));
        assertEquals(List.of("ship"), names(tasks.findBy("isactive", false)));
        assertEquals(List.of(), tasks.findBy("undeclared", 1));
        assertEquals(List.of("write", "review"), names(tasks.active()));
        assertEquals(List.of("review"), names(tasks.filter(e -> (Integer) e.get("priority") > 1)));

        tasks.clear();
        assertTrue(tasks.isEmpty());
    }

    @Test
    void equals_comparesKindAndItemsInOrder() {
        EntityContainer a = new EntityContainer("a", "Task").add(task("x", 1)).add(task("y", 2));
        EntityContainer b = new EntityContainer("b", "Task").add(task("x", 1)).add(task("y", 2));
        EntityContainer reordered = new EntityContainer("a", "Task").add(task("y", 2)).add(task("x", 1));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, reordered);
    }

    private static List<String> names(List<Entity> entities) {
        List<String> names = new ArrayList<>();
        entities.forEach(e -> names.add(e.getName()));
        return names;
    }
}
