package com.msb.serializer;

import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;
import com.msb.entity.error.DanglingReferenceException;
import com.msb.entity.error.TraversalLimitExceededException;
import com.msb.entity.error.TypeMismatchException;
import com.msb.entity.error.UnknownTypeException;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.AttributeType;
import com.msb.entity.schema.EntitySchema;
import com.msb.entity.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One deserialization pass, in two phases.
 * <p>
 * Phase one walks the form over an explicit work stack, rebuilding every entity and container
 * in schema order and indexing each by the {@link Pointer} of the form it came from. Slots that
 * may hold reference markers (entity and container attributes, entity lists and maps, container
 * items) are recorded as bindings; anywhere else a {@code $ref} map is plain data. Phase two
 * runs the bindings, resolving each marker against the index.
 */
final class GraphReader {

    private static final Logger log = LoggerFactory.getLogger(GraphReader.class);

    private final SchemaRegistry registry;
    private final SerializerOptions options;
    private final Map<Pointer, Object> byPointer = new HashMap<>();
    private final Deque<Runnable> work = new ArrayDeque<>();
    private final List<Runnable> bindings = new ArrayList<>();
    private int nodes;
    private int references;

    GraphReader(SchemaRegistry registry, SerializerOptions options) {
        this.registry = registry;
        this.options = options;
    }

    Entity readEntity(Map<?, ?> form, String expectedKind) {
        checkNotReference(form);
        Entity root = entity(form, expectedKind, Pointer.ROOT);
        finish();
        return root;
    }

    EntityContainer readContainer(Map<?, ?> form) {
        checkNotReference(form);
        Object type = form.get(SerializedForm.TYPE);
        if (!SerializedForm.CONTAINER_TYPE.equals(type)) {
            throw new TypeMismatchException(SerializedForm.TYPE, SerializedForm.CONTAINER_TYPE,
                    String.valueOf(type), SerializedForm.ROOT);
        }
        String name = requireName(form, Pointer.ROOT);
        Object elementType = form.get(SerializedForm.ELEMENT_TYPE);
        if (!(elementType instanceof String kind)) {
            throw new TypeMismatchException(SerializedForm.ELEMENT_TYPE, "STRING",
                    AttributeDef.describe(elementType), SerializedForm.ROOT);
        }
        registry.require(kind, SerializedForm.child(SerializedForm.ROOT, SerializedForm.ELEMENT_TYPE));
        Pointer itemsPointer = Pointer.ROOT.child(SerializedForm.ITEMS);
        Object items = form.get(SerializedForm.ITEMS);
        if (items != null && !(items instanceof Map)) {
            throw new TypeMismatchException(SerializedForm.ITEMS, "Map", AttributeDef.describe(items),
                    itemsPointer.toString());
        }
        EntityContainer container = container(name, kind, Pointer.ROOT);
        items(container, items != null ? (Map<?, ?>) items : Map.of(), itemsPointer);
        finish();
        return container;
    }

    private void finish() {
        while (!work.isEmpty()) {
            work.pop().run();
        }
        for (Runnable binding : bindings) {
            binding.run();
        }
        log.debug("Deserialized {} nodes, resolved {} reference markers", nodes, references);
    }

    private Entity entity(Map<?, ?> form, String expectedKind, Pointer pointer) {
        Object type = form.get(SerializedForm.TYPE);
        if (type != null && !(type instanceof String)) {
            throw new TypeMismatchException(SerializedForm.TYPE, "STRING", AttributeDef.describe(type),
                    pointer.toString());
        }
        String kind = type != null ? (String) type : expectedKind;
        EntitySchema schema = registry.get(kind);
        if (schema == null) {
            throw new UnknownTypeException(kind, pointer.toString());
        }
        if (expectedKind != null && !expectedKind.equals(schema.getKind())) {
            throw new TypeMismatchException(SerializedForm.TYPE, expectedKind, schema.getKind(), pointer.toString());
        }
        String name = requireName(form, pointer);
        countNode(pointer);
        Entity entity = schema.newEntity(name);
        Object active = form.get(SerializedForm.ACTIVE);
        if (active != null) {
            if (!(active instanceof Boolean b)) {
                throw new TypeMismatchException(SerializedForm.ACTIVE, "BOOLEAN", AttributeDef.describe(active),
                        pointer.child(SerializedForm.ACTIVE).toString());
            }
            entity.setActive(b);
        }
        byPointer.put(pointer, entity);
        for (Object key : form.keySet()) {
            if (!isReservedKey(key) && !schema.declares(String.valueOf(key))) {
                log.warn("Ignoring undeclared attribute '{}' of {} at {}", key, schema.getKind(), pointer);
            }
        }
        List<Runnable> children = new ArrayList<>();
        for (AttributeDef def : schema.getAttributes()) {
            if (form.containsKey(def.getName())) {
                attribute(entity, def, form.get(def.getName()), pointer.child(def.getName()), children);
            }
        }
        pushInOrder(children);
        return entity;
    }

    private void attribute(Entity entity, AttributeDef def, Object raw, Pointer pointer, List<Runnable> children) {
        String name = def.getName();
        AttributeType type = def.getType();
        boolean reference = type == AttributeType.ENTITY || type == AttributeType.CONTAINER;
        if (reference && SerializedForm.isReference(raw)) {
            String target = SerializedForm.referenceTarget(raw);
            bindings.add(() -> resolve(target, pointer)
                    .ifPresent(node -> entity.set(name, coerce(def, node, pointer))));
            return;
        }
        if (raw == null) {
            entity.set(name, coerce(def, null, pointer));
            return;
        }
        switch (type) {
            case ENTITY -> {
                Map<?, ?> form = requireMap(def, raw, pointer);
                children.add(() -> entity.set(name, coerce(def, entity(form, def.getKind(), pointer), pointer)));
            }
            case CONTAINER -> {
                Map<?, ?> form = requireMap(def, raw, pointer);
                children.add(() -> {
                    EntityContainer container = container(name, def.getKind(), pointer);
                    entity.set(name, coerce(def, container, pointer));
                    items(container, form, pointer);
                });
            }
            case LIST -> {
                if (def.getKind() == null) {
                    entity.set(name, coerce(def, raw, pointer));
                } else {
                    entityList(entity, def, raw, pointer, children);
                }
            }
            case MAP -> {
                if (def.getKind() == null) {
                    entity.set(name, coerce(def, raw, pointer));
                } else {
                    entityMap(entity, def, raw, pointer, children);
                }
            }
            default -> entity.set(name, coerce(def, raw, pointer));
        }
    }

    private void entityList(Entity entity, AttributeDef def, Object raw, Pointer pointer, List<Runnable> children) {
        if (!(raw instanceof List<?> list)) {
            throw new TypeMismatchException(def.getName(), def.describeType(), AttributeDef.describe(raw),
                    pointer.toString());
        }
        Object[] slots = new Object[list.size()];
        for (int i = 0; i < list.size(); i++) {
            slot(slots, i, list.get(i), def, pointer.child(i), children);
        }
        bindings.add(() -> {
            List<Object> resolved = new ArrayList<>(slots.length);
            for (int i = 0; i < slots.length; i++) {
                resolveSlot(slots[i], pointer.child(i)).ifPresent(resolved::add);
            }
            entity.set(def.getName(), coerce(def, resolved, pointer));
        });
    }

    private void entityMap(Entity entity, AttributeDef def, Object raw, Pointer pointer, List<Runnable> children) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new TypeMismatchException(def.getName(), def.describeType(), AttributeDef.describe(raw),
                    pointer.toString());
        }
        List<String> keys = new ArrayList<>(map.size());
        Object[] slots = new Object[map.size()];
        int i = 0;
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            keys.add(key);
            slot(slots, i++, e.getValue(), def, pointer.child(key), children);
        }
        bindings.add(() -> {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (int j = 0; j < slots.length; j++) {
                String key = keys.get(j);
                resolveSlot(slots[j], pointer.child(key)).ifPresent(v -> resolved.put(key, v));
            }
            entity.set(def.getName(), coerce(def, resolved, pointer));
        });
    }

    /** Fills slots[index] with a rebuilt entity (later, from the work stack) or keeps the marker. */
    private void slot(Object[] slots, int index, Object raw, AttributeDef def, Pointer pointer,
                      List<Runnable> children) {
        if (SerializedForm.isReference(raw)) {
            slots[index] = raw;
            return;
        }
        Map<?, ?> form = requireMap(def, raw, pointer);
        children.add(() -> slots[index] = entity(form, def.getKind(), pointer));
    }

    private EntityContainer container(String name, String kind, Pointer pointer) {
        countNode(pointer);
        EntityContainer container = new EntityContainer(name, kind, options.getDuplicateNamePolicy());
        byPointer.put(pointer, container);
        return container;
    }

    /**
     * Rebuilds container items; they are added in order once every marker can be resolved.
     * An item key must equal its entity's name, surrounding whitespace aside.
     */
    private void items(EntityContainer container, Map<?, ?> items, Pointer itemsPointer) {
        List<String> keys = new ArrayList<>(items.size());
        Object[] slots = new Object[items.size()];
        List<Runnable> children = new ArrayList<>(items.size());
        int i = 0;
        for (Map.Entry<?, ?> e : items.entrySet()) {
            String key = String.valueOf(e.getKey());
            Pointer pointer = itemsPointer.child(key);
            keys.add(key);
            int index = i++;
            Object raw = e.getValue();
            if (SerializedForm.isReference(raw)) {
                slots[index] = raw;
            } else if (raw instanceof Map<?, ?> form) {
                children.add(() -> slots[index] = entity(form, container.getElementKind(), pointer));
            } else {
                throw new TypeMismatchException(key, "ENTITY<" + container.getElementKind() + ">",
                        AttributeDef.describe(raw), pointer.toString());
            }
        }
        pushInOrder(children);
        bindings.add(() -> {
            for (int j = 0; j < slots.length; j++) {
                String key = keys.get(j);
                Pointer pointer = itemsPointer.child(key);
                Optional<Object> item = resolveSlot(slots[j], pointer);
                if (item.isEmpty()) continue;
                if (!(item.get() instanceof Entity e) || !key.trim().equals(e.getName())) {
                    throw new TypeMismatchException(key, "entity named '" + key.trim() + "'",
                            AttributeDef.describe(item.get()), pointer.toString());
                }
                container.add(e);
            }
        });
    }

    private Optional<Object> resolveSlot(Object slot, Pointer pointer) {
        if (SerializedForm.isReference(slot)) {
            return resolve(SerializedForm.referenceTarget(slot), pointer);
        }
        return Optional.ofNullable(slot);
    }

    private Optional<Object> resolve(String target, Pointer pointer) {
        Pointer parsed = Pointer.parse(target);
        Object node = parsed != null ? byPointer.get(parsed) : null;
        if (node == null) {
            if (options.isFailOnDanglingReference()) {
                throw new DanglingReferenceException(target, pointer.toString());
            }
            log.warn("Unresolved reference {} at {}; slot left unset", target, pointer);
            return Optional.empty();
        }
        references++;
        return Optional.of(node);
    }

    private void countNode(Pointer pointer) {
        if (++nodes > options.getMaxNodes()) {
            throw new TraversalLimitExceededException(nodes, options.getMaxNodes(), pointer.toString());
        }
    }

    /** Pushes so that the first task runs first. */
    private void pushInOrder(List<Runnable> tasks) {
        for (int i = tasks.size() - 1; i >= 0; i--) {
            work.push(tasks.get(i));
        }
    }

    /** Coerces against a relative path and reports failures at the full pointer. */
    private static Object coerce(AttributeDef def, Object value, Pointer pointer) {
        try {
            return def.coerce(value, "");
        } catch (TypeMismatchException e) {
            throw new TypeMismatchException(e.getAttribute(), e.getExpectedType(), e.getActualType(),
                    pointer + e.getPath());
        }
    }

    private static String requireName(Map<?, ?> form, Pointer pointer) {
        Object name = form.get(SerializedForm.NAME);
        if (!(name instanceof String s) || s.isBlank()) {
            throw new TypeMismatchException(SerializedForm.NAME, "non-blank STRING", AttributeDef.describe(name),
                    pointer.child(SerializedForm.NAME).toString());
        }
        return s;
    }

    private static Map<?, ?> requireMap(AttributeDef def, Object raw, Pointer pointer) {
        if (raw instanceof Map<?, ?> map) return map;
        throw new TypeMismatchException(def.getName(), def.describeType(), AttributeDef.describe(raw),
                pointer.toString());
    }

    private static void checkNotReference(Map<?, ?> form) {
        if (SerializedForm.isReference(form)) {
            throw new TypeMismatchException(SerializedForm.TYPE, "serialized form", "reference marker",
                    SerializedForm.ROOT);
        }
    }

    private static boolean isReservedKey(Object key) {
        return SerializedForm.NAME.equals(key) || SerializedForm.ACTIVE.equals(key) || SerializedForm.TYPE.equals(key);
    }
}
