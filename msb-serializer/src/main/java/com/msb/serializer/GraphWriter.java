package com.msb.serializer;

import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;
import com.msb.entity.error.CyclicReferenceException;
import com.msb.entity.error.TraversalLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One serialization pass. Depth-first over an explicit work stack; children are visited in
 * declaration order, so the output is in document order.
 * <p>
 * Two identity maps, for two separate concerns: {@code onPath} holds the entities and
 * containers currently open on the traversal path (a hit is a cycle); {@code completed}
 * holds those already emitted in full (a hit is a shared subgraph) and is kept only under
 * {@link SharedReferencePolicy#REFERENCE}. Both map an object to the {@link Pointer} of its emission.
 * Pointer text is built only for markers and errors.
 */
final class GraphWriter {

    private static final Logger log = LoggerFactory.getLogger(GraphWriter.class);

    private final SerializerOptions options;
    private final Map<Object, Pointer> onPath = new IdentityHashMap<>();
    private final Map<Object, Pointer> completed = new IdentityHashMap<>();
    private final boolean shareReferences;
    private final Deque<Runnable> work = new ArrayDeque<>();
    private int nodes;
    private int references;

    GraphWriter(SerializerOptions options) {
        this.options = options;
        this.shareReferences = options.getSharedReferencePolicy() == SharedReferencePolicy.REFERENCE;
    }

    /** Serializes an entity or container; the result holds no live object references. */
    @SuppressWarnings("unchecked")
    Map<String, Object> write(Object root) {
        AtomicReference<Object> result = new AtomicReference<>();
        work.push(() -> visit(root, Pointer.ROOT, true, result::set));
        while (!work.isEmpty()) {
            work.pop().run();
        }
        log.debug("Serialized {} nodes with {} reference markers", nodes, references);
        return (Map<String, Object>) result.get();
    }

    private void visit(Object value, Pointer pointer, boolean topLevel, Consumer<Object> sink) {
        if (value instanceof Entity || value instanceof EntityContainer) {
            visitNode(value, pointer, topLevel, sink);
        } else if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(Collections.nCopies(list.size(), null));
            sink.accept(out);
            List<Runnable> children = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                int index = i;
                Object element = list.get(i);
                children.add(() -> visit(element, pointer.child(index), false, v -> out.set(index, v)));
            }
            pushInOrder(children);
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            sink.accept(out);
            List<Runnable> children = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> e : map.entrySet()) {
                String key = (String) e.getKey();
                Object element = e.getValue();
                out.put(key, null);
                children.add(() -> visit(element, pointer.child(key), false, v -> out.put(key, v)));
            }
            pushInOrder(children);
        } else {
            sink.accept(value);
        }
    }

    private void visitNode(Object node, Pointer pointer, boolean topLevel, Consumer<Object> sink) {
        Pointer open = onPath.get(node);
        if (open != null) {
            if (options.getCyclePolicy() == CyclePolicy.FAIL) {
                throw new CyclicReferenceException(open.toString(), pointer.toString());
            }
            emitReference(open, sink);
            return;
        }
        if (shareReferences) {
            Pointer done = completed.get(node);
            if (done != null) {
                emitReference(done, sink);
                return;
            }
        }
        if (++nodes > options.getMaxNodes()) {
            throw new TraversalLimitExceededException(nodes, options.getMaxNodes(), pointer.toString());
        }
        onPath.put(node, pointer);
        // runs after every child pushed below
        work.push(() -> {
            onPath.remove(node);
            if (shareReferences) {
                completed.putIfAbsent(node, pointer);
            }
        });
        if (node instanceof Entity entity) {
            writeEntity(entity, pointer, sink);
        } else {
            writeContainer((EntityContainer) node, pointer, topLevel, sink);
        }
    }

    private void writeEntity(Entity entity, Pointer pointer, Consumer<Object> sink) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(SerializedForm.NAME, entity.getName());
        out.put(SerializedForm.ACTIVE, entity.isActive());
        List<Runnable> children = new ArrayList<>();
        for (Map.Entry<String, Object> e : entity.attributes().entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (isScalar(value)) {
                out.put(key, value);
            } else {
                out.put(key, null);
                children.add(() -> visit(value, pointer.child(key), false, v -> out.put(key, v)));
            }
        }
        out.put(SerializedForm.TYPE, entity.getType());
        sink.accept(out);
        pushInOrder(children);
    }

    private void writeContainer(EntityContainer container, Pointer pointer, boolean topLevel, Consumer<Object> sink) {
        Pointer itemsPointer = topLevel ? pointer.child(SerializedForm.ITEMS) : pointer;
        Map<String, Object> items = new LinkedHashMap<>();
        List<Runnable> children = new ArrayList<>(container.size());
        for (Entity entity : container) {
            String key = entity.getName();
            items.put(key, null);
            children.add(() -> visit(entity, itemsPointer.child(key), false, v -> items.put(key, v)));
        }
        if (topLevel) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(SerializedForm.NAME, container.getName());
            out.put(SerializedForm.TYPE, SerializedForm.CONTAINER_TYPE);
            out.put(SerializedForm.ELEMENT_TYPE, container.getElementKind());
            out.put(SerializedForm.ITEMS, items);
            sink.accept(out);
        } else {
            sink.accept(items);
        }
        pushInOrder(children);
    }

    private void emitReference(Pointer target, Consumer<Object> sink) {
        references++;
        sink.accept(SerializedForm.reference(target.toString()));
    }

    /** Pushes so that the first task runs first. */
    private void pushInOrder(List<Runnable> tasks) {
        for (int i = tasks.size() - 1; i >= 0; i--) {
            work.push(tasks.get(i));
        }
    }

    private static boolean isScalar(Object value) {
        return !(value instanceof Entity || value instanceof EntityContainer
                || value instanceof List || value instanceof Map);
    }
}
