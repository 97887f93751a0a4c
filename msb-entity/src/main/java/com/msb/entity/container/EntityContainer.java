package com.msb.entity.container;

import com.msb.entity.Entity;
import com.msb.entity.StructuralEquality;
import com.msb.entity.error.DuplicateNameException;
import com.msb.entity.error.TypeMismatchException;
import com.msb.entity.validation.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Insertion-ordered collection of uniquely named entities of one kind. The container owns
 * its entities: removing an entity, or discarding the container, ends that ownership.
 * <p>
 * Not thread-safe.
 */
public final class EntityContainer implements Iterable<Entity> {

    private static final Logger log = LoggerFactory.getLogger(EntityContainer.class);

    /** Type discriminator of a serialized container; no entity kind may use it. */
    public static final String TYPE = "Container";

    private final String name;
    private final String elementKind;
    private final DuplicateNamePolicy duplicateNamePolicy;
    private final Map<String, Entity> items = new LinkedHashMap<>();

    /** Creates a container that rejects duplicate names. */
    public EntityContainer(String name, String elementKind) {
        this(name, elementKind, DuplicateNamePolicy.REJECT);
    }

    /**
     * @param name                container label (non-blank)
     * @param elementKind         kind every held entity must have
     * @param duplicateNamePolicy what {@link #add} does on a name collision
     */
    public EntityContainer(String name, String elementKind, DuplicateNamePolicy duplicateNamePolicy) {
        this.name = Validation.checkNonEmptyString(name, "container name");
        this.elementKind = Validation.checkNonEmptyString(elementKind, "element kind");
        this.duplicateNamePolicy = Objects.requireNonNull(duplicateNamePolicy, "duplicateNamePolicy");
    }

    public String getName() {
        return name;
    }

    public String getElementKind() {
        return elementKind;
    }

    public DuplicateNamePolicy getDuplicateNamePolicy() {
        return duplicateNamePolicy;
    }

    /**
     * Adds an entity under its name.
     *
     * @throws TypeMismatchException  if the entity is not of the element kind
     * @throws DuplicateNameException if the name is held and the policy is {@link DuplicateNamePolicy#REJECT}
     */
    public EntityContainer add(Entity entity) {
        checkAddable(entity, Set.of());
        Entity previous = items.put(entity.getName(), entity);
        if (previous != null && previous != entity) {
            log.debug("Container '{}' replaced entity '{}'", name, entity.getName());
        }
        return this;
    }

    /**
     * Adds several entities. All are checked before any is added, so on failure the container
     * is unchanged.
     */
    public EntityContainer addAll(Collection<Entity> entities) {
        Objects.requireNonNull(entities, "entities");
        Set<String> batch = new HashSet<>();
        for (Entity e : entities) {
            checkAddable(e, batch);
            batch.add(e.getName());
        }
        for (Entity e : entities) {
            items.put(e.getName(), e);
        }
        return this;
    }

    private void checkAddable(Entity entity, Set<String> pendingNames) {
        Objects.requireNonNull(entity, "entity");
        if (!elementKind.equals(entity.getType())) {
            throw new TypeMismatchException(entity.getName(), elementKind, entity.getType(), name);
        }
        boolean taken = items.containsKey(entity.getName()) || pendingNames.contains(entity.getName());
        if (taken && duplicateNamePolicy == DuplicateNamePolicy.REJECT) {
            throw new DuplicateNameException(name, entity.getName(), name);
        }
    }

    /** Returns the entity with the name, or null. */
    public Entity get(String entityName) {
        return entityName != null ? items.get(entityName) : null;
    }

    /**
     * Returns the entity with the name.
     *
     * @throws NoSuchElementException if absent
     */
    public Entity require(String entityName) {
        Entity e = get(entityName);
        if (e == null) {
            throw new NoSuchElementException("Container '" + name + "' holds no entity named '" + entityName + "'");
        }
        return e;
    }

    /** Removes and returns the entity with the name, or null if absent. */
    public Entity remove(String entityName) {
        return entityName != null ? items.remove(entityName) : null;
    }

    public boolean contains(String entityName) {
        return entityName != null && items.containsKey(entityName);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /** Entity names in insertion order (snapshot). */
    public List<String> names() {
        return List.copyOf(items.keySet());
    }

    /** Entities in insertion order (snapshot). */
    public List<Entity> entities() {
        return List.copyOf(items.values());
    }

    @Override
    public Iterator<Entity> iterator() {
        return Collections.unmodifiableCollection(items.values()).iterator();
    }

    /** Entities matching the predicate, in insertion order. */
    public List<Entity> filter(Predicate<Entity> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        List<Entity> result = new ArrayList<>();
        for (Entity e : items.values()) {
            if (predicate.test(e)) result.add(e);
        }
        return result;
    }

    /**
     * Entities whose attribute equals the value. Also matches on {@value Entity#NAME} and
     * {@value Entity#ACTIVE}; entities that do not declare the attribute never match.
     */
    public List<Entity> findBy(String attribute, Object value) {
        Objects.requireNonNull(attribute, "attribute");
        return filter(e -> {
            if (Entity.NAME.equals(attribute)) return e.getName().equals(value);
            if (Entity.ACTIVE.equals(attribute)) return Boolean.valueOf(e.isActive()).equals(value);
            return e.getSchema().declares(attribute) && Objects.equals(e.get(attribute), value);
        });
    }

    /** Active entities in insertion order. */
    public List<Entity> active() {
        return filter(Entity::isActive);
    }

    public void clear() {
        items.clear();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityContainer)) return false;
        return StructuralEquality.equal(this, o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementKind, names());
    }

    @Override
    public String toString() {
        return "Container[" + name + "]<" + elementKind + ">" + items.keySet();
    }
}
