package com.msb.entity;

import com.msb.entity.container.EntityContainer;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural comparison of entity graphs. Two graphs are equal when corresponding entities
 * have the same kind, name, active flag and attribute values, comparing referenced entities
 * and containers the same way. Uses an explicit work list, and a pair already under
 * comparison is assumed equal, so cyclic graphs terminate.
 * <p>
 * Containers compare element kind and items in order; the container name is a label and is
 * not compared.
 */
public final class StructuralEquality {

    private StructuralEquality() {
    }

    public static boolean equal(Object a, Object b) {
        Deque<Object[]> pending = new ArrayDeque<>();
        Map<Object, Set<Object>> assumed = new IdentityHashMap<>();
        pending.push(new Object[] {a, b});
        while (!pending.isEmpty()) {
            Object[] pair = pending.pop();
            Object x = pair[0];
            Object y = pair[1];
            if (x == y) continue;
            if (x == null || y == null) return false;
            if (x instanceof Entity ex) {
                if (!(y instanceof Entity ey)) return false;
                if (!assume(assumed, ex, ey)) continue;
                if (!ex.getType().equals(ey.getType()) || !ex.getName().equals(ey.getName())
                        || ex.isActive() != ey.isActive()) {
                    return false;
                }
                List<String> names = List.copyOf(ex.getSchema().getAttributeNames());
                if (!names.equals(List.copyOf(ey.getSchema().getAttributeNames()))) return false;
                for (String attribute : names) {
                    pending.push(new Object[] {ex.get(attribute), ey.get(attribute)});
                }
            } else if (x instanceof EntityContainer cx) {
                if (!(y instanceof EntityContainer cy)) return false;
                if (!assume(assumed, cx, cy)) continue;
                if (!cx.getElementKind().equals(cy.getElementKind()) || !cx.names().equals(cy.names())) return false;
                for (String name : cx.names()) {
                    pending.push(new Object[] {cx.get(name), cy.get(name)});
                }
            } else if (x instanceof List<?> lx) {
                if (!(y instanceof List<?> ly) || lx.size() != ly.size()) return false;
                Iterator<?> ix = lx.iterator();
                Iterator<?> iy = ly.iterator();
                while (ix.hasNext()) {
                    pending.push(new Object[] {ix.next(), iy.next()});
                }
            } else if (x instanceof Map<?, ?> mx) {
                if (!(y instanceof Map<?, ?> my) || !mx.keySet().equals(my.keySet())) return false;
                for (Map.Entry<?, ?> e : mx.entrySet()) {
                    pending.push(new Object[] {e.getValue(), my.get(e.getKey())});
                }
            } else if (!Objects.equals(x, y)) {
                return false;
            }
        }
        return true;
    }

    /** Records the pair; returns false if it was already recorded. */
    private static boolean assume(Map<Object, Set<Object>> assumed, Object x, Object y) {
        return assumed.computeIfAbsent(x, k -> Collections.newSetFromMap(new IdentityHashMap<>())).add(y);
    }
}
