package com.msb.serializer;

import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keys and reference markers of the serialized form.
 * <p>
 * Entity: {@code {"name", "isactive", <declared attributes in order>, "type"}}.
 * Top-level container: {@code {"name", "type": "Container", "elementType", "items": {name → entity form}}};
 * a container held by an attribute is just its {@code items} mapping.
 * <p>
 * A reference marker {@code {"$ref": "#/friend"}} stands for the object emitted at that JSON
 * Pointer within the same document ({@code #} is the document root).
 */
public final class SerializedForm {

    public static final String NAME = Entity.NAME;
    public static final String ACTIVE = Entity.ACTIVE;
    public static final String TYPE = Entity.TYPE;
    public static final String CONTAINER_TYPE = EntityContainer.TYPE;
    public static final String ELEMENT_TYPE = "elementType";
    public static final String ITEMS = "items";
    public static final String REF = "$ref";
    public static final String ROOT = "#";

    private SerializedForm() {
    }

    /** Pointer to a child of {@code parent}; {@code ~} and {@code /} in the segment are escaped. */
    public static String child(String parent, String segment) {
        return parent + "/" + Pointer.escape(segment);
    }

    public static String child(String parent, int index) {
        return parent + "/" + index;
    }

    /** Creates a reference marker to the given pointer. */
    public static Map<String, Object> reference(String pointer) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put(REF, pointer);
        return marker;
    }

    /** True if the value is a map with the single entry {@code "$ref": <string>}. */
    public static boolean isReference(Object value) {
        return value instanceof Map<?, ?> map && map.size() == 1 && map.get(REF) instanceof String;
    }

    /** The pointer of a reference marker. */
    public static String referenceTarget(Object marker) {
        return (String) ((Map<?, ?>) marker).get(REF);
    }
}
