package com.msb.config.load;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.EntitySchema;
import com.msb.entity.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of a schema catalog file: version and kind definitions by kind name.
 * <pre>
 * {"version": "1.0", "kinds": {"Person": {"attributes": [{"name": "age", "type": "INTEGER"}]}}}
 * </pre>
 */
public final class SchemaCatalog {

    private final String version;
    private final Map<String, KindDefinition> kinds;

    @JsonCreator
    public SchemaCatalog(
            @JsonProperty("version") String version,
            @JsonProperty("kinds") Map<String, KindDefinition> kinds) {
        this.version = version;
        this.kinds = kinds != null ? Collections.unmodifiableMap(new LinkedHashMap<>(kinds)) : Map.of();
    }

    /** Catalog describing every schema of the registry, kinds in name order. */
    public static SchemaCatalog of(String version, SchemaRegistry registry) {
        Map<String, KindDefinition> kinds = new LinkedHashMap<>();
        for (String kind : registry.kinds()) {
            kinds.put(kind, KindDefinition.of(registry.get(kind)));
        }
        return new SchemaCatalog(version, kinds);
    }

    public String getVersion() {
        return version;
    }

    /** Kind definitions in file order. */
    public Map<String, KindDefinition> getKinds() {
        return kinds;
    }

    /**
     * Builds a registry holding one schema per kind. Kinds referenced by ENTITY, CONTAINER and
     * entity LIST/MAP attributes must be defined in the same catalog.
     *
     * @throws IllegalArgumentException listing every problem found
     */
    public SchemaRegistry toRegistry() {
        List<String> errors = new ArrayList<>();
        List<EntitySchema> schemas = new ArrayList<>();
        for (Map.Entry<String, KindDefinition> e : kinds.entrySet()) {
            if (e.getValue() == null) {
                errors.add("kind " + e.getKey() + " has no definition");
                continue;
            }
            try {
                schemas.add(e.getValue().toSchema(e.getKey()));
            } catch (IllegalArgumentException ex) {
                errors.add(ex.getMessage());
            }
        }
        for (EntitySchema schema : schemas) {
            for (AttributeDef def : schema.getAttributes()) {
                if (def.getKind() != null && !kinds.containsKey(def.getKind())) {
                    errors.add(schema.getKind() + "." + def.getName() + " refers to undefined kind " + def.getKind());
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid schema catalog (version " + version + "): "
                    + String.join("; ", errors));
        }
        SchemaRegistry registry = new SchemaRegistry();
        schemas.forEach(registry::register);
        return registry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchemaCatalog that = (SchemaCatalog) o;
        return Objects.equals(version, that.version) && kinds.equals(that.kinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, kinds);
    }
}
