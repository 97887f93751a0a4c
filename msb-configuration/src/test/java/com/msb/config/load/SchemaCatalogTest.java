package com.msb.config.load;

import com.msb.entity.Entity;
import com.msb.entity.schema.AttributeDef;
import com.msb.entity.schema.AttributeType;
import com.msb.entity.schema.EntitySchema;
import com.msb.entity.schema.SchemaRegistry;
import com.msb.serializer.EntitySerializer;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaCatalogTest {

    private static final String CATALOG_JSON = """
            {
              "version": "1.0",
              "kinds": {
                "Pet": {"attributes": [{"name": "species", "type": "STRING", "default": "cat"}]},
                "Person": {"attributes": [
                  {"name": "age", "type": "INTEGER", "nullable": true},
                  {"name": "pets", "type": "LIST", "kind": "Pet", "default": []},
                  {"name": "friend", "type": "ENTITY", "kind": "Person", "nullable": true},
                  {"name": "mood", "type": "WHATEVER"}
                ]}
              }
            }
            """;

    @Test
    void fromJson_keepsKindAndAttributeOrder() {
        SchemaCatalog catalog = SchemaCatalogs.fromJson(CATALOG_JSON);

        assertEquals("1.0", catalog.getVersion());
        assertEquals(List.of("Pet", "Person"), List.copyOf(catalog.getKinds().keySet()));
        List<AttributeDef> person = catalog.getKinds().get("Person").getAttributes();
        assertEquals(List.of("age", "pets", "friend", "mood"), person.stream().map(AttributeDef::getName).toList());
        assertEquals(AttributeType.UNKNOWN, person.get(3).getType());
    }

    @Test
    void toRegistry_reportsInvalidDeclarations() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchemaCatalogs.fromJson(CATALOG_JSON).toRegistry());

        assertTrue(e.getMessage().contains("'mood' has an unknown type"), e.getMessage());
    }

    @Test
    void toRegistry_rejectsReferencesToUndefinedKinds() {
        String json = CATALOG_JSON.replace("\"kind\": \"Pet\"", "\"kind\": \"Fish\"").replace("WHATEVER", "STRING");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchemaCatalogs.fromJson(json).toRegistry());

        assertTrue(e.getMessage().contains("Person.pets refers to undefined kind Fish"), e.getMessage());
    }

    @Test
    void toRegistry_buildsUsableSchemas() {
        SchemaCatalog catalog = SchemaCatalogs.fromJson(CATALOG_JSON.replace("WHATEVER", "STRING"));

        SchemaRegistry registry = catalog.toRegistry();

        assertEquals(Set.of("Pet", "Person"), registry.kinds());
        Entity rex = registry.newEntity("Pet", "rex");
        assertEquals("cat", rex.get("species"));
        Entity alice = registry.newEntity("Person", "alice").set("pets", List.of(rex));
        EntitySerializer serializer = new EntitySerializer(registry);
        assertEquals(alice, serializer.deserialize(serializer.serialize(alice)));
    }

    @Test
    void of_describesRegistryAndReadsBack() {
        SchemaRegistry registry = new SchemaRegistry()
                .register(EntitySchema.builder("City")
                        .attribute("population", AttributeType.LONG)
                        .attribute(AttributeDef.entity("twin", "City"))
                        .build());

        String json = SchemaCatalogs.toJson(SchemaCatalog.of("2.0", registry));
        SchemaCatalog reread = SchemaCatalogs.fromJson(json);

        assertEquals(SchemaCatalog.of("2.0", registry), reread);
        assertEquals(registry.kinds(), reread.toRegistry().kinds());
    }

    @Test
    void fromJson_malformedIsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> SchemaCatalogs.fromJson("{\"kinds\": ["));
    }
}
