package com.msb.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.msb.entity.Entity;
import com.msb.entity.container.EntityContainer;
import com.msb.serializer.EntitySerializer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON text encoding of serialized forms. Key order is preserved both ways; nulls are written.
 */
public final class EntityJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> FORM_TYPE = new TypeReference<>() {};

    private EntityJson() {
    }

    /**
     * Parses a serialized form from a JSON object string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static Map<String, Object> fromJson(String json) {
        try {
            return MAPPER.readValue(json, FORM_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Writes a serialized form as compact JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Map<String, ?> form) {
        try {
            return MAPPER.writeValueAsString(form);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Writes a serialized form as pretty-printed JSON. */
    public static String toJsonPretty(Map<String, ?> form) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(form);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes the entity and writes it as compact JSON. */
    public static String toJson(EntitySerializer serializer, Entity entity) {
        return toJson(serializer.serialize(entity));
    }

    /** Serializes the container and writes it as compact JSON. */
    public static String toJson(EntitySerializer serializer, EntityContainer container) {
        return toJson(serializer.serialize(container));
    }

    /** Parses JSON and rebuilds the entity it describes. */
    public static Entity entityFromJson(EntitySerializer serializer, String json) {
        return serializer.deserialize(fromJson(json));
    }

    /** Parses JSON and rebuilds the container it describes. */
    public static EntityContainer containerFromJson(EntitySerializer serializer, String json) {
        return serializer.deserializeContainer(fromJson(json));
    }
}
