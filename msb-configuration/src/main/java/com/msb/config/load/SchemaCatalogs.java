package com.msb.config.load;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON reading and writing of schema catalogs.
 */
public final class SchemaCatalogs {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private SchemaCatalogs() {
    }

    /**
     * @throws UncheckedIOException on parse failure
     */
    public static SchemaCatalog fromJson(String json) {
        try {
            return MAPPER.readValue(json, SchemaCatalog.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(SchemaCatalog catalog) {
        try {
            return MAPPER.writeValueAsString(catalog);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
