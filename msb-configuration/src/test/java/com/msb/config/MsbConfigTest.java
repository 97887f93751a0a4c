package com.msb.config;

import com.msb.entity.container.DuplicateNamePolicy;
import com.msb.serializer.CyclePolicy;
import com.msb.serializer.SerializerOptions;
import com.msb.serializer.SharedReferencePolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MsbConfigTest {

    @Test
    void fromEnvironment_usesDefaultsWhenUnset() {
        MsbConfig config = MsbConfig.fromEnvironment(Map.<String, String>of()::get);

        assertEquals(CyclePolicy.BREAK, config.getCyclePolicy());
        assertEquals(SharedReferencePolicy.COPY, config.getSharedReferencePolicy());
        assertEquals(100_000, config.getMaxNodes());
        assertEquals(DuplicateNamePolicy.REJECT, config.getDuplicateNamePolicy());
        assertEquals(Path.of("config", "schemas.json"), config.getSchemaPath());
        assertEquals(SerializerOptions.defaults(), config.serializerOptions());
    }

    @Test
    void fromEnvironment_readsEveryVariable() {
        Map<String, String> env = Map.of(
                "MSB_CYCLE_POLICY", "fail",
                "MSB_SHARED_REFERENCE_POLICY", " REFERENCE ",
                "MSB_MAX_NODES", "250",
                "MSB_FAIL_ON_DANGLING_REFERENCE", "false",
                "MSB_DUPLICATE_NAME_POLICY", "overwrite",
                "MSB_SCHEMA_DIR", "/etc/msb",
                "MSB_SCHEMA_FILE", "kinds.json");

        MsbConfig config = MsbConfig.fromEnvironment(env::get);

        SerializerOptions options = config.serializerOptions();
        assertEquals(CyclePolicy.FAIL, options.getCyclePolicy());
        assertEquals(SharedReferencePolicy.REFERENCE, options.getSharedReferencePolicy());
        assertEquals(250, options.getMaxNodes());
        assertFalse(options.isFailOnDanglingReference());
        assertEquals(DuplicateNamePolicy.OVERWRITE, options.getDuplicateNamePolicy());
        assertEquals(Path.of("/etc/msb", "kinds.json"), config.getSchemaPath());
    }

    @Test
    void fromEnvironment_malformedValuesFallBackToDefaults() {
        Map<String, String> env = Map.of(
                "MSB_CYCLE_POLICY", "sometimes",
                "MSB_MAX_NODES", "-3",
                "MSB_FAIL_ON_DANGLING_REFERENCE", "maybe",
                "MSB_DUPLICATE_NAME_POLICY", "",
                "MSB_SCHEMA_FILE", "   ");

        MsbConfig config = MsbConfig.fromEnvironment(env::get);

        assertEquals(CyclePolicy.BREAK, config.getCyclePolicy());
        assertEquals(SerializerOptions.DEFAULT_MAX_NODES, config.getMaxNodes());
        assertEquals(true, config.isFailOnDanglingReference());
        assertEquals(DuplicateNamePolicy.REJECT, config.getDuplicateNamePolicy());
        assertEquals("schemas.json", config.getSchemaFile());

        assertEquals(SerializerOptions.DEFAULT_MAX_NODES,
                MsbConfig.fromEnvironment(Map.of("MSB_MAX_NODES", "lots")::get).getMaxNodes());
    }

    @Test
    void builder_rejectsNonPositiveMaxNodes() {
        assertThrows(IllegalArgumentException.class, () -> MsbConfig.builder().maxNodes(0));
    }
}
