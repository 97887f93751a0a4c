package com.msb.config.load;

import com.msb.config.MsbConfig;
import com.msb.entity.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads the schema catalog in order: {@code <schemaDir>/<schemaFile>} → classpath resource
 * {@code /msb/<schemaFile>}. A source that cannot be read or parsed is logged and skipped.
 */
public final class SchemaCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalogLoader.class);

    private static final String CLASSPATH_DIR = "/msb/";

    private final Path schemaDir;
    private final String schemaFile;

    /**
     * @param schemaDir  directory for the catalog file; null skips the file source
     * @param schemaFile catalog file name, also used for the classpath lookup
     */
    public SchemaCatalogLoader(Path schemaDir, String schemaFile) {
        this.schemaDir = schemaDir;
        this.schemaFile = Objects.requireNonNull(schemaFile, "schemaFile");
    }

    public SchemaCatalogLoader(MsbConfig config) {
        this(Path.of(config.getSchemaDir()), config.getSchemaFile());
    }

    /**
     * @return the first catalog found (never null)
     * @throws IllegalStateException if no source holds a readable catalog
     */
    public SchemaCatalog load() {
        return tryLoad().orElseThrow(() -> new IllegalStateException(
                "No schema catalog found: " + describeFile() + ", classpath:" + CLASSPATH_DIR + schemaFile));
    }

    /**
     * Loads the catalog and builds its registry.
     *
     * @throws IllegalArgumentException if the catalog defines invalid schemas
     */
    public SchemaRegistry loadRegistry() {
        SchemaCatalog catalog = load();
        SchemaRegistry registry = catalog.toRegistry();
        log.info("Schema registry built with {} kinds: {}", registry.kinds().size(), registry.kinds());
        return registry;
    }

    /** One attempt over both sources; empty if none is readable. */
    public Optional<SchemaCatalog> tryLoad() {
        Optional<SchemaCatalog> catalog = readFile().flatMap(json -> parse(json, describeFile()));
        if (catalog.isPresent()) {
            log.info("Schema catalog version={} loaded from file: {}", catalog.get().getVersion(), describeFile());
            return catalog;
        }
        String resource = CLASSPATH_DIR + schemaFile;
        catalog = readResource(resource).flatMap(json -> parse(json, "classpath:" + resource));
        if (catalog.isPresent()) {
            log.info("Schema catalog version={} loaded from classpath: {}", catalog.get().getVersion(), resource);
        }
        return catalog;
    }

    private Optional<SchemaCatalog> parse(String json, String source) {
        try {
            return Optional.of(SchemaCatalogs.fromJson(json));
        } catch (Exception e) {
            log.warn("Failed to parse schema catalog from {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readFile() {
        if (schemaDir == null) {
            return Optional.empty();
        }
        Path file = schemaDir.resolve(schemaFile);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read schema catalog file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readResource(String resource) {
        try (InputStream in = SchemaCatalogLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read schema catalog resource {}: {}", resource, e.getMessage());
            return Optional.empty();
        }
    }

    private String describeFile() {
        return schemaDir != null ? schemaDir.resolve(schemaFile).toString() : "(no schema dir)";
    }
}
