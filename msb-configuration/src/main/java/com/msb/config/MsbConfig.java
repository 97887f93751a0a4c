package com.msb.config;

import com.msb.entity.container.DuplicateNamePolicy;
import com.msb.serializer.CyclePolicy;
import com.msb.serializer.SerializerOptions;
import com.msb.serializer.SharedReferencePolicy;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables.
 * <p>
 * Serializer: MSB_CYCLE_POLICY, MSB_SHARED_REFERENCE_POLICY, MSB_MAX_NODES,
 * MSB_FAIL_ON_DANGLING_REFERENCE, MSB_DUPLICATE_NAME_POLICY.
 * Schema catalog: MSB_SCHEMA_DIR, MSB_SCHEMA_FILE.
 * <p>
 * Missing or malformed values fall back to the defaults.
 */
public final class MsbConfig {

    static final String ENV_CYCLE_POLICY = "MSB_CYCLE_POLICY";
    static final String ENV_SHARED_REFERENCE_POLICY = "MSB_SHARED_REFERENCE_POLICY";
    static final String ENV_MAX_NODES = "MSB_MAX_NODES";
    static final String ENV_FAIL_ON_DANGLING_REFERENCE = "MSB_FAIL_ON_DANGLING_REFERENCE";
    static final String ENV_DUPLICATE_NAME_POLICY = "MSB_DUPLICATE_NAME_POLICY";
    static final String ENV_SCHEMA_DIR = "MSB_SCHEMA_DIR";
    static final String ENV_SCHEMA_FILE = "MSB_SCHEMA_FILE";

    private static final String DEFAULT_SCHEMA_DIR = "config";
    private static final String DEFAULT_SCHEMA_FILE = "schemas.json";

    private final CyclePolicy cyclePolicy;
    private final SharedReferencePolicy sharedReferencePolicy;
    private final int maxNodes;
    private final boolean failOnDanglingReference;
    private final DuplicateNamePolicy duplicateNamePolicy;
    private final String schemaDir;
    private final String schemaFile;

    private MsbConfig(Builder b) {
        this.cyclePolicy = b.cyclePolicy;
        this.sharedReferencePolicy = b.sharedReferencePolicy;
        this.maxNodes = b.maxNodes;
        this.failOnDanglingReference = b.failOnDanglingReference;
        this.duplicateNamePolicy = b.duplicateNamePolicy;
        this.schemaDir = b.schemaDir;
        this.schemaFile = b.schemaFile;
    }

    public static MsbConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads the variables through {@code env}; tests pass a map lookup here. */
    static MsbConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .cyclePolicy(CyclePolicy.fromValue(env.apply(ENV_CYCLE_POLICY), CyclePolicy.BREAK))
                .sharedReferencePolicy(SharedReferencePolicy.fromValue(
                        env.apply(ENV_SHARED_REFERENCE_POLICY), SharedReferencePolicy.COPY))
                .maxNodes(parsePositiveInt(env.apply(ENV_MAX_NODES), SerializerOptions.DEFAULT_MAX_NODES))
                .failOnDanglingReference(parseBoolean(env.apply(ENV_FAIL_ON_DANGLING_REFERENCE), true))
                .duplicateNamePolicy(DuplicateNamePolicy.fromValue(
                        env.apply(ENV_DUPLICATE_NAME_POLICY), DuplicateNamePolicy.REJECT))
                .schemaDir(getEnv(env, ENV_SCHEMA_DIR, DEFAULT_SCHEMA_DIR))
                .schemaFile(getEnv(env, ENV_SCHEMA_FILE, DEFAULT_SCHEMA_FILE))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public CyclePolicy getCyclePolicy() {
        return cyclePolicy;
    }

    public SharedReferencePolicy getSharedReferencePolicy() {
        return sharedReferencePolicy;
    }

    /** Bound on entities and containers visited per serializer call. Default {@value SerializerOptions#DEFAULT_MAX_NODES}. */
    public int getMaxNodes() {
        return maxNodes;
    }

    public boolean isFailOnDanglingReference() {
        return failOnDanglingReference;
    }

    public DuplicateNamePolicy getDuplicateNamePolicy() {
        return duplicateNamePolicy;
    }

    /** Directory holding the schema catalog file. Default {@code config}. */
    public String getSchemaDir() {
        return schemaDir;
    }

    /** Schema catalog file name. Default {@code schemas.json}. */
    public String getSchemaFile() {
        return schemaFile;
    }

    public Path getSchemaPath() {
        return Path.of(schemaDir).resolve(schemaFile);
    }

    /** Serializer options carrying this configuration's policies and bound. */
    public SerializerOptions serializerOptions() {
        return SerializerOptions.builder()
                .cyclePolicy(cyclePolicy)
                .sharedReferencePolicy(sharedReferencePolicy)
                .maxNodes(maxNodes)
                .failOnDanglingReference(failOnDanglingReference)
                .duplicateNamePolicy(duplicateNamePolicy)
                .build();
    }

    @Override
    public String toString() {
        return "MsbConfig{cyclePolicy=" + cyclePolicy + ", sharedReferencePolicy=" + sharedReferencePolicy
                + ", maxNodes=" + maxNodes + ", failOnDanglingReference=" + failOnDanglingReference
                + ", duplicateNamePolicy=" + duplicateNamePolicy + ", schema=" + getSchemaPath() + "}";
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private CyclePolicy cyclePolicy = CyclePolicy.BREAK;
        private SharedReferencePolicy sharedReferencePolicy = SharedReferencePolicy.COPY;
        private int maxNodes = SerializerOptions.DEFAULT_MAX_NODES;
        private boolean failOnDanglingReference = true;
        private DuplicateNamePolicy duplicateNamePolicy = DuplicateNamePolicy.REJECT;
        private String schemaDir = DEFAULT_SCHEMA_DIR;
        private String schemaFile = DEFAULT_SCHEMA_FILE;

        public Builder cyclePolicy(CyclePolicy cyclePolicy) {
            this.cyclePolicy = Objects.requireNonNull(cyclePolicy, "cyclePolicy");
            return this;
        }

        public Builder sharedReferencePolicy(SharedReferencePolicy sharedReferencePolicy) {
            this.sharedReferencePolicy = Objects.requireNonNull(sharedReferencePolicy, "sharedReferencePolicy");
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            if (maxNodes <= 0) {
                throw new IllegalArgumentException("maxNodes must be positive, got " + maxNodes);
            }
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder failOnDanglingReference(boolean failOnDanglingReference) {
            this.failOnDanglingReference = failOnDanglingReference;
            return this;
        }

        public Builder duplicateNamePolicy(DuplicateNamePolicy duplicateNamePolicy) {
            this.duplicateNamePolicy = Objects.requireNonNull(duplicateNamePolicy, "duplicateNamePolicy");
            return this;
        }

        public Builder schemaDir(String schemaDir) {
            this.schemaDir = schemaDir != null ? schemaDir : DEFAULT_SCHEMA_DIR;
            return this;
        }

        public Builder schemaFile(String schemaFile) {
            this.schemaFile = schemaFile != null ? schemaFile : DEFAULT_SCHEMA_FILE;
            return this;
        }

        public MsbConfig build() {
            return new MsbConfig(this);
        }
    }
}
