package com.msb.serializer;

import com.msb.entity.container.DuplicateNamePolicy;

import java.util.Objects;

/**
 * Serializer behavior: cycle and shared-reference handling, traversal bound, dangling
 * reference handling, and the duplicate-name policy of containers rebuilt on deserialization.
 */
public final class SerializerOptions {

    /** Default bound on entities and containers visited by one call. */
    public static final int DEFAULT_MAX_NODES = 100_000;

    private static final SerializerOptions DEFAULTS = builder().build();

    private final CyclePolicy cyclePolicy;
    private final SharedReferencePolicy sharedReferencePolicy;
    private final int maxNodes;
    private final boolean failOnDanglingReference;
    private final DuplicateNamePolicy duplicateNamePolicy;

    private SerializerOptions(Builder b) {
        this.cyclePolicy = b.cyclePolicy;
        this.sharedReferencePolicy = b.sharedReferencePolicy;
        this.maxNodes = b.maxNodes;
        this.failOnDanglingReference = b.failOnDanglingReference;
        this.duplicateNamePolicy = b.duplicateNamePolicy;
    }

    /** BREAK cycles, COPY shared subgraphs, {@value #DEFAULT_MAX_NODES} nodes, fail on dangling references, REJECT duplicates. */
    public static SerializerOptions defaults() {
        return DEFAULTS;
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

    public int getMaxNodes() {
        return maxNodes;
    }

    /** When false, unresolved reference markers are logged and their slot is left unset. */
    public boolean isFailOnDanglingReference() {
        return failOnDanglingReference;
    }

    public DuplicateNamePolicy getDuplicateNamePolicy() {
        return duplicateNamePolicy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SerializerOptions that = (SerializerOptions) o;
        return maxNodes == that.maxNodes && failOnDanglingReference == that.failOnDanglingReference
                && cyclePolicy == that.cyclePolicy && sharedReferencePolicy == that.sharedReferencePolicy
                && duplicateNamePolicy == that.duplicateNamePolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cyclePolicy, sharedReferencePolicy, maxNodes, failOnDanglingReference, duplicateNamePolicy);
    }

    @Override
    public String toString() {
        return "SerializerOptions{cyclePolicy=" + cyclePolicy + ", sharedReferencePolicy=" + sharedReferencePolicy
                + ", maxNodes=" + maxNodes + ", failOnDanglingReference=" + failOnDanglingReference
                + ", duplicateNamePolicy=" + duplicateNamePolicy + "}";
    }

    public static final class Builder {
        private CyclePolicy cyclePolicy = CyclePolicy.BREAK;
        private SharedReferencePolicy sharedReferencePolicy = SharedReferencePolicy.COPY;
        private int maxNodes = DEFAULT_MAX_NODES;
        private boolean failOnDanglingReference = true;
        private DuplicateNamePolicy duplicateNamePolicy = DuplicateNamePolicy.REJECT;

        public Builder cyclePolicy(CyclePolicy cyclePolicy) {
            this.cyclePolicy = Objects.requireNonNull(cyclePolicy, "cyclePolicy");
            return this;
        }

        public Builder sharedReferencePolicy(SharedReferencePolicy sharedReferencePolicy) {
            this.sharedReferencePolicy = Objects.requireNonNull(sharedReferencePolicy, "sharedReferencePolicy");
            return this;
        }

        /** Must be positive. */
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

        public SerializerOptions build() {
            return new SerializerOptions(this);
        }
    }
}
