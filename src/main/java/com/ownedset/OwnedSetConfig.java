package com.ownedset;

import java.util.Objects;

/**
 * Configuration for an {@link OwnedSet}.
 * Uses builder pattern for flexible configuration.
 */
public class OwnedSetConfig {

    // Default values
    public static final String DEFAULT_NAME = "owned-set";
    public static final int DEFAULT_INITIAL_CAPACITY = 16;
    public static final boolean DEFAULT_LEAK_DETECTION = true;

    private final String name;
    private final int initialCapacity;
    private final boolean leakDetection;

    private OwnedSetConfig(Builder builder) {
        this.name = builder.name;
        this.initialCapacity = builder.initialCapacity;
        this.leakDetection = builder.leakDetection;
    }

    /**
     * Label used in log lines and {@code toString()}.
     */
    public String getName() {
        return name;
    }

    /**
     * Initial capacity of the backing map.
     */
    public int getInitialCapacity() {
        return initialCapacity;
    }

    /**
     * Whether owners that become unreachable without being closed are
     * reclaimed by a cleaner and reported as leaks.
     */
    public boolean isLeakDetection() {
        return leakDetection;
    }

    /**
     * Create a new builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a config with all default values.
     */
    public static OwnedSetConfig defaults() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        return String.format(
            "OwnedSetConfig[name=%s, initialCapacity=%d, leakDetection=%b]",
            name, initialCapacity, leakDetection);
    }

    public static class Builder {
        private String name = DEFAULT_NAME;
        private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
        private boolean leakDetection = DEFAULT_LEAK_DETECTION;

        public Builder name(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        public Builder initialCapacity(int initialCapacity) {
            if (initialCapacity <= 0) {
                throw new IllegalArgumentException("initialCapacity must be positive");
            }
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder leakDetection(boolean leakDetection) {
            this.leakDetection = leakDetection;
            return this;
        }

        public OwnedSetConfig build() {
            return new OwnedSetConfig(this);
        }
    }
}
