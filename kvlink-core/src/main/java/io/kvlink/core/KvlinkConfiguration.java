package io.kvlink.core;

import io.kvlink.field.CompressionMode;

import java.util.Objects;

/**
 * Immutable configuration for a {@link KvlinkArena}.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * KvlinkConfiguration config = KvlinkConfiguration.builder()
 *     .cascadeFetchByDefault(true)
 *     .keyPrefix("shop:")
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see KvlinkArena
 */
public final class KvlinkConfiguration {

    // Cascade defaults used by the no-argument record operations
    private final boolean cascadeSaveByDefault;
    private final boolean cascadeFetchByDefault;
    private final boolean reloadCascadeByDefault;

    // Field defaults used by the annotation-driven schema extractor
    private final CompressionMode defaultCompressionMode;
    private final int defaultFixedPointPlaces;

    private final String keyPrefix;

    private KvlinkConfiguration(Builder builder) {
        this.cascadeSaveByDefault = builder.cascadeSaveByDefault;
        this.cascadeFetchByDefault = builder.cascadeFetchByDefault;
        this.reloadCascadeByDefault = builder.reloadCascadeByDefault;
        this.defaultCompressionMode = builder.defaultCompressionMode;
        this.defaultFixedPointPlaces = builder.defaultFixedPointPlaces;
        this.keyPrefix = builder.keyPrefix;
    }

    /**
     * Create a new builder for KvlinkConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every default applied.
     */
    public static KvlinkConfiguration defaults() {
        return builder().build();
    }

    /**
     * Whether {@code save()} without arguments saves linked records first.
     *
     * @return true by default
     */
    public boolean cascadeSaveByDefault() {
        return cascadeSaveByDefault;
    }

    /**
     * Whether {@code all()} without arguments resolves every reachable link.
     *
     * @return false by default
     */
    public boolean cascadeFetchByDefault() {
        return cascadeFetchByDefault;
    }

    /**
     * Whether {@code reload()} without arguments reloads resolved link targets.
     *
     * @return false by default
     */
    public boolean reloadCascadeByDefault() {
        return reloadCascadeByDefault;
    }

    public CompressionMode defaultCompressionMode() {
        return defaultCompressionMode;
    }

    public int defaultFixedPointPlaces() {
        return defaultFixedPointPlaces;
    }

    /**
     * Prefix prepended to every model key name handed to the store.
     */
    public String keyPrefix() {
        return keyPrefix;
    }

    /**
     * Builder for KvlinkConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private boolean cascadeSaveByDefault = true;
        private boolean cascadeFetchByDefault = false;
        private boolean reloadCascadeByDefault = false;
        private CompressionMode defaultCompressionMode = CompressionMode.DEFLATE;
        private int defaultFixedPointPlaces = 5;
        private String keyPrefix = "";

        private Builder() {
        }

        /**
         * Set whether saves cascade to linked records when not stated explicitly.
         *
         * @param cascadeSaveByDefault true to cascade (default: true)
         * @return this builder for method chaining
         */
        public Builder cascadeSaveByDefault(boolean cascadeSaveByDefault) {
            this.cascadeSaveByDefault = cascadeSaveByDefault;
            return this;
        }

        /**
         * Set whether query results resolve their links eagerly when not stated explicitly.
         *
         * @param cascadeFetchByDefault true to resolve eagerly (default: false)
         * @return this builder for method chaining
         */
        public Builder cascadeFetchByDefault(boolean cascadeFetchByDefault) {
            this.cascadeFetchByDefault = cascadeFetchByDefault;
            return this;
        }

        /**
         * Set whether reloads refresh resolved link targets when not stated explicitly.
         *
         * @param reloadCascadeByDefault true to reload targets (default: false)
         * @return this builder for method chaining
         */
        public Builder reloadCascadeByDefault(boolean reloadCascadeByDefault) {
            this.reloadCascadeByDefault = reloadCascadeByDefault;
            return this;
        }

        public Builder defaultCompressionMode(CompressionMode defaultCompressionMode) {
            this.defaultCompressionMode = Objects.requireNonNull(defaultCompressionMode, "defaultCompressionMode");
            return this;
        }

        /**
         * Set the number of decimal places used by fixed-point fields declared
         * without an explicit precision.
         *
         * @param defaultFixedPointPlaces digits after the decimal point, 0 to 18
         * @return this builder for method chaining
         */
        public Builder defaultFixedPointPlaces(int defaultFixedPointPlaces) {
            if (defaultFixedPointPlaces < 0 || defaultFixedPointPlaces > 18) {
                throw new IllegalArgumentException("defaultFixedPointPlaces out of range: " + defaultFixedPointPlaces);
            }
            this.defaultFixedPointPlaces = defaultFixedPointPlaces;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
            return this;
        }

        /**
         * Build the immutable configuration instance.
         *
         * @return a new KvlinkConfiguration with the configured values
         */
        public KvlinkConfiguration build() {
            return new KvlinkConfiguration(this);
        }
    }
}
