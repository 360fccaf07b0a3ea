/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.cache;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration of the compiled graph cache.
 *
 * <p>Values come from, in increasing precedence: builder defaults, a properties file, and
 * environment variables.
 *
 * <p>Environment variables:
 * <pre>
 * KGRAPH_CACHE_EVICTION=NODE_COUNT
 * KGRAPH_CACHE_MAX_IDENTITIES=5000
 * KGRAPH_CACHE_MAX_NODES=2000000
 * KGRAPH_CACHE_EXPIRE_AFTER_ACCESS_MINUTES=30
 * KGRAPH_CACHE_RECORD_STATS=true
 * </pre>
 *
 * <p>Properties use the same names in dotted lower case, e.g. {@code kgraph.cache.max.nodes}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * GraphCacheConfig config = GraphCacheConfig.builder()
 *     .evictionPolicy(EvictionPolicy.NODE_COUNT)
 *     .maxNodes(1_000_000)
 *     .expireAfterAccess(Duration.ofMinutes(30))
 *     .build();
 *
 * IGraphCache cache = new CaffeineGraphCache(compiler, config, tracer);
 * }</pre>
 */
public final class GraphCacheConfig {

    private static final Logger logger = Logger.getLogger(GraphCacheConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_EVICTION = "KGRAPH_CACHE_EVICTION";
    static final String ENV_MAX_IDENTITIES = "KGRAPH_CACHE_MAX_IDENTITIES";
    static final String ENV_MAX_NODES = "KGRAPH_CACHE_MAX_NODES";
    static final String ENV_EXPIRE_AFTER_ACCESS_MINUTES = "KGRAPH_CACHE_EXPIRE_AFTER_ACCESS_MINUTES";
    static final String ENV_RECORD_STATS = "KGRAPH_CACHE_RECORD_STATS";

    public static final String DEFAULT_PROPERTIES = "kgraph-cache.properties";

    /**
     * How the cache bounds its size.
     */
    public enum EvictionPolicy {
        /** At most {@code maxIdentities} compiled graphs. */
        IDENTITY_COUNT,

        /** At most {@code maxNodes} graph nodes summed over all cached graphs. */
        NODE_COUNT
    }

    private final EvictionPolicy evictionPolicy;
    private final long maxIdentities;
    private final long maxNodes;
    private final long expireAfterAccessMinutes;
    private final boolean recordStats;
    private final boolean logEvictions;

    private GraphCacheConfig(Builder builder) {
        this.evictionPolicy = builder.evictionPolicy;
        this.maxIdentities = builder.maxIdentities;
        this.maxNodes = builder.maxNodes;
        this.expireAfterAccessMinutes = builder.expireAfterAccessMinutes;
        this.recordStats = builder.recordStats;
        this.logEvictions = builder.logEvictions;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Small identity-bounded cache without expiry, suited to tests and local runs.
     */
    public static GraphCacheConfig forDevelopment() {
        return builder()
                .evictionPolicy(EvictionPolicy.IDENTITY_COUNT)
                .maxIdentities(100)
                .expireAfterAccess(Duration.ZERO)
                .recordStats(true)
                .logEvictions(true)
                .build();
    }

    /**
     * Node-weighted cache with idle expiry, so a few very large merchant configurations cannot
     * crowd out the memory budget.
     */
    public static GraphCacheConfig forProduction() {
        return builder()
                .evictionPolicy(EvictionPolicy.NODE_COUNT)
                .maxNodes(5_000_000)
                .expireAfterAccess(Duration.ofMinutes(60))
                .recordStats(true)
                .build();
    }

    /**
     * Builder defaults overridden by environment variables.
     */
    public static GraphCacheConfig fromEnvironment() {
        return builder().applyEnvironment(System::getenv).build();
    }

    /**
     * Loads {@link #DEFAULT_PROPERTIES} from the classpath or the working directory.
     */
    public static GraphCacheConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads configuration from a properties resource.
     *
     * <p>Searches the classpath first, then the file system. Environment variables override
     * values from the file. A missing file falls back to defaults.
     */
    public static GraphCacheConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static GraphCacheConfig loadFromProperties(String propertiesPath, Function<String, String> environment) {
        logger.info("Loading graph cache configuration from: " + propertiesPath);
        Properties props = new Properties();

        try (InputStream is = GraphCacheConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath + " (" + e.getMessage() + ")");
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return builder()
                .applyProperties(props)
                .applyEnvironment(environment)
                .build();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .evictionPolicy(evictionPolicy)
                .maxIdentities(maxIdentities)
                .maxNodes(maxNodes)
                .expireAfterAccess(Duration.ofMinutes(expireAfterAccessMinutes))
                .recordStats(recordStats)
                .logEvictions(logEvictions);
    }

    public static final class Builder {
        private EvictionPolicy evictionPolicy = EvictionPolicy.IDENTITY_COUNT;
        private long maxIdentities = 10_000;
        private long maxNodes = 5_000_000;
        private long expireAfterAccessMinutes = 0;
        private boolean recordStats = true;
        private boolean logEvictions = false;

        private Builder() {
        }

        public Builder evictionPolicy(EvictionPolicy policy) {
            this.evictionPolicy = policy;
            return this;
        }

        public Builder maxIdentities(long maxIdentities) {
            this.maxIdentities = maxIdentities;
            return this;
        }

        public Builder maxNodes(long maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        /**
         * Idle expiry in whole minutes; {@link Duration#ZERO} disables it.
         */
        public Builder expireAfterAccess(Duration duration) {
            this.expireAfterAccessMinutes = duration.toMinutes();
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public Builder logEvictions(boolean logEvictions) {
            this.logEvictions = logEvictions;
            return this;
        }

        Builder applyProperties(Properties props) {
            apply(props::getProperty, true);
            return this;
        }

        Builder applyEnvironment(Function<String, String> environment) {
            apply(environment, false);
            return this;
        }

        private void apply(Function<String, String> source, boolean dotted) {
            lookup(source, ENV_EVICTION, dotted).ifPresent(val -> {
                try {
                    this.evictionPolicy = EvictionPolicy.valueOf(val.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + ENV_EVICTION + ": " + val + ", using default: " + evictionPolicy);
                }
            });
            lookupLong(source, ENV_MAX_IDENTITIES, dotted).ifPresent(val -> this.maxIdentities = val);
            lookupLong(source, ENV_MAX_NODES, dotted).ifPresent(val -> this.maxNodes = val);
            lookupLong(source, ENV_EXPIRE_AFTER_ACCESS_MINUTES, dotted)
                    .ifPresent(val -> this.expireAfterAccessMinutes = val);
            lookup(source, ENV_RECORD_STATS, dotted).ifPresent(val -> {
                String normalized = val.toLowerCase(Locale.ROOT);
                this.recordStats = "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
            });
        }

        public GraphCacheConfig build() {
            return new GraphCacheConfig(this);
        }

        private static Optional<String> lookup(Function<String, String> source, String envKey, boolean dotted) {
            String key = dotted ? propertyKey(envKey) : envKey;
            String value = source.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded " + key + "=" + value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> lookupLong(Function<String, String> source, String envKey, boolean dotted) {
            return lookup(source, envKey, dotted).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + envKey + ": " + val);
                    return null;
                }
            });
        }
    }

    /**
     * {@code KGRAPH_CACHE_MAX_NODES} becomes {@code kgraph.cache.max.nodes}.
     */
    static String propertyKey(String envKey) {
        return envKey.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (evictionPolicy == null) {
            throw new IllegalArgumentException("evictionPolicy must not be null");
        }
        if (evictionPolicy == EvictionPolicy.IDENTITY_COUNT && maxIdentities <= 0) {
            throw new IllegalArgumentException("maxIdentities must be positive: " + maxIdentities);
        }
        if (evictionPolicy == EvictionPolicy.NODE_COUNT && maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (expireAfterAccessMinutes < 0) {
            throw new IllegalArgumentException("expireAfterAccess must not be negative: "
                    + expireAfterAccessMinutes + " minutes");
        }
        logger.fine("Graph cache configuration validated: " + this);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public EvictionPolicy getEvictionPolicy() { return evictionPolicy; }
    public long getMaxIdentities() { return maxIdentities; }
    public long getMaxNodes() { return maxNodes; }
    public boolean isRecordStats() { return recordStats; }
    public boolean isLogEvictions() { return logEvictions; }

    public Optional<Duration> getExpireAfterAccess() {
        return expireAfterAccessMinutes == 0
                ? Optional.empty()
                : Optional.of(Duration.ofMinutes(expireAfterAccessMinutes));
    }

    @Override
    public String toString() {
        return "GraphCacheConfig{" +
                "evictionPolicy=" + evictionPolicy +
                ", maxIdentities=" + maxIdentities +
                ", maxNodes=" + maxNodes +
                ", expireAfterAccessMinutes=" + expireAfterAccessMinutes +
                ", recordStats=" + recordStats +
                ", logEvictions=" + logEvictions +
                '}';
    }
}
