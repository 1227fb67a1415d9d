/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration of the grammar compiler, its cache and the bitmask kernel.
 *
 * <p><b>Properties file keys</b> (see {@link #loadDefault()}):
 * <pre>
 * cache.type=TIERED
 * cache.max.entries=256
 * cache.ttl.minutes=60
 * cache.record.stats=true
 * cache.directory=/var/cache/tessera
 * builder.simplify=true
 * hasher.enabled=true
 * kernel.parallel.threshold=1048576
 * </pre>
 *
 * <p><b>Environment variable override:</b> every key can be overridden with
 * {@code TESSERA_<KEY>}, dots replaced by underscores and upper-cased, e.g.
 * {@code TESSERA_CACHE_MAX_ENTRIES=1024}. Environment values win over file values. Values
 * that do not parse are logged and ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TesseraConfig config = TesseraConfig.builder()
 *     .cacheType(CacheType.IN_MEMORY)
 *     .maxEntries(512)
 *     .build();
 * IGrammarCache cache = GrammarCacheFactory.create(config);
 * }</pre>
 */
public final class TesseraConfig {

    private static final Logger logger = Logger.getLogger(TesseraConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "tessera.properties";
    private static final String ENV_PREFIX = "TESSERA_";

    static final String KEY_CACHE_TYPE = "cache.type";
    static final String KEY_MAX_ENTRIES = "cache.max.entries";
    static final String KEY_TTL_MINUTES = "cache.ttl.minutes";
    static final String KEY_RECORD_STATS = "cache.record.stats";
    static final String KEY_CACHE_DIRECTORY = "cache.directory";
    static final String KEY_BUILDER_SIMPLIFY = "builder.simplify";
    static final String KEY_HASHER_ENABLED = "hasher.enabled";
    static final String KEY_PARALLEL_THRESHOLD = "kernel.parallel.threshold";

    /**
     * Grammar cache implementations.
     */
    public enum CacheType {
        /** Caffeine-backed, bounded by entry count. */
        IN_MEMORY,
        /** One JSON document per grammar under {@code cache.directory}. */
        FILE,
        /** In-memory in front of the file cache. */
        TIERED,
        /** Caching disabled. */
        NO_OP
    }

    private final CacheType cacheType;
    private final long maxEntries;
    private final long ttlMinutes;
    private final boolean recordStats;
    private final Path cacheDirectory;
    private final boolean builderSimplify;
    private final boolean hasherEnabled;
    private final long kernelParallelThreshold;

    private TesseraConfig(Builder builder) {
        this.cacheType = builder.cacheType;
        this.maxEntries = builder.maxEntries;
        this.ttlMinutes = builder.ttlMinutes;
        this.recordStats = builder.recordStats;
        this.cacheDirectory = builder.cacheDirectory;
        this.builderSimplify = builder.builderSimplify;
        this.hasherEnabled = builder.hasherEnabled;
        this.kernelParallelThreshold = builder.kernelParallelThreshold;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults, ignoring the environment.
     */
    public static TesseraConfig defaults() {
        return new Builder().build();
    }

    /**
     * Small in-memory cache with stats, no environment overrides.
     */
    public static TesseraConfig forTesting() {
        return new Builder()
                .cacheType(CacheType.IN_MEMORY)
                .maxEntries(16)
                .recordStats(true)
                .build();
    }

    /**
     * Defaults overridden by {@code TESSERA_*} environment variables.
     */
    public static TesseraConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} from the classpath root or working directory.
     * Falls back to defaults if it is missing.
     */
    public static TesseraConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads a properties file, looking on the classpath first and then on the file system.
     * Environment variables override the file.
     */
    public static TesseraConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static TesseraConfig loadFromProperties(String propertiesPath, Function<String, String> environment) {
        logger.info("Loading configuration from: " + propertiesPath);
        Properties props = readProperties(propertiesPath);
        return new Builder()
                .applyProperties(props)
                .applyEnvironment(environment)
                .build();
    }

    private static Properties readProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = TesseraConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
                return props;
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        Path file = Paths.get(propertiesPath);
        if (Files.isReadable(file)) {
            try (InputStream is = Files.newInputStream(file)) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not read properties file: " + propertiesPath + ". Using defaults.");
            }
        } else {
            logger.warning("Properties file not found: " + propertiesPath + ". Using defaults.");
        }
        return props;
    }

    /**
     * Builder seeded with defaults and then {@code TESSERA_*} environment overrides.
     */
    public static Builder builder() {
        return new Builder().applyEnvironment(System::getenv);
    }

    public Builder toBuilder() {
        return new Builder()
                .cacheType(cacheType)
                .maxEntries(maxEntries)
                .ttlMinutes(ttlMinutes)
                .recordStats(recordStats)
                .cacheDirectory(cacheDirectory)
                .builderSimplify(builderSimplify)
                .hasherEnabled(hasherEnabled)
                .kernelParallelThreshold(kernelParallelThreshold);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private CacheType cacheType = CacheType.IN_MEMORY;
        private long maxEntries = 256;
        private long ttlMinutes = 0;
        private boolean recordStats = true;
        private Path cacheDirectory = Paths.get(System.getProperty("java.io.tmpdir"), "tessera-grammar-cache");
        private boolean builderSimplify = true;
        private boolean hasherEnabled = true;
        private long kernelParallelThreshold = 1 << 20;

        private Builder() {
        }

        public Builder cacheType(CacheType type) {
            this.cacheType = type;
            return this;
        }

        public Builder maxEntries(long entries) {
            this.maxEntries = entries;
            return this;
        }

        /**
         * Expire cached grammars this many minutes after they were written; 0 disables expiry.
         */
        public Builder ttlMinutes(long minutes) {
            this.ttlMinutes = minutes;
            return this;
        }

        public Builder recordStats(boolean enable) {
            this.recordStats = enable;
            return this;
        }

        public Builder cacheDirectory(Path directory) {
            this.cacheDirectory = directory;
            return this;
        }

        public Builder builderSimplify(boolean enable) {
            this.builderSimplify = enable;
            return this;
        }

        public Builder hasherEnabled(boolean enable) {
            this.hasherEnabled = enable;
            return this;
        }

        /**
         * Number of logits elements from which kernel rows run in parallel.
         */
        public Builder kernelParallelThreshold(long elements) {
            this.kernelParallelThreshold = elements;
            return this;
        }

        Builder applyProperties(Properties props) {
            apply(props::getProperty, Function.identity());
            return this;
        }

        Builder applyEnvironment(Function<String, String> environment) {
            apply(environment, TesseraConfig::environmentKey);
            return this;
        }

        private void apply(Function<String, String> source, Function<String, String> keyMapping) {
            Function<String, Optional<String>> lookup = key -> {
                String mapped = keyMapping.apply(key);
                String value = source.apply(mapped);
                if (value == null || value.trim().isEmpty()) {
                    return Optional.empty();
                }
                logger.fine("Loaded setting " + mapped + "=" + value.trim());
                return Optional.of(value.trim());
            };

            lookup.apply(KEY_CACHE_TYPE).ifPresent(val -> parse(KEY_CACHE_TYPE, val,
                    v -> CacheType.valueOf(v.toUpperCase()), this::cacheType));
            lookup.apply(KEY_MAX_ENTRIES).ifPresent(val -> parse(KEY_MAX_ENTRIES, val,
                    Long::parseLong, this::maxEntries));
            lookup.apply(KEY_TTL_MINUTES).ifPresent(val -> parse(KEY_TTL_MINUTES, val,
                    Long::parseLong, this::ttlMinutes));
            lookup.apply(KEY_RECORD_STATS).ifPresent(val -> parse(KEY_RECORD_STATS, val,
                    TesseraConfig::parseBoolean, this::recordStats));
            lookup.apply(KEY_CACHE_DIRECTORY).ifPresent(val -> parse(KEY_CACHE_DIRECTORY, val,
                    Paths::get, this::cacheDirectory));
            lookup.apply(KEY_BUILDER_SIMPLIFY).ifPresent(val -> parse(KEY_BUILDER_SIMPLIFY, val,
                    TesseraConfig::parseBoolean, this::builderSimplify));
            lookup.apply(KEY_HASHER_ENABLED).ifPresent(val -> parse(KEY_HASHER_ENABLED, val,
                    TesseraConfig::parseBoolean, this::hasherEnabled));
            lookup.apply(KEY_PARALLEL_THRESHOLD).ifPresent(val -> parse(KEY_PARALLEL_THRESHOLD, val,
                    Long::parseLong, this::kernelParallelThreshold));
        }

        private static <T> void parse(String key, String raw, Function<String, T> parser, Consumer<T> setter) {
            T value;
            try {
                value = parser.apply(raw);
            } catch (RuntimeException e) {
                logger.warning("Invalid value for " + key + ": " + raw + ", keeping previous value");
                return;
            }
            setter.accept(value);
        }

        public TesseraConfig build() {
            return new TesseraConfig(this);
        }
    }

    static String environmentKey(String propertyKey) {
        return ENV_PREFIX + propertyKey.replace('.', '_').toUpperCase();
    }

    private static Boolean parseBoolean(String value) {
        String normalized = value.toLowerCase();
        if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
            return Boolean.TRUE;
        }
        if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (cacheType == null) {
            throw new IllegalArgumentException("cacheType is required");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (ttlMinutes < 0) {
            throw new IllegalArgumentException("ttlMinutes must not be negative: " + ttlMinutes);
        }
        if (kernelParallelThreshold <= 0) {
            throw new IllegalArgumentException("kernelParallelThreshold must be positive: " + kernelParallelThreshold);
        }
        if ((cacheType == CacheType.FILE || cacheType == CacheType.TIERED) && cacheDirectory == null) {
            throw new IllegalArgumentException("cacheDirectory is required for " + cacheType + " cache type");
        }
        logger.fine("Configuration validated: " + this);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public CacheType getCacheType() { return cacheType; }
    public long getMaxEntries() { return maxEntries; }
    public long getTtlMinutes() { return ttlMinutes; }
    public boolean isRecordStats() { return recordStats; }
    public Path getCacheDirectory() { return cacheDirectory; }
    public boolean isBuilderSimplify() { return builderSimplify; }
    public boolean isHasherEnabled() { return hasherEnabled; }
    public long getKernelParallelThreshold() { return kernelParallelThreshold; }

    public Optional<Duration> getTtl() {
        return ttlMinutes == 0 ? Optional.empty() : Optional.of(Duration.ofMinutes(ttlMinutes));
    }

    @Override
    public String toString() {
        return String.format(
                "TesseraConfig{cacheType=%s, maxEntries=%d, ttlMinutes=%d, recordStats=%s, cacheDirectory=%s, "
                        + "builderSimplify=%s, hasherEnabled=%s, kernelParallelThreshold=%d}",
                cacheType, maxEntries, ttlMinutes, recordStats, cacheDirectory,
                builderSimplify, hasherEnabled, kernelParallelThreshold);
    }
}
