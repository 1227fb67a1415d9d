/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tessera.grammar.api.IGrammarCache;
import com.tessera.grammar.runtime.model.Grammar;

import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Grammar cache backed by Caffeine.
 *
 * <p>Grammars are immutable, so entries are stored and returned as-is without copying.
 */
public class InMemoryGrammarCache implements IGrammarCache {
    private static final Logger logger = Logger.getLogger(InMemoryGrammarCache.class.getName());

    private final Cache<String, Grammar> cache;
    private final boolean statsEnabled;

    private InMemoryGrammarCache(Builder builder) {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder()
                .maximumSize(builder.maxEntries);

        if (builder.expireAfterWrite != null) {
            cacheBuilder.expireAfterWrite(builder.expireAfterWrite);
        }

        this.statsEnabled = builder.recordStats;
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }

        cacheBuilder.removalListener((key, value, cause) -> {
            if (cause.wasEvicted()) {
                logger.fine(String.format("Grammar evicted: fingerprint=%s, cause=%s", key, cause));
            }
        });

        this.cache = cacheBuilder.build();

        logger.info(String.format(
                "InMemoryGrammarCache initialized: maxEntries=%d, ttl=%s, stats=%b",
                builder.maxEntries, builder.expireAfterWrite, builder.recordStats));
    }

    @Override
    public Optional<Grammar> get(String fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public void put(String fingerprint, Grammar grammar) {
        cache.put(fingerprint, grammar);
    }

    @Override
    public void invalidate(String fingerprint) {
        cache.invalidate(fingerprint);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheMetrics getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        return new CacheMetrics(cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.evictionCount());
    }

    /**
     * Force synchronous cleanup of evicted entries.
     */
    public void cleanup() {
        cache.cleanUp();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long maxEntries = 256;
        private Duration expireAfterWrite;
        private boolean recordStats = true;

        public Builder maxEntries(long maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder expireAfterWrite(Duration ttl) {
            this.expireAfterWrite = ttl;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public InMemoryGrammarCache build() {
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
            }
            return new InMemoryGrammarCache(this);
        }
    }
}
