/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api;

import com.tessera.grammar.runtime.model.Grammar;

import java.util.Optional;

/**
 * Cache of compiled grammars keyed by the fingerprint of their source.
 *
 * <p>Implementations are passed to the compiler explicitly; there is no process-wide
 * instance. All implementations must be safe for concurrent use.
 */
public interface IGrammarCache {

    Optional<Grammar> get(String fingerprint);

    void put(String fingerprint, Grammar grammar);

    void invalidate(String fingerprint);

    void clear();

    CacheMetrics getMetrics();

    /**
     * Point-in-time cache statistics.
     */
    record CacheMetrics(long size, long hits, long misses, long evictions) {

        public static final CacheMetrics EMPTY = new CacheMetrics(0, 0, 0, 0);

        public double hitRate() {
            long requests = hits + misses;
            return requests == 0 ? 0.0 : (double) hits / requests;
        }

        public CacheMetrics plus(CacheMetrics other) {
            return new CacheMetrics(size + other.size, hits + other.hits,
                    misses + other.misses, evictions + other.evictions);
        }
    }
}
