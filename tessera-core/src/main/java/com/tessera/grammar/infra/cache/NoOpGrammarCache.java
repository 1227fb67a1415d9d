/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.tessera.grammar.api.IGrammarCache;
import com.tessera.grammar.runtime.model.Grammar;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache that stores nothing; every lookup is a miss.
 */
public final class NoOpGrammarCache implements IGrammarCache {

    private final AtomicLong misses = new AtomicLong();

    @Override
    public Optional<Grammar> get(String fingerprint) {
        misses.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public void put(String fingerprint, Grammar grammar) {
    }

    @Override
    public void invalidate(String fingerprint) {
    }

    @Override
    public void clear() {
    }

    @Override
    public CacheMetrics getMetrics() {
        return new CacheMetrics(0, 0, misses.get(), 0);
    }
}
