/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.tessera.grammar.api.IGrammarCache;
import com.tessera.grammar.runtime.model.Grammar;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Two-level cache: a fast front tier (usually in memory) over a persistent back tier.
 * Back-tier hits are promoted to the front tier.
 */
public class TieredGrammarCache implements IGrammarCache {
    private static final Logger logger = Logger.getLogger(TieredGrammarCache.class.getName());

    private final IGrammarCache front;
    private final IGrammarCache back;

    public TieredGrammarCache(IGrammarCache front, IGrammarCache back) {
        this.front = Objects.requireNonNull(front, "front");
        this.back = Objects.requireNonNull(back, "back");
    }

    @Override
    public Optional<Grammar> get(String fingerprint) {
        Optional<Grammar> hit = front.get(fingerprint);
        if (hit.isPresent()) {
            return hit;
        }
        Optional<Grammar> persisted = back.get(fingerprint);
        persisted.ifPresent(grammar -> {
            logger.fine("Promoting cached grammar " + fingerprint + " to the front tier");
            front.put(fingerprint, grammar);
        });
        return persisted;
    }

    @Override
    public void put(String fingerprint, Grammar grammar) {
        back.put(fingerprint, grammar);
        front.put(fingerprint, grammar);
    }

    @Override
    public void invalidate(String fingerprint) {
        front.invalidate(fingerprint);
        back.invalidate(fingerprint);
    }

    @Override
    public void clear() {
        front.clear();
        back.clear();
    }

    /**
     * Hits of either tier count as hits; only lookups missing both tiers count as misses.
     */
    @Override
    public CacheMetrics getMetrics() {
        CacheMetrics f = front.getMetrics();
        CacheMetrics b = back.getMetrics();
        return new CacheMetrics(b.size(), f.hits() + b.hits(), b.misses(), f.evictions() + b.evictions());
    }
}
