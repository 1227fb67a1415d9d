/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.tessera.grammar.api.IGrammarCache;
import com.tessera.grammar.infra.config.TesseraConfig;

import java.util.logging.Logger;

/**
 * Creates the grammar cache selected by a {@link TesseraConfig}.
 */
public final class GrammarCacheFactory {
    private static final Logger logger = Logger.getLogger(GrammarCacheFactory.class.getName());

    private GrammarCacheFactory() {
        throw new AssertionError("No instances");
    }

    public static IGrammarCache create(TesseraConfig config) {
        logger.info("Creating grammar cache of type " + config.getCacheType());
        return switch (config.getCacheType()) {
            case IN_MEMORY -> inMemory(config);
            case FILE -> new FileGrammarCache(config.getCacheDirectory());
            case TIERED -> new TieredGrammarCache(inMemory(config), new FileGrammarCache(config.getCacheDirectory()));
            case NO_OP -> new NoOpGrammarCache();
        };
    }

    private static InMemoryGrammarCache inMemory(TesseraConfig config) {
        InMemoryGrammarCache.Builder builder = InMemoryGrammarCache.builder()
                .maxEntries(config.getMaxEntries())
                .recordStats(config.isRecordStats());
        config.getTtl().ifPresent(builder::expireAfterWrite);
        return builder.build();
    }
}
