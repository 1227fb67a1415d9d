/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.tessera.grammar.api.IGrammarCache.CacheMetrics;
import com.tessera.grammar.runtime.model.Grammar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryGrammarCacheTest {

    private InMemoryGrammarCache cache;

    @BeforeEach
    void setUp() {
        cache = InMemoryGrammarCache.builder()
                .maxEntries(100)
                .expireAfterWrite(Duration.ofMinutes(10))
                .recordStats(true)
                .build();
    }

    @Test
    @DisplayName("Should return the stored grammar instance")
    void shouldReturnStoredGrammar() {
        Grammar grammar = TestGrammars.literalGrammar("ab");
        cache.put("fp1", grammar);

        assertThat(cache.get("fp1")).containsSame(grammar);
        assertThat(cache.get("fp2")).isEmpty();
    }

    @Test
    @DisplayName("Should track hits and misses")
    void shouldTrackStats() {
        cache.put("fp1", TestGrammars.literalGrammar("a"));
        cache.get("fp1");
        cache.get("fp1");
        cache.get("missing");

        CacheMetrics metrics = cache.getMetrics();
        assertThat(metrics.size()).isEqualTo(1);
        assertThat(metrics.hits()).isEqualTo(2);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.hitRate()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("Should invalidate single entries and clear everything")
    void shouldInvalidateAndClear() {
        cache.put("fp1", TestGrammars.literalGrammar("a"));
        cache.put("fp2", TestGrammars.literalGrammar("b"));

        cache.invalidate("fp1");
        assertThat(cache.get("fp1")).isEmpty();
        assertThat(cache.get("fp2")).isPresent();

        cache.clear();
        assertThat(cache.get("fp2")).isEmpty();
        assertThat(cache.getMetrics().size()).isZero();
    }

    @Test
    @DisplayName("Should stay within the configured size")
    void shouldEvictBeyondMaxEntries() {
        InMemoryGrammarCache small = InMemoryGrammarCache.builder().maxEntries(2).build();
        for (int i = 0; i < 10; i++) {
            small.put("fp" + i, TestGrammars.literalGrammar("x"));
        }
        small.cleanup();

        assertThat(small.getMetrics().size()).isLessThanOrEqualTo(2);
        assertThat(small.getMetrics().evictions()).isGreaterThanOrEqualTo(8);
    }

    @Test
    @DisplayName("Should report zero stats when recording is disabled")
    void shouldReportEmptyStatsWhenDisabled() {
        InMemoryGrammarCache quiet = InMemoryGrammarCache.builder().recordStats(false).build();
        quiet.put("fp", TestGrammars.literalGrammar("a"));
        quiet.get("fp");

        assertThat(quiet.getMetrics().hits()).isZero();
        assertThat(quiet.getMetrics().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a non-positive size")
    void shouldRejectNonPositiveSize() {
        assertThatThrownBy(() -> InMemoryGrammarCache.builder().maxEntries(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
