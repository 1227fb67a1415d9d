/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics;

import com.tessera.grammar.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.tessera.grammar.infra.metrics.internal.MetricsRegistryHolder;
import com.tessera.grammar.infra.metrics.internal.NoOpMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsRegistryTest {

    private InMemoryMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryMetricsRegistry();
    }

    @Test
    @DisplayName("Should discover the in-memory provider registered for tests")
    void shouldDiscoverRegisteredProvider() {
        assertThat(MetricsRegistryHolder.INSTANCE).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    @DisplayName("Should return the same counter for the same name and tags")
    void shouldShareCountersByKey() {
        registry.counter("tessera.cache.hits", "tier", "front").increment();
        registry.counter("tessera.cache.hits", "tier", "front").increment(2);
        registry.counter("tessera.cache.hits", "tier", "back").increment();

        assertThat(registry.counter("tessera.cache.hits", "tier", "front").count()).isEqualTo(3);
        assertThat(registry.counter("tessera.cache.hits", "tier", "back").count()).isEqualTo(1);
        assertThat(registry.counter("tessera.cache.hits").count()).isZero();
    }

    @Test
    @DisplayName("Should reject unpaired tags")
    void shouldRejectUnpairedTags() {
        assertThatThrownBy(() -> registry.counter("x", "lonely"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep the last gauge value")
    void shouldKeepLastGaugeValue() {
        registry.gauge("tessera.fsm.states").set(12);
        registry.gauge("tessera.fsm.states").set(7);

        assertThat(registry.gauge("tessera.fsm.states").value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Should compute timer percentiles over recordings")
    void shouldComputePercentiles() throws Exception {
        Timer timer = registry.timer("tessera.compile.duration");
        for (int ms = 1; ms <= 5; ms++) {
            timer.record(Duration.ofMillis(ms));
        }
        assertThat(timer.record(() -> "done")).isEqualTo("done");

        assertThat(timer.count()).isEqualTo(6);
        assertThat(timer.percentile(1.0)).isEqualTo(Duration.ofMillis(5));
        assertThatThrownBy(() -> timer.record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should accept everything and report nothing when disabled")
    void shouldIgnoreEverythingWhenNoOp() {
        MetricsRegistry noOp = NoOpMetricsRegistry.INSTANCE;
        noOp.counter("c").increment();
        noOp.gauge("g").set(1);
        noOp.timer("t").record(Duration.ofSeconds(1));

        assertThat(noOp.counter("c").count()).isZero();
        assertThat(noOp.timer("t").count()).isZero();
    }
}
