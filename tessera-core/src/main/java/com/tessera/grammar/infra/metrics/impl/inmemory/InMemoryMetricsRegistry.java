/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.impl.inmemory;

import com.tessera.grammar.infra.metrics.Counter;
import com.tessera.grammar.infra.metrics.Gauge;
import com.tessera.grammar.infra.metrics.MetricsRegistry;
import com.tessera.grammar.infra.metrics.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry keeping all metrics in memory, keyed by name plus tags.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), InMemoryTimer::new);
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static String key(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs: " + String.join(",", tags));
        }
        if (tags.length == 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) sb.append(',');
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
