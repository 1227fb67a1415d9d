/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.impl.inmemory;

import com.tessera.grammar.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recorded duration, for assertions and percentile calculations.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));

        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);
        if (sorted.size() == 1) {
            return sorted.get(0);
        }

        double index = (sorted.size() - 1) * p;
        int lowerIndex = (int) Math.floor(index);
        int upperIndex = (int) Math.ceil(index);
        if (lowerIndex == upperIndex) {
            return sorted.get(lowerIndex);
        }

        Duration lower = sorted.get(lowerIndex);
        Duration upper = sorted.get(upperIndex);
        double fraction = index - lowerIndex;
        return Duration.ofNanos(lower.toNanos() + (long) ((upper.toNanos() - lower.toNanos()) * fraction));
    }

    @Override
    public long count() {
        return recordings.size();
    }

    Duration max() {
        return recordings.stream().max(Comparator.naturalOrder()).orElse(Duration.ZERO);
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{name='%s', count=%d, max=%s, p99=%s}",
                name, count(), max(), percentile(0.99));
    }
}
