/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency distribution metric.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Times the callable and records its duration, also when it throws.
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * @param percentile in {@code [0, 1]}
     */
    Duration percentile(double percentile);

    long count();
}
