/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics;

/**
 * Factory and lookup for named metrics. Tags are alternating key/value pairs.
 *
 * <p>Asking twice for the same name and tags returns the same metric.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);
}
