/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.impl.inmemory;

import com.tessera.grammar.infra.metrics.MetricsRegistry;
import com.tessera.grammar.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider.
 *
 * <p>To enable, register it in
 * {@code META-INF/services/com.tessera.grammar.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
