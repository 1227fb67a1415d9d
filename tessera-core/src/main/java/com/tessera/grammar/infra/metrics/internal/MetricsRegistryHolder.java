/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.internal;

import com.tessera.grammar.infra.metrics.MetricsRegistry;
import com.tessera.grammar.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the default MetricsRegistry, discovered through ServiceLoader.
 *
 * <p><b>INTERNAL USE ONLY</b> - components take a registry explicitly and fall back to
 * this one when none is given.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE;

    static {
        ServiceLoader<MetricsRegistryProvider> loader =
                ServiceLoader.load(MetricsRegistryProvider.class);

        // Select highest-priority provider
        MetricsRegistryProvider provider = StreamSupport.stream(
                        loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider != null) {
            INSTANCE = provider.create();
            logger.info(String.format("Metrics provider: %s (priority: %d)",
                    provider.name(), provider.priority()));
        } else {
            INSTANCE = NoOpMetricsRegistry.INSTANCE;
            logger.fine("No metrics provider found, using no-op implementation");
        }
    }

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }
}
