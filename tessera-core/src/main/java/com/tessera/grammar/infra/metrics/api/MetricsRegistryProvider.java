/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.api;

import com.tessera.grammar.infra.metrics.MetricsRegistry;

/**
 * Plugs a metrics backend into the compiler. Providers are found through
 * {@link java.util.ServiceLoader} under
 * {@code META-INF/services/com.tessera.grammar.infra.metrics.api.MetricsRegistryProvider}
 * and need a public no-arg constructor.
 */
public interface MetricsRegistryProvider {

    /**
     * Called once, by the first component asking for the default registry. The result is
     * shared by every compiler in the process.
     */
    MetricsRegistry create();

    /**
     * Wins over providers with a lower priority.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
