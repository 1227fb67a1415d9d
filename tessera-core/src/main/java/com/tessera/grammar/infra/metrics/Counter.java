/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics;

/**
 * Monotonically increasing count, such as compiled grammars or cache hits. Safe for
 * concurrent increments.
 */
public interface Counter {
    void increment();
    void increment(long amount);
    long count();
}
