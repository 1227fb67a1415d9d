/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics;

/**
 * Last-written value, such as the state count of the most recent grammar.
 */
public interface Gauge {
    void set(double value);
    double value();
}
