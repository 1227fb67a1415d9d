/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.impl.inmemory;

import com.tessera.grammar.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryGauge implements Gauge {
    private final AtomicLong bits = new AtomicLong(Double.doubleToRawLongBits(0.0));
    private final String name;

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double value) {
        bits.set(Double.doubleToRawLongBits(value));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%s}", name, value());
    }
}
