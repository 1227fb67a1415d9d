/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.metrics.impl.inmemory;

import com.tessera.grammar.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {
    private final AtomicLong value = new AtomicLong(0);
    private final String name;

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter " + name + " cannot decrease by " + amount);
        }
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{name='%s', count=%d}", name, count());
    }
}
