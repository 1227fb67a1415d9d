/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import com.tessera.grammar.api.model.GrammarExpr;

import java.util.Objects;

/**
 * A compiled grammar rule. The id is its position in the owning {@link Grammar}.
 */
public record Rule(int id, String name, GrammarExpr body, Fsm fsm) {

    public Rule {
        if (id < 0) {
            throw new IllegalArgumentException("Rule id must be non-negative, got " + id);
        }
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(fsm, "fsm");
    }
}
