/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.model;

import java.util.Objects;

/**
 * A named rule as handed over by the front end. Rule ids are not part of the
 * definition; the grammar assigns them from declaration order.
 */
public record RuleDefinition(String name, GrammarExpr body) {
    public RuleDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
    }
}
