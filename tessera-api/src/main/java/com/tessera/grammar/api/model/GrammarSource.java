/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Complete input of one compilation: the rule table in declaration order plus the name
 * of the root rule.
 */
public record GrammarSource(List<RuleDefinition> rules, String rootRuleName) {

    public static final String DEFAULT_ROOT_RULE = "root";

    public GrammarSource {
        rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        Objects.requireNonNull(rootRuleName, "rootRuleName");
    }

    public static GrammarSource of(RuleDefinition... rules) {
        return new GrammarSource(List.of(rules), DEFAULT_ROOT_RULE);
    }
}
