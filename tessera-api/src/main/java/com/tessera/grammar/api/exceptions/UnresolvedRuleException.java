/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Thrown when a rule reference names a rule that is not part of the grammar.
 */
public class UnresolvedRuleException extends GrammarException {

    private final String ruleName;
    private final String referencedFrom;

    public UnresolvedRuleException(String ruleName, String referencedFrom) {
        super(referencedFrom == null
                ? String.format("Rule '%s' is not defined", ruleName)
                : String.format("Rule '%s' referenced from '%s' is not defined", ruleName, referencedFrom));
        this.ruleName = ruleName;
        this.referencedFrom = referencedFrom;
    }

    public String getRuleName() {
        return ruleName;
    }

    /**
     * @return name of the rule whose body holds the reference, or null for the root lookup
     */
    public String getReferencedFrom() {
        return referencedFrom;
    }
}
