/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Static factories for building rule bodies in code.
 *
 * <pre>{@code
 * // root ::= [a-z] | [0-9]
 * GrammarExpr body = choice(charClass('a', 'z'), charClass('0', '9'));
 * }</pre>
 */
public final class GrammarExprs {

    private static final GrammarExpr.EmptyString EMPTY = new GrammarExpr.EmptyString();

    private GrammarExprs() {
    }

    public static GrammarExpr.CharacterClass charClass(int min, int max) {
        return new GrammarExpr.CharacterClass(false, List.of(new GrammarExpr.CodePointRange(min, max)));
    }

    /**
     * @param bounds pairs of inclusive bounds: {@code min0, max0, min1, max1, ...}
     */
    public static GrammarExpr.CharacterClass charClass(boolean negated, int... bounds) {
        if (bounds.length % 2 != 0) {
            throw new IllegalArgumentException("Character class bounds must come in pairs");
        }
        List<GrammarExpr.CodePointRange> ranges = new ArrayList<>(bounds.length / 2);
        for (int i = 0; i < bounds.length; i += 2) {
            ranges.add(new GrammarExpr.CodePointRange(bounds[i], bounds[i + 1]));
        }
        return new GrammarExpr.CharacterClass(negated, ranges);
    }

    public static GrammarExpr.Literal literal(String text) {
        return new GrammarExpr.Literal(text);
    }

    public static GrammarExpr.Sequence seq(GrammarExpr... items) {
        return new GrammarExpr.Sequence(List.of(items));
    }

    public static GrammarExpr.Choice choice(GrammarExpr... alternatives) {
        return new GrammarExpr.Choice(List.of(alternatives));
    }

    public static GrammarExpr.Repetition star(GrammarExpr body) {
        return new GrammarExpr.Repetition(body, 0, GrammarExpr.Repetition.UNBOUNDED);
    }

    public static GrammarExpr.Repetition plus(GrammarExpr body) {
        return new GrammarExpr.Repetition(body, 1, GrammarExpr.Repetition.UNBOUNDED);
    }

    public static GrammarExpr.Repetition optional(GrammarExpr body) {
        return new GrammarExpr.Repetition(body, 0, 1);
    }

    public static GrammarExpr.Repetition repeat(GrammarExpr body, int min, int max) {
        return new GrammarExpr.Repetition(body, min, max);
    }

    public static GrammarExpr.RuleRef ref(String ruleName) {
        return new GrammarExpr.RuleRef(ruleName);
    }

    public static GrammarExpr.EmptyString empty() {
        return EMPTY;
    }

    public static RuleDefinition rule(String name, GrammarExpr body) {
        return new RuleDefinition(name, body);
    }
}
