/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Body expression of a grammar rule, as produced by the external EBNF front end.
 *
 * <p>The variants mirror the constructs the FSM builder understands:
 * <ul>
 *   <li>{@link CharacterClass} - one or more inclusive code point ranges, optionally negated</li>
 *   <li>{@link Literal} - an exact string, matched code point by code point</li>
 *   <li>{@link Sequence} - concatenation of sub-expressions</li>
 *   <li>{@link Choice} - alternation between sub-expressions</li>
 *   <li>{@link Repetition} - bounded or unbounded repetition of a sub-expression</li>
 *   <li>{@link RuleRef} - a call into another rule, by name</li>
 *   <li>{@link EmptyString} - the empty string</li>
 * </ul>
 *
 * Consumers dispatch on the variant through {@link Visitor}.
 */
public interface GrammarExpr {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitCharacterClass(CharacterClass expr);

        R visitLiteral(Literal expr);

        R visitSequence(Sequence expr);

        R visitChoice(Choice expr);

        R visitRepetition(Repetition expr);

        R visitRuleRef(RuleRef expr);

        R visitEmptyString(EmptyString expr);
    }

    /**
     * Inclusive code point range. Ordering and bounds are validated by the FSM builder,
     * not here, so that malformed front-end output surfaces as a compilation error.
     */
    record CodePointRange(int min, int max) {
    }

    record CharacterClass(boolean negated, List<CodePointRange> ranges) implements GrammarExpr {
        public CharacterClass {
            ranges = List.copyOf(Objects.requireNonNull(ranges, "ranges"));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharacterClass(this);
        }
    }

    record Literal(String text) implements GrammarExpr {
        public Literal {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record Sequence(List<GrammarExpr> items) implements GrammarExpr {
        public Sequence {
            items = List.copyOf(Objects.requireNonNull(items, "items"));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    record Choice(List<GrammarExpr> alternatives) implements GrammarExpr {
        public Choice {
            alternatives = List.copyOf(Objects.requireNonNull(alternatives, "alternatives"));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoice(this);
        }
    }

    /**
     * Repeats {@code body} between {@code min} and {@code max} times; {@code max == UNBOUNDED}
     * means no upper limit.
     */
    record Repetition(GrammarExpr body, int min, int max) implements GrammarExpr {
        public static final int UNBOUNDED = -1;

        public Repetition {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepetition(this);
        }
    }

    record RuleRef(String ruleName) implements GrammarExpr {
        public RuleRef {
            Objects.requireNonNull(ruleName, "ruleName");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRuleRef(this);
        }
    }

    record EmptyString() implements GrammarExpr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmptyString(this);
        }
    }
}
