/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.compiler.fsm;

import com.tessera.grammar.api.CompilationListener;
import com.tessera.grammar.api.exceptions.GrammarCompilationException;
import com.tessera.grammar.api.exceptions.InvalidRangeException;
import com.tessera.grammar.api.exceptions.UnresolvedRuleException;
import com.tessera.grammar.api.model.GrammarSource;
import com.tessera.grammar.runtime.model.Fsm;
import com.tessera.grammar.runtime.model.FsmEdge;
import com.tessera.grammar.runtime.model.Grammar;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tessera.grammar.api.model.GrammarExprs.charClass;
import static com.tessera.grammar.api.model.GrammarExprs.choice;
import static com.tessera.grammar.api.model.GrammarExprs.empty;
import static com.tessera.grammar.api.model.GrammarExprs.literal;
import static com.tessera.grammar.api.model.GrammarExprs.optional;
import static com.tessera.grammar.api.model.GrammarExprs.plus;
import static com.tessera.grammar.api.model.GrammarExprs.ref;
import static com.tessera.grammar.api.model.GrammarExprs.repeat;
import static com.tessera.grammar.api.model.GrammarExprs.rule;
import static com.tessera.grammar.api.model.GrammarExprs.seq;
import static com.tessera.grammar.api.model.GrammarExprs.star;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarFsmBuilderTest {

    private GrammarFsmBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new GrammarFsmBuilder();
    }

    @Test
    @DisplayName("Should build a two-state FSM for a choice of two classes")
    void shouldBuildTwoStateFsmForClassChoice() {
        Grammar grammar = builder.build(GrammarSource.of(
                rule("root", choice(charClass('a', 'z'), charClass('0', '9')))));

        Fsm fsm = grammar.getRootRule().fsm();
        assertThat(fsm.numStates()).isEqualTo(2);
        assertThat(fsm.accepts("k")).isTrue();
        assertThat(fsm.accepts("5")).isTrue();
        assertThat(fsm.accepts("K")).isFalse();
        assertThat(grammar.isCanonicalized()).isFalse();
    }

    @Test
    @DisplayName("Should assign rule ids in declaration order")
    void shouldAssignIdsInDeclarationOrder() {
        GrammarSource source = new GrammarSource(List.of(
                rule("value", literal("v")),
                rule("root", ref("value"))), "root");

        Object2IntMap<String> ids = builder.resolveRuleIds(source);
        assertThat(ids.getInt("value")).isZero();
        assertThat(ids.getInt("root")).isEqualTo(1);

        Grammar grammar = builder.build(source);
        assertThat(grammar.getRootRuleId()).isEqualTo(1);
        assertThat(grammar.getRule(0).name()).isEqualTo("value");
    }

    @Test
    @DisplayName("Should keep rule references as edges instead of inlining")
    void shouldKeepReferencesAsEdges() {
        Grammar grammar = builder.build(GrammarSource.of(
                rule("root", seq(literal("["), star(ref("item")), literal("]"))),
                rule("item", charClass('a', 'z'))));

        Fsm root = grammar.getRootRule().fsm();
        assertThat(root.hasRuleRefs()).isTrue();
        assertThat(root.accepts("[]")).isTrue();
        assertThat(root.accepts("[a]")).isFalse();

        boolean referencesItem = false;
        for (int s = 0; s < root.numStates(); s++) {
            for (FsmEdge e : root.edges(s)) {
                referencesItem |= e.isRuleRef() && e.refRuleId() == 1;
            }
        }
        assertThat(referencesItem).isTrue();
    }

    @Test
    @DisplayName("Should allow self-recursive rules")
    void shouldAllowRecursion() {
        Grammar grammar = builder.build(GrammarSource.of(
                rule("root", choice(literal("x"), seq(literal("("), ref("root"), literal(")"))))));

        assertThat(grammar.getRootRule().fsm().hasRuleRefs()).isTrue();
        assertThat(grammar.getRootRule().fsm().accepts("x")).isTrue();
    }

    @Test
    @DisplayName("Should lower negated classes to their complement")
    void shouldLowerNegatedClass() {
        Fsm fsm = builder.build(GrammarSource.of(rule("root", charClass(true, 'a', 'z')))).getRootRule().fsm();

        assertThat(fsm.accepts("a")).isFalse();
        assertThat(fsm.accepts("A")).isTrue();
        assertThat(fsm.accepts("\u0000")).isTrue();
        assertThat(fsm.accepts(new String(Character.toChars(GrammarFsmBuilder.MAX_CODE_POINT)))).isTrue();
    }

    @Test
    @DisplayName("Should complement overlapping ranges")
    void shouldComplementOverlappingRanges() {
        List<int[]> complement = GrammarFsmBuilder.complement(List.of(new int[]{10, 20}, new int[]{0, 5},
                new int[]{15, 30}));

        assertThat(complement).hasSize(2);
        assertThat(complement.get(0)).containsExactly(6, 9);
        assertThat(complement.get(1)).containsExactly(31, GrammarFsmBuilder.MAX_CODE_POINT);
        assertThat(GrammarFsmBuilder.complement(List.of(new int[]{0, GrammarFsmBuilder.MAX_CODE_POINT}))).isEmpty();
    }

    @Test
    @DisplayName("Should lower every repetition form")
    void shouldLowerRepetitions() {
        Grammar grammar = builder.build(GrammarSource.of(
                rule("root", seq(plus(literal("a")), optional(literal("b")), repeat(literal("c"), 1, 2)))));
        Fsm fsm = grammar.getRootRule().fsm();

        assertThat(fsm.accepts("ac")).isTrue();
        assertThat(fsm.accepts("aaabcc")).isTrue();
        assertThat(fsm.accepts("abccc")).isFalse();
        assertThat(fsm.accepts("bc")).isFalse();
    }

    @Test
    @DisplayName("Should accept the empty string for an empty body")
    void shouldHandleEmptyString() {
        Fsm fsm = builder.build(GrammarSource.of(rule("root", empty()))).getRootRule().fsm();
        assertThat(fsm.accepts("")).isTrue();
        assertThat(fsm.numStates()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should leave epsilon edges in place when simplification is off")
    void shouldKeepEpsilonsWithoutSimplify() {
        GrammarFsmBuilder raw = new GrammarFsmBuilder(false);
        Fsm fsm = raw.build(GrammarSource.of(rule("root", choice(literal("a"), literal("b"))))).getRootRule().fsm();

        assertThat(raw.isSimplify()).isFalse();
        assertThat(fsm.edges(fsm.start())).allMatch(FsmEdge::isEpsilon);
        assertThat(fsm.accepts("b")).isTrue();
    }

    @Test
    @DisplayName("Should reject an inverted character range")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> builder.build(GrammarSource.of(rule("root", charClass('z', 'a')))))
                .isInstanceOf(InvalidRangeException.class)
                .satisfies(e -> {
                    InvalidRangeException range = (InvalidRangeException) e;
                    assertThat(range.getMin()).isEqualTo('z');
                    assertThat(range.getMax()).isEqualTo('a');
                });
    }

    @Test
    @DisplayName("Should reject code points outside Unicode")
    void shouldRejectOutOfRangeCodePoint() {
        assertThatThrownBy(() -> builder.build(GrammarSource.of(
                rule("root", charClass(0, GrammarFsmBuilder.MAX_CODE_POINT + 1)))))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("outside");
    }

    @Test
    @DisplayName("Should reject inverted repetition bounds")
    void shouldRejectInvertedRepetition() {
        assertThatThrownBy(() -> builder.build(GrammarSource.of(rule("root", repeat(literal("a"), 3, 1)))))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("Invalid repetition bounds {3,1} in rule 'root'");
    }

    @Test
    @DisplayName("Should reject a reference to an undefined rule")
    void shouldRejectUnresolvedReference() {
        assertThatThrownBy(() -> builder.build(GrammarSource.of(rule("root", ref("missing")))))
                .isInstanceOf(UnresolvedRuleException.class)
                .satisfies(e -> {
                    UnresolvedRuleException unresolved = (UnresolvedRuleException) e;
                    assertThat(unresolved.getRuleName()).isEqualTo("missing");
                    assertThat(unresolved.getReferencedFrom()).isEqualTo("root");
                });
    }

    @Test
    @DisplayName("Should reject duplicate rule names")
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> builder.build(GrammarSource.of(
                rule("root", literal("a")), rule("root", literal("b")))))
                .isInstanceOf(GrammarCompilationException.class)
                .hasMessageContaining("Duplicate rule name: root")
                .satisfies(e -> assertThat(((GrammarCompilationException) e).getStage())
                        .isEqualTo(CompilationListener.VALIDATION));
    }

    @Test
    @DisplayName("Should reject an empty grammar")
    void shouldRejectEmptyGrammar() {
        assertThatThrownBy(() -> builder.build(new GrammarSource(List.of(), "root")))
                .isInstanceOf(GrammarCompilationException.class)
                .hasMessageContaining("Grammar has no rules");
    }

    @Test
    @DisplayName("Should reject a grammar without its root rule")
    void shouldRejectMissingRoot() {
        assertThatThrownBy(() -> builder.build(new GrammarSource(List.of(rule("start", literal("a"))), "root")))
                .isInstanceOf(UnresolvedRuleException.class)
                .satisfies(e -> assertThat(((UnresolvedRuleException) e).getReferencedFrom()).isNull());
    }
}
