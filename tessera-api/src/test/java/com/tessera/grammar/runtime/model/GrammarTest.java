/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import com.tessera.grammar.api.model.GrammarExprs;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarTest {

    private static Fsm singleState() {
        Fsm.Builder b = Fsm.builder();
        int s = b.addState();
        return b.setStart(s).addAccepting(s).build();
    }

    private static Rule rule(int id, String name) {
        return new Rule(id, name, GrammarExprs.empty(), singleState());
    }

    @Test
    @DisplayName("New grammar has empty side tables")
    void newGrammarIsNotCanonicalized() {
        Grammar grammar = Grammar.of(List.of(rule(0, "root"), rule(1, "item")), 0);

        assertThat(grammar.numRules()).isEqualTo(2);
        assertThat(grammar.getRootRule().name()).isEqualTo("root");
        assertThat(grammar.findRuleId("item")).hasValue(1);
        assertThat(grammar.findRuleId("missing")).isEmpty();
        assertThat(grammar.getFsmHash(0)).isEmpty();
        assertThat(grammar.getFsmNewStateIds(1)).isEmpty();
        assertThat(grammar.isCanonicalized()).isFalse();
        assertThat(grammar.totalStates()).isEqualTo(2);
    }

    @Test
    @DisplayName("Canonicalization results produce a new grammar")
    void withCanonicalizationCopies() {
        Grammar grammar = Grammar.of(List.of(rule(0, "root")), 0);
        Int2IntOpenHashMap ids = new Int2IntOpenHashMap();
        ids.put(0, 0);

        Grammar canonical = grammar.withCanonicalization(List.of(OptionalLong.of(42L)), List.of(Optional.of(ids)));
        ids.put(5, 5);

        assertThat(grammar.isCanonicalized()).isFalse();
        assertThat(canonical.isCanonicalized()).isTrue();
        assertThat(canonical.getFsmHash(0)).hasValue(42L);
        Int2IntMap stored = canonical.getFsmNewStateIds(0).orElseThrow();
        assertThat(stored).hasSize(1);
        assertThatThrownBy(() -> stored.put(1, 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Rule ids, names, root and side tables are validated")
    void validation() {
        assertThatThrownBy(() -> Grammar.of(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Grammar.of(List.of(rule(1, "root")), 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Grammar.of(List.of(rule(0, "a"), rule(1, "a")), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Grammar.of(List.of(rule(0, "root")), 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Grammar.restore(List.of(rule(0, "root")), 0, List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Rule references must name a rule of the grammar")
    void ruleReferencesAreValidated() {
        Fsm.Builder b = Fsm.builder();
        int s0 = b.addState();
        int s1 = b.addState();
        b.setStart(s0).addRuleRef(s0, 7, s1).addAccepting(s1);
        Rule dangling = new Rule(0, "root", GrammarExprs.ref("ghost"), b.build());

        assertThatThrownBy(() -> Grammar.of(List.of(dangling), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("references rule id 7");
    }

    @Test
    @DisplayName("State id maps must cover exactly the states of their rule")
    void stateIdMapsAreValidated() {
        Grammar grammar = Grammar.of(List.of(rule(0, "root")), 0);
        Int2IntOpenHashMap extra = new Int2IntOpenHashMap();
        extra.put(0, 0);
        extra.put(99, 7);
        Int2IntOpenHashMap missing = new Int2IntOpenHashMap();
        missing.put(1, 0);
        Int2IntOpenHashMap outOfRange = new Int2IntOpenHashMap();
        outOfRange.put(0, 3);

        assertThatThrownBy(() -> grammar.withCanonicalization(List.of(OptionalLong.of(1L)), List.of(Optional.of(extra))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has 2 entries for 1 states");
        assertThatThrownBy(() -> grammar.withCanonicalization(List.of(OptionalLong.of(1L)), List.of(Optional.of(missing))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no entry for state 0");
        assertThatThrownBy(() -> grammar.withCanonicalization(List.of(OptionalLong.of(1L)), List.of(Optional.of(outOfRange))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maps state 0 to 3");
    }
}
