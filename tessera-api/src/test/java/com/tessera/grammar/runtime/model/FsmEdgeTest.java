/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import com.tessera.grammar.api.exceptions.InvalidRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FsmEdgeTest {

    @Test
    @DisplayName("Edge kinds are mutually exclusive")
    void kindsAreExclusive() {
        FsmEdge epsilon = FsmEdge.epsilon(1);
        FsmEdge ref = FsmEdge.ruleRef(3, 1);
        FsmEdge range = FsmEdge.charRange('a', 'z', 1);

        assertThat(epsilon.isEpsilon()).isTrue();
        assertThat(epsilon.isRuleRef()).isFalse();
        assertThat(epsilon.isCharRange()).isFalse();

        assertThat(ref.isEpsilon()).isFalse();
        assertThat(ref.isRuleRef()).isTrue();
        assertThat(ref.isCharRange()).isFalse();

        assertThat(range.isEpsilon()).isFalse();
        assertThat(range.isRuleRef()).isFalse();
        assertThat(range.isCharRange()).isTrue();
    }

    @Test
    @DisplayName("Rule reference with id 0 is not mistaken for a character range")
    void ruleZeroIsStillARuleRef() {
        FsmEdge ref = FsmEdge.ruleRef(0, 4);

        assertThat(ref.isRuleRef()).isTrue();
        assertThat(ref.refRuleId()).isZero();
        assertThat(ref.target()).isEqualTo(4);
    }

    @Test
    @DisplayName("Inverted character range is rejected")
    void invertedRangeRejected() {
        assertThatThrownBy(() -> FsmEdge.charRange('z', 'a', 0))
                .isInstanceOf(InvalidRangeException.class)
                .satisfies(e -> {
                    InvalidRangeException ire = (InvalidRangeException) e;
                    assertThat(ire.getMin()).isEqualTo('z');
                    assertThat(ire.getMax()).isEqualTo('a');
                });
    }

    @Test
    @DisplayName("Single code point range is valid")
    void singlePointRange() {
        FsmEdge edge = new FsmEdge(65, 65, 2);
        assertThat(edge.isCharRange()).isTrue();
    }

    @Test
    @DisplayName("Sentinel pairs that describe no edge kind are rejected")
    void malformedSentinelsRejected() {
        assertThatThrownBy(() -> new FsmEdge(5, -1, 0)).isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> new FsmEdge(-2, 3, 0)).isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> new FsmEdge(-1, -7, 0)).isInstanceOf(InvalidRangeException.class);
    }

    @Test
    @DisplayName("Rule id is only defined on rule reference edges")
    void refRuleIdOnlyForRuleRefs() {
        assertThatThrownBy(() -> FsmEdge.epsilon(0).refRuleId()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> FsmEdge.charRange(1, 2, 0).refRuleId()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Negative targets and negative rule ids are rejected")
    void negativeIdsRejected() {
        assertThatThrownBy(() -> FsmEdge.epsilon(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FsmEdge.ruleRef(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withTarget keeps the label")
    void withTargetKeepsLabel() {
        FsmEdge moved = FsmEdge.charRange('0', '9', 1).withTarget(7);
        assertThat(moved).isEqualTo(new FsmEdge('0', '9', 7));
    }
}
