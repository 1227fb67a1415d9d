/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.internal.collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArenaListTest {

    private ArenaList<String> list;

    @BeforeEach
    void setUp() {
        list = new ArenaList<>();
    }

    private List<String> contents() {
        List<String> out = new ArrayList<>();
        list.forEach(out::add);
        return out;
    }

    @Test
    @DisplayName("New list is empty and begin equals end")
    void emptyList() {
        assertThat(list.isEmpty()).isTrue();
        assertThat(list.begin()).isEqualTo(list.end());
        assertThat(list.end()).isZero();
    }

    @Test
    @DisplayName("pushBack returns non-sentinel handles in insertion order")
    void pushBackAppends() {
        int a = list.pushBack("a");
        int b = list.pushBack("b");

        assertThat(a).isNotZero();
        assertThat(b).isNotZero().isNotEqualTo(a);
        assertThat(list.begin()).isEqualTo(a);
        assertThat(list.next(a)).isEqualTo(b);
        assertThat(list.next(b)).isEqualTo(list.end());
        assertThat(contents()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("erase returns the next live element or end")
    void eraseReturnsNext() {
        int a = list.pushBack("a");
        int b = list.pushBack("b");
        int c = list.pushBack("c");

        assertThat(list.erase(b)).isEqualTo(c);
        assertThat(list.erase(c)).isEqualTo(list.end());
        assertThat(contents()).containsExactly("a");
        assertThat(list.size()).isEqualTo(1);
        assertThat(list.isLive(b)).isFalse();
        assertThat(list.get(a)).isEqualTo("a");
    }

    @Test
    @DisplayName("Pruning scan removes matching elements only")
    void pruningScan() {
        for (int i = 0; i < 10; i++) {
            list.pushBack(String.valueOf(i));
        }

        for (int h = list.begin(); h != list.end(); ) {
            if (Integer.parseInt(list.get(h)) % 2 == 0) {
                h = list.erase(h);
            } else {
                h = list.next(h);
            }
        }

        assertThat(contents()).containsExactly("1", "3", "5", "7", "9");
    }

    @Test
    @DisplayName("moveBack puts the element last without reallocating")
    void moveBackToTail() {
        int a = list.pushBack("a");
        list.pushBack("b");
        list.pushBack("c");
        int pool = list.poolSize();

        list.moveBack(a);

        assertThat(contents()).containsExactly("b", "c", "a");
        assertThat(list.poolSize()).isEqualTo(pool);
        assertThat(list.get(a)).isEqualTo("a");
    }

    @Test
    @DisplayName("Erased handles are recycled by the next pushBack")
    void handlesAreRecycled() {
        list.pushBack("a");
        int b = list.pushBack("b");
        list.erase(b);
        int pool = list.poolSize();

        int reused = list.pushBack("c");

        assertThat(reused).isEqualTo(b);
        assertThat(list.poolSize()).isEqualTo(pool);
        assertThat(contents()).containsExactly("a", "c");
    }

    @Test
    @DisplayName("clear leaves only the sentinel")
    void clearResets() {
        list.pushBack("a");
        list.pushBack("b");

        list.clear();

        assertThat(list.begin()).isEqualTo(list.end());
        assertThat(list.isEmpty()).isTrue();
        assertThat(list.poolSize()).isEqualTo(1);
        assertThat(list.pushBack("x")).isEqualTo(1);
    }

    @Test
    @DisplayName("Sentinel and dead handles are rejected")
    void invalidHandlesRejected() {
        int a = list.pushBack("a");
        list.erase(a);

        assertThatThrownBy(() -> list.get(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> list.erase(a)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> list.moveBack(42)).isInstanceOf(IllegalArgumentException.class);
    }
}
