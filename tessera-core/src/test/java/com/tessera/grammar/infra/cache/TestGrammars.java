/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.tessera.grammar.runtime.model.Fsm;
import com.tessera.grammar.runtime.model.Grammar;
import com.tessera.grammar.runtime.model.Rule;

import java.util.List;

import static com.tessera.grammar.api.model.GrammarExprs.literal;

/**
 * Small hand-built grammars for cache tests.
 */
final class TestGrammars {

    private TestGrammars() {
    }

    /**
     * {@code root ::= "<text>"} over single code units.
     */
    static Grammar literalGrammar(String text) {
        Fsm.Builder fsm = Fsm.builder();
        int state = fsm.addState();
        fsm.setStart(state);
        for (int i = 0; i < text.length(); i++) {
            int next = fsm.addState();
            fsm.addCharRange(state, text.charAt(i), text.charAt(i), next);
            state = next;
        }
        fsm.addAccepting(state);
        return Grammar.of(List.of(new Rule(0, "root", literal(text), fsm.build())), 0);
    }
}
