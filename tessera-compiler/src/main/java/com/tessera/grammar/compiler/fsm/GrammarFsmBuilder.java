/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.compiler.fsm;

import com.tessera.grammar.api.CompilationListener;
import com.tessera.grammar.api.exceptions.GrammarCompilationException;
import com.tessera.grammar.api.exceptions.InvalidRangeException;
import com.tessera.grammar.api.exceptions.UnresolvedRuleException;
import com.tessera.grammar.api.model.GrammarExpr;
import com.tessera.grammar.api.model.GrammarSource;
import com.tessera.grammar.api.model.RuleDefinition;
import com.tessera.grammar.runtime.model.Fsm;
import com.tessera.grammar.runtime.model.Grammar;
import com.tessera.grammar.runtime.model.Rule;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds one FSM per rule from the rule bodies handed over by the front end.
 *
 * <p>A reference to another rule becomes a single rule-reference edge; the callee's FSM is
 * never inlined, so every FSM stays finite however deeply rules recurse. The matcher treats
 * such an edge as a call into the callee's start state and continues at the edge target once
 * the callee accepts.
 *
 * <p>Any error aborts the whole grammar; no partially built grammar is ever returned.
 */
public final class GrammarFsmBuilder {

    private static final Logger logger = Logger.getLogger(GrammarFsmBuilder.class.getName());

    public static final int MAX_CODE_POINT = Character.MAX_CODE_POINT;

    private final boolean simplify;

    public GrammarFsmBuilder() {
        this(true);
    }

    /**
     * @param simplify eliminate epsilon edges and merge equivalent states in every rule FSM
     */
    public GrammarFsmBuilder(boolean simplify) {
        this.simplify = simplify;
    }

    /**
     * Checks the rule table and resolves rule names to ids (declaration order).
     *
     * @throws GrammarCompilationException if there are no rules or a name repeats
     * @throws UnresolvedRuleException     if the root rule is not defined
     */
    public Object2IntMap<String> resolveRuleIds(GrammarSource source) {
        List<RuleDefinition> rules = source.rules();
        if (rules.isEmpty()) {
            throw new GrammarCompilationException(CompilationListener.VALIDATION, "Grammar has no rules");
        }
        Object2IntLinkedOpenHashMap<String> ids = new Object2IntLinkedOpenHashMap<>(rules.size());
        ids.defaultReturnValue(-1);
        for (RuleDefinition rule : rules) {
            if (ids.containsKey(rule.name())) {
                throw new GrammarCompilationException(CompilationListener.VALIDATION,
                        "Duplicate rule name: " + rule.name());
            }
            ids.put(rule.name(), ids.size());
        }
        if (!ids.containsKey(source.rootRuleName())) {
            throw new UnresolvedRuleException(source.rootRuleName(), null);
        }
        return Object2IntMaps.unmodifiable(ids);
    }

    /**
     * Builds every rule FSM of {@code source}. The result carries no canonical hashes yet.
     */
    public Grammar build(GrammarSource source) {
        Object2IntMap<String> ids = resolveRuleIds(source);
        List<Rule> rules = new ArrayList<>(source.rules().size());
        for (RuleDefinition definition : source.rules()) {
            Fsm fsm = buildRuleFsm(definition, ids);
            rules.add(new Rule(rules.size(), definition.name(), definition.body(), fsm));
            logger.fine(String.format("Built FSM for rule '%s': %d states, %d edges",
                    definition.name(), fsm.numStates(), fsm.totalEdges()));
        }
        return Grammar.of(rules, ids.getInt(source.rootRuleName()));
    }

    /**
     * Builds the FSM of a single rule body.
     *
     * @param ruleIds name to id table of the enclosing grammar
     */
    public Fsm buildRuleFsm(RuleDefinition rule, Object2IntMap<String> ruleIds) {
        Fsm fsm = rule.body().accept(new ExprVisitor(rule.name(), ruleIds));
        return simplify ? FsmOperations.simplify(fsm) : fsm;
    }

    public boolean isSimplify() {
        return simplify;
    }

    // ========================================================================
    // EXPRESSION LOWERING
    // ========================================================================

    private static final class ExprVisitor implements GrammarExpr.Visitor<Fsm> {
        private final String ruleName;
        private final Object2IntMap<String> ruleIds;

        ExprVisitor(String ruleName, Object2IntMap<String> ruleIds) {
            this.ruleName = ruleName;
            this.ruleIds = ruleIds;
        }

        @Override
        public Fsm visitCharacterClass(GrammarExpr.CharacterClass expr) {
            List<int[]> ranges = new ArrayList<>(expr.ranges().size());
            for (GrammarExpr.CodePointRange range : expr.ranges()) {
                checkCodePoint(range.min(), range.max(), range.min());
                checkCodePoint(range.min(), range.max(), range.max());
                if (range.min() > range.max()) {
                    throw new InvalidRangeException(range.min(), range.max());
                }
                ranges.add(new int[]{range.min(), range.max()});
            }
            return FsmOperations.codePointRanges(expr.negated() ? complement(ranges) : ranges);
        }

        @Override
        public Fsm visitLiteral(GrammarExpr.Literal expr) {
            return FsmOperations.literal(expr.text().codePoints().toArray());
        }

        @Override
        public Fsm visitSequence(GrammarExpr.Sequence expr) {
            List<Fsm> parts = new ArrayList<>(expr.items().size());
            for (GrammarExpr item : expr.items()) {
                parts.add(item.accept(this));
            }
            return FsmOperations.concatenate(parts);
        }

        @Override
        public Fsm visitChoice(GrammarExpr.Choice expr) {
            List<Fsm> branches = new ArrayList<>(expr.alternatives().size());
            for (GrammarExpr alternative : expr.alternatives()) {
                branches.add(alternative.accept(this));
            }
            return FsmOperations.union(branches);
        }

        @Override
        public Fsm visitRepetition(GrammarExpr.Repetition expr) {
            int min = expr.min();
            int max = expr.max();
            if (min < 0 || (max != GrammarExpr.Repetition.UNBOUNDED && max < min)) {
                throw new InvalidRangeException(min, max, String.format(
                        "Invalid repetition bounds {%d,%d} in rule '%s'", min, max, ruleName));
            }
            Fsm body = expr.body().accept(this);
            if (min == 0 && max == GrammarExpr.Repetition.UNBOUNDED) {
                return FsmOperations.star(body);
            }
            if (min == 1 && max == GrammarExpr.Repetition.UNBOUNDED) {
                return FsmOperations.plus(body);
            }
            if (min == 0 && max == 1) {
                return FsmOperations.optional(body);
            }
            return FsmOperations.repeat(body, min, max);
        }

        @Override
        public Fsm visitRuleRef(GrammarExpr.RuleRef expr) {
            int id = ruleIds.getInt(expr.ruleName());
            if (!ruleIds.containsKey(expr.ruleName())) {
                throw new UnresolvedRuleException(expr.ruleName(), ruleName);
            }
            return FsmOperations.ruleRef(id);
        }

        @Override
        public Fsm visitEmptyString(GrammarExpr.EmptyString expr) {
            return FsmOperations.emptyString();
        }
    }

    private static void checkCodePoint(int min, int max, int codePoint) {
        if (codePoint < 0 || codePoint > MAX_CODE_POINT) {
            throw new InvalidRangeException(min, max, String.format(
                    "Code point %d outside [0, 0x%X]", codePoint, MAX_CODE_POINT));
        }
    }

    /**
     * Complement of the union of {@code ranges} within {@code [0, MAX_CODE_POINT]}.
     */
    static List<int[]> complement(List<int[]> ranges) {
        List<int[]> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingInt((int[] r) -> r[0]).thenComparingInt(r -> r[1]));
        List<int[]> result = new ArrayList<>();
        int next = 0;
        for (int[] range : sorted) {
            if (range[0] > next) {
                result.add(new int[]{next, range[0] - 1});
            }
            next = Math.max(next, range[1] + 1);
        }
        if (next <= MAX_CODE_POINT) {
            result.add(new int[]{next, MAX_CODE_POINT});
        }
        return result;
    }
}
