/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * The compiled, immutable representation of a grammar.
 *
 * <p>A grammar owns its rules (and through them every rule FSM) plus two per-rule side
 * tables filled in by canonicalization:
 * <ul>
 *   <li>the canonical FSM hash of each rule, absent until the rule was canonicalized</li>
 *   <li>the remap from each original state id of the rule FSM to its canonical state id</li>
 * </ul>
 *
 * Instances are never mutated once created. Canonicalization yields a new instance through
 * {@link #withCanonicalization(List, List)}, so a grammar shared with readers is never
 * observed half-updated.
 */
public final class Grammar {

    private final List<Rule> rules;
    private final int rootRuleId;
    private final List<OptionalLong> perRuleFsmHashes;
    private final List<Optional<Int2IntMap>> perRuleFsmNewStateIds;
    private final Map<String, Integer> ruleIdsByName;

    private Grammar(List<Rule> rules, int rootRuleId,
                    List<OptionalLong> perRuleFsmHashes,
                    List<Optional<Int2IntMap>> perRuleFsmNewStateIds) {
        this.rules = List.copyOf(rules);
        this.rootRuleId = rootRuleId;
        this.perRuleFsmHashes = List.copyOf(perRuleFsmHashes);
        this.perRuleFsmNewStateIds = List.copyOf(perRuleFsmNewStateIds);

        Map<String, Integer> byName = new HashMap<>();
        for (Rule rule : this.rules) {
            byName.put(rule.name(), rule.id());
        }
        this.ruleIdsByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Creates a grammar whose side tables are empty.
     *
     * @throws IllegalArgumentException if rule ids are not {@code 0..n-1} in order, names
     *                                  repeat, or the root id is out of range
     */
    public static Grammar of(List<Rule> rules, int rootRuleId) {
        List<OptionalLong> hashes = new ArrayList<>(rules.size());
        List<Optional<Int2IntMap>> newIds = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            hashes.add(OptionalLong.empty());
            newIds.add(Optional.empty());
        }
        return restore(rules, rootRuleId, hashes, newIds);
    }

    /**
     * Recreates a grammar with both side tables, e.g. after deserialization.
     *
     * @throws IllegalArgumentException if the rules are malformed as for {@link #of}, an edge
     *                                  references a rule id outside the grammar, or a state id
     *                                  map does not cover exactly the states of its rule
     */
    public static Grammar restore(List<Rule> rules, int rootRuleId,
                                  List<OptionalLong> perRuleFsmHashes,
                                  List<Optional<Int2IntMap>> perRuleFsmNewStateIds) {
        Objects.requireNonNull(rules, "rules");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("A grammar needs at least one rule");
        }
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).id() != i) {
                throw new IllegalArgumentException(String.format(
                        "Rule '%s' at position %d has id %d", rules.get(i).name(), i, rules.get(i).id()));
            }
            for (int j = 0; j < i; j++) {
                if (rules.get(j).name().equals(rules.get(i).name())) {
                    throw new IllegalArgumentException("Duplicate rule name: " + rules.get(i).name());
                }
            }
        }
        if (rootRuleId < 0 || rootRuleId >= rules.size()) {
            throw new IllegalArgumentException("Root rule id " + rootRuleId + " out of range");
        }
        if (perRuleFsmHashes.size() != rules.size() || perRuleFsmNewStateIds.size() != rules.size()) {
            throw new IllegalArgumentException("Side tables must have one entry per rule");
        }
        for (int i = 0; i < rules.size(); i++) {
            checkRuleRefs(rules.get(i), rules.size());
            Optional<Int2IntMap> ids = perRuleFsmNewStateIds.get(i);
            if (ids.isPresent()) {
                checkStateIdMap(rules.get(i), ids.get());
            }
        }
        List<Optional<Int2IntMap>> frozen = new ArrayList<>(rules.size());
        for (Optional<Int2IntMap> ids : perRuleFsmNewStateIds) {
            frozen.add(ids.map(m -> Int2IntMaps.unmodifiable(new Int2IntOpenHashMap(m))));
        }
        return new Grammar(rules, rootRuleId, perRuleFsmHashes, frozen);
    }

    private static void checkRuleRefs(Rule rule, int ruleCount) {
        Fsm fsm = rule.fsm();
        for (int s = 0; s < fsm.numStates(); s++) {
            final int state = s;
            fsm.forEachEdge(s, (min, max, target) -> {
                if (min == FsmEdge.NO_CHAR && max >= ruleCount) {
                    throw new IllegalArgumentException(String.format(
                            "Rule '%s' state %d references rule id %d, but the grammar has %d rules",
                            rule.name(), state, max, ruleCount));
                }
            });
        }
    }

    private static void checkStateIdMap(Rule rule, Int2IntMap ids) {
        int states = rule.fsm().numStates();
        if (ids.size() != states) {
            throw new IllegalArgumentException(String.format(
                    "State id map of rule '%s' has %d entries for %d states", rule.name(), ids.size(), states));
        }
        for (int s = 0; s < states; s++) {
            if (!ids.containsKey(s)) {
                throw new IllegalArgumentException(String.format(
                        "State id map of rule '%s' has no entry for state %d", rule.name(), s));
            }
            int canonical = ids.get(s);
            if (canonical < 0 || canonical >= states) {
                throw new IllegalArgumentException(String.format(
                        "State id map of rule '%s' maps state %d to %d, outside [0, %d)",
                        rule.name(), s, canonical, states));
            }
        }
    }

    /**
     * Returns a copy of this grammar carrying the given canonicalization results. The rules
     * and their FSMs are shared, as they are immutable.
     */
    public Grammar withCanonicalization(List<OptionalLong> hashes, List<Optional<Int2IntMap>> newStateIds) {
        return restore(rules, rootRuleId, hashes, newStateIds);
    }

    public int numRules() {
        return rules.size();
    }

    public Rule getRule(int ruleId) {
        return rules.get(ruleId);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public OptionalInt findRuleId(String name) {
        Integer id = ruleIdsByName.get(name);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public int getRootRuleId() {
        return rootRuleId;
    }

    public Rule getRootRule() {
        return rules.get(rootRuleId);
    }

    public OptionalLong getFsmHash(int ruleId) {
        return perRuleFsmHashes.get(ruleId);
    }

    public Optional<Int2IntMap> getFsmNewStateIds(int ruleId) {
        return perRuleFsmNewStateIds.get(ruleId);
    }

    public List<OptionalLong> getPerRuleFsmHashes() {
        return perRuleFsmHashes;
    }

    public List<Optional<Int2IntMap>> getPerRuleFsmNewStateIds() {
        return perRuleFsmNewStateIds;
    }

    /**
     * @return true once every rule carries a canonical hash
     */
    public boolean isCanonicalized() {
        return perRuleFsmHashes.stream().allMatch(OptionalLong::isPresent);
    }

    public int totalStates() {
        int total = 0;
        for (Rule rule : rules) {
            total += rule.fsm().numStates();
        }
        return total;
    }

    public int totalEdges() {
        int total = 0;
        for (Rule rule : rules) {
            total += rule.fsm().totalEdges();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grammar)) return false;
        Grammar other = (Grammar) o;
        return rootRuleId == other.rootRuleId
                && rules.equals(other.rules)
                && perRuleFsmHashes.equals(other.perRuleFsmHashes)
                && perRuleFsmNewStateIds.equals(other.perRuleFsmNewStateIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rules, rootRuleId, perRuleFsmHashes, perRuleFsmNewStateIds);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Grammar(root=").append(getRootRule().name());
        for (Rule rule : rules) {
            sb.append("\n  ").append(rule.id()).append(' ').append(rule.name())
                    .append(" hash=").append(perRuleFsmHashes.get(rule.id()))
                    .append(' ').append(rule.fsm());
        }
        return sb.append(')').toString();
    }
}
