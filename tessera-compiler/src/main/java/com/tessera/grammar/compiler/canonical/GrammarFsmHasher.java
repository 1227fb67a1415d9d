/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.compiler.canonical;

import com.tessera.grammar.api.exceptions.CanonicalizationInvariantViolation;
import com.tessera.grammar.runtime.internal.collections.ArenaList;
import com.tessera.grammar.runtime.internal.collections.UnionFind;
import com.tessera.grammar.runtime.model.CsrArray;
import com.tessera.grammar.runtime.model.Fsm;
import com.tessera.grammar.runtime.model.FsmEdge;
import com.tessera.grammar.runtime.model.Grammar;
import com.tessera.grammar.runtime.model.Rule;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns every rule of a grammar a structural hash that does not depend on how the rule's
 * states are numbered or in which order the rules are declared.
 *
 * <p>All rule FSMs are refined together as one graph. A state starts out colored by whether
 * it is a start state, whether it accepts, and the kinds of its outgoing edges. Each round,
 * a state's signature is the sorted multiset of {@code (edge label, target color)} over its
 * outgoing edges; for a rule-reference edge the callee is represented by the color of its
 * start state rather than by its id, which makes recursive rule graphs order-invariant. A
 * color class that holds more than one signature is split. Classes never merge, so the
 * number of classes grows every round until the partition is stable, which takes at most as
 * many rounds as there are states.
 *
 * <p>Only states with a recolored successor are recomputed. When a class splits, its largest
 * group keeps the old color, so only the predecessors of the smaller groups are revisited.
 * Pending states are kept on an {@link ArenaList} work frontier; once refinement is stable, states sharing a color are
 * merged with a {@link UnionFind}, numbered canonically per rule, and hashed.
 *
 * <p>The hasher never mutates its input. It returns a new {@link Grammar} carrying the
 * per-rule hashes and the original-to-canonical state id maps.
 */
public final class GrammarFsmHasher {

    private static final Logger logger = Logger.getLogger(GrammarFsmHasher.class.getName());

    private static final long SEED = 0x2545F4914F6CDD1DL;

    private static final int KIND_EPSILON = 0;
    private static final int KIND_RULE_REF = 1;
    private static final int KIND_CHAR_RANGE = 2;

    /**
     * Computes canonical hashes and state maps for every rule of {@code grammar}.
     *
     * @throws CanonicalizationInvariantViolation if refinement fails to stabilize
     */
    public Grammar canonicalize(Grammar grammar) {
        JointGraph graph = new JointGraph(grammar);
        long[] colors = refine(graph);

        UnionFind<Integer> classes = new UnionFind<>();
        Long2ObjectOpenHashMap<IntArrayList> byColor = new Long2ObjectOpenHashMap<>();
        for (int g = 0; g < graph.numStates; g++) {
            classes.make(g);
            IntArrayList members = classOf(byColor, colors[g]);
            if (!members.isEmpty()) {
                classes.union(members.getInt(0), g);
            }
            members.add(g);
        }

        List<OptionalLong> hashes = new ArrayList<>(grammar.numRules());
        List<Optional<Int2IntMap>> newIds = new ArrayList<>(grammar.numRules());
        for (Rule rule : grammar.getRules()) {
            Int2IntMap canonicalIds = canonicalNumbering(graph, rule.id(), colors, classes);
            hashes.add(OptionalLong.of(ruleHash(graph, rule.id(), colors, canonicalIds)));
            newIds.add(Optional.of(canonicalIds));
        }
        logger.fine(String.format("Canonicalized %d rules over %d states into %d classes",
                grammar.numRules(), graph.numStates, byColor.size()));
        return grammar.withCanonicalization(hashes, newIds);
    }

    // ========================================================================
    // COLOR REFINEMENT
    // ========================================================================

    private long[] refine(JointGraph graph) {
        int n = graph.numStates;
        Partition partition = new Partition(n);

        ArenaList<Integer> frontier = new ArenaList<>(n);
        int[] handles = new int[n];
        for (int g = 0; g < n; g++) {
            partition.assign(g, initialColor(graph, g));
            handles[g] = frontier.pushBack(g);
        }

        int cap = n + 1;
        int rounds = 0;
        while (!frontier.isEmpty()) {
            if (++rounds > cap) {
                throw new CanonicalizationInvariantViolation(rounds - 1, String.format(
                        "Color refinement did not stabilize within %d rounds over %d states", cap, n));
            }

            // Recompute signatures of the frontier, grouped by class, and drain it.
            Long2ObjectLinkedOpenHashMap<IntArrayList> touched = new Long2ObjectLinkedOpenHashMap<>();
            for (int h = frontier.begin(); h != frontier.end(); ) {
                int g = frontier.get(h);
                partition.signatures[g] = signature(graph, g, partition.colors);
                handles[g] = 0;
                classOf(touched, partition.colors[g]).add(g);
                h = frontier.erase(h);
            }

            IntArrayList recolored = new IntArrayList();
            for (Long2ObjectMap.Entry<IntArrayList> entry : touched.long2ObjectEntrySet()) {
                partition.split(entry.getLongKey(), entry.getValue(), recolored);
            }

            for (int i = 0; i < recolored.size(); i++) {
                IntList predecessors = graph.predecessors.row(recolored.getInt(i));
                for (int j = 0; j < predecessors.size(); j++) {
                    int p = predecessors.getInt(j);
                    if (handles[p] == 0) {
                        handles[p] = frontier.pushBack(p);
                    } else {
                        frontier.moveBack(handles[p]);
                    }
                }
            }
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Refinement round %d: %d states recolored, %d classes",
                        rounds, recolored.size(), partition.classCount()));
            }
        }
        return partition.colors;
    }

    private static IntArrayList classOf(Long2ObjectMap<IntArrayList> classes, long color) {
        IntArrayList members = classes.get(color);
        if (members == null) {
            members = new IntArrayList();
            classes.put(color, members);
        }
        return members;
    }

    private static long initialColor(JointGraph graph, int g) {
        int rule = graph.ruleOf[g];
        Fsm fsm = graph.fsms[rule];
        int local = g - graph.offsets[rule];
        long[] kinds = new long[fsm.edgeCount(local)];
        for (int i = 0; i < kinds.length; i++) {
            kinds[i] = kindOf(fsm.edge(local, i));
        }
        long h = combine(SEED, fsm.start() == local ? 1 : 0);
        h = combine(h, fsm.isAccepting(local) ? 1 : 0);
        return combineSorted(h, kinds);
    }

    private static long signature(JointGraph graph, int g, long[] colors) {
        int rule = graph.ruleOf[g];
        Fsm fsm = graph.fsms[rule];
        int local = g - graph.offsets[rule];
        long[] edges = new long[fsm.edgeCount(local)];
        for (int i = 0; i < edges.length; i++) {
            edges[i] = edgeLabel(graph, fsm.edge(local, i), colors, graph.offsets[rule]);
        }
        return combineSorted(SEED, edges);
    }

    /**
     * Hash of an edge's label together with the current color of where it leads.
     */
    private static long edgeLabel(JointGraph graph, FsmEdge edge, long[] colors, int offset) {
        long h = combine(SEED, kindOf(edge));
        if (edge.isCharRange()) {
            h = combine(combine(h, edge.min()), edge.max());
        } else if (edge.isRuleRef()) {
            h = combine(h, colors[graph.startOf(edge.refRuleId())]);
        }
        return combine(h, colors[offset + edge.target()]);
    }

    private static int kindOf(FsmEdge edge) {
        return edge.isEpsilon() ? KIND_EPSILON : edge.isRuleRef() ? KIND_RULE_REF : KIND_CHAR_RANGE;
    }

    // ========================================================================
    // CANONICAL NUMBERING AND HASHING
    // ========================================================================

    /**
     * Numbers the equivalence classes of one rule: breadth-first from the start class with
     * edges taken in label order, then any unreachable classes by color.
     */
    private static Int2IntMap canonicalNumbering(JointGraph graph, int rule, long[] colors,
                                                 UnionFind<Integer> classes) {
        Fsm fsm = graph.fsms[rule];
        int offset = graph.offsets[rule];
        Int2IntOpenHashMap classId = new Int2IntOpenHashMap();
        classId.defaultReturnValue(-1);

        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        classId.put((int) classes.find(offset + fsm.start()), 0);
        queue.enqueue(fsm.start());
        while (!queue.isEmpty()) {
            int local = queue.dequeueInt();
            for (FsmEdge edge : sortedEdges(graph, fsm, local, offset, colors)) {
                int target = classes.find(offset + edge.target());
                if (classId.get(target) < 0) {
                    classId.put(target, classId.size());
                    queue.enqueue(edge.target());
                }
            }
        }

        List<Integer> unreachable = new ArrayList<>();
        for (int s = 0; s < fsm.numStates(); s++) {
            int root = classes.find(offset + s);
            if (classId.get(root) < 0 && !unreachable.contains(root)) {
                unreachable.add(root);
            }
        }
        unreachable.sort((a, b) -> Long.compare(colors[a], colors[b]));
        for (int root : unreachable) {
            classId.put(root, classId.size());
        }

        Int2IntOpenHashMap newIds = new Int2IntOpenHashMap(fsm.numStates());
        for (int s = 0; s < fsm.numStates(); s++) {
            newIds.put(s, classId.get((int) classes.find(offset + s)));
        }
        return newIds;
    }

    private static List<FsmEdge> sortedEdges(JointGraph graph, Fsm fsm, int local, int offset, long[] colors) {
        List<FsmEdge> edges = new ArrayList<>(fsm.edges(local));
        edges.sort((a, b) -> {
            int c = Integer.compare(kindOf(a), kindOf(b));
            if (c == 0) c = Integer.compare(a.min(), b.min());
            if (c == 0 && a.isCharRange()) c = Integer.compare(a.max(), b.max());
            if (c == 0 && a.isRuleRef()) {
                c = Long.compare(colors[graph.startOf(a.refRuleId())], colors[graph.startOf(b.refRuleId())]);
            }
            if (c == 0) c = Long.compare(colors[offset + a.target()], colors[offset + b.target()]);
            return c;
        });
        return edges;
    }

    private static long ruleHash(JointGraph graph, int rule, long[] colors, Int2IntMap canonicalIds) {
        Fsm fsm = graph.fsms[rule];
        int offset = graph.offsets[rule];
        int classCount = 0;
        for (int id : canonicalIds.values()) {
            classCount = Math.max(classCount, id + 1);
        }
        long[] classColors = new long[classCount];
        LongArrayList edgeTuples = new LongArrayList();
        for (int s = 0; s < fsm.numStates(); s++) {
            int from = canonicalIds.get(s);
            classColors[from] = colors[offset + s];
            for (FsmEdge edge : fsm.edges(s)) {
                long h = combine(combine(SEED, from), kindOf(edge));
                if (edge.isCharRange()) {
                    h = combine(combine(h, edge.min()), edge.max());
                } else if (edge.isRuleRef()) {
                    h = combine(h, colors[graph.startOf(edge.refRuleId())]);
                }
                edgeTuples.add(combine(h, canonicalIds.get(edge.target())));
            }
        }
        long[] tuples = edgeTuples.toLongArray();
        Arrays.sort(tuples);
        // Equivalent states contribute identical tuples; count each once.
        long h = combine(SEED, colors[offset + fsm.start()]);
        h = combine(h, classCount);
        for (long c : classColors) {
            h = combine(h, c);
        }
        long previous = 0;
        for (int i = 0; i < tuples.length; i++) {
            if (i == 0 || tuples[i] != previous) {
                h = combine(h, tuples[i]);
            }
            previous = tuples[i];
        }
        return h;
    }

    // ========================================================================
    // HASH MIXING
    // ========================================================================

    static long combine(long seed, long value) {
        return mix(seed ^ (value + 0x9E3779B97F4A7C15L + (seed << 6) + (seed >>> 2)));
    }

    private static long combineSorted(long seed, long[] values) {
        Arrays.sort(values);
        long h = combine(seed, values.length);
        for (long v : values) {
            h = combine(h, v);
        }
        return h;
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 33)) * 0xFF51AFD7ED558CCDL;
        z = (z ^ (z >>> 33)) * 0xC4CEB9FE1A85EC53L;
        return z ^ (z >>> 33);
    }

    // ========================================================================
    // PARTITION
    // ========================================================================

    /**
     * Color classes under refinement.
     *
     * <p>Members of a class that are off the frontier all share the class signature, so a
     * split looks at the frontier members only. The largest signature group keeps the class
     * color (ties go to the smaller signature) and only the other groups are recolored, so a
     * state moves to a new class only when it lands in at most half of its old one.
     */
    private static final class Partition {
        final long[] colors;
        final long[] signatures;
        private final int[] positions;
        private final Long2ObjectOpenHashMap<IntArrayList> members = new Long2ObjectOpenHashMap<>();
        private final Long2LongOpenHashMap classSignatures = new Long2LongOpenHashMap();
        private final Long2IntOpenHashMap generations = new Long2IntOpenHashMap();

        Partition(int numStates) {
            colors = new long[numStates];
            signatures = new long[numStates];
            positions = new int[numStates];
        }

        int classCount() {
            return members.size();
        }

        void assign(int g, long color) {
            colors[g] = color;
            IntArrayList list = classOf(members, color);
            positions[g] = list.size();
            list.add(g);
        }

        private void detach(int g) {
            IntArrayList list = members.get(colors[g]);
            int last = list.popInt();
            if (last != g) {
                list.set(positions[g], last);
                positions[last] = positions[g];
            }
        }

        /**
         * Splits class {@code color} by the fresh signatures of its frontier members, adding
         * every state that changes color to {@code recolored}.
         */
        void split(long color, IntArrayList frontierMembers, IntArrayList recolored) {
            IntArrayList all = members.get(color);
            int rest = all.size() - frontierMembers.size();
            long restSignature = rest > 0 ? classSignatures.get(color) : 0L;

            Long2IntOpenHashMap counts = new Long2IntOpenHashMap();
            for (int i = 0; i < frontierMembers.size(); i++) {
                counts.addTo(signatures[frontierMembers.getInt(i)], 1);
            }
            if (rest > 0) {
                counts.addTo(restSignature, rest);
            }
            long kept = 0L;
            int keptCount = -1;
            for (Long2IntMap.Entry group : counts.long2IntEntrySet()) {
                int count = group.getIntValue();
                long sig = group.getLongKey();
                if (count > keptCount || (count == keptCount && sig < kept)) {
                    kept = sig;
                    keptCount = count;
                }
            }
            classSignatures.put(color, kept);
            if (counts.size() == 1) {
                return;
            }

            int generation = generations.addTo(color, 1);
            // Off-frontier members only have to move when their group is not the kept one.
            IntArrayList candidates = rest > 0 && restSignature != kept ? new IntArrayList(all) : frontierMembers;
            for (int i = 0; i < candidates.size(); i++) {
                int g = candidates.getInt(i);
                long sig = signatures[g];
                if (sig == kept) {
                    continue;
                }
                long target = combine(combine(color, generation), sig);
                detach(g);
                assign(g, target);
                classSignatures.put(target, sig);
                recolored.add(g);
            }
        }
    }

    // ========================================================================
    // JOINT STATE GRAPH
    // ========================================================================

    /**
     * All rule FSMs laid out in one global state space: state {@code s} of rule {@code r}
     * is {@code offsets[r] + s}. Predecessors include the callers of a rule's start state.
     */
    private static final class JointGraph {
        final Fsm[] fsms;
        final int[] offsets;
        final int[] ruleOf;
        final int numStates;
        final CsrArray predecessors;

        JointGraph(Grammar grammar) {
            int rules = grammar.numRules();
            fsms = new Fsm[rules];
            offsets = new int[rules];
            int total = 0;
            for (int r = 0; r < rules; r++) {
                fsms[r] = grammar.getRule(r).fsm();
                offsets[r] = total;
                total += fsms[r].numStates();
            }
            numStates = total;
            ruleOf = new int[total];
            for (int r = 0; r < rules; r++) {
                Arrays.fill(ruleOf, offsets[r], offsets[r] + fsms[r].numStates(), r);
            }

            List<IntOpenHashSet> incoming = new ArrayList<>(total);
            for (int g = 0; g < total; g++) {
                incoming.add(new IntOpenHashSet());
            }
            for (int r = 0; r < rules; r++) {
                for (int s = 0; s < fsms[r].numStates(); s++) {
                    int from = offsets[r] + s;
                    for (FsmEdge edge : fsms[r].edges(s)) {
                        if (edge.isRuleRef()) {
                            int callee = edge.refRuleId();
                            incoming.get(offsets[callee] + fsms[callee].start()).add(from);
                        }
                        incoming.get(offsets[r] + edge.target()).add(from);
                    }
                }
            }
            predecessors = new CsrArray();
            for (IntOpenHashSet row : incoming) {
                predecessors.insert(new IntArrayList(row));
            }
        }

        int startOf(int rule) {
            return offsets[rule] + fsms[rule].start();
        }
    }
}
