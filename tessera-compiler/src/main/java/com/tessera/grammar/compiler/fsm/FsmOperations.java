/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.compiler.fsm;

import com.tessera.grammar.runtime.model.Fsm;
import com.tessera.grammar.runtime.model.FsmEdge;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural FSM constructions over immutable {@link Fsm} values.
 *
 * <p>Every operator returns a new FSM and leaves its inputs untouched. The constructions
 * introduce epsilon edges freely; {@link #simplifyEpsilon(Fsm)} and
 * {@link #mergeEquivalentStates(Fsm)} remove them again. All operations are deterministic:
 * equal inputs give identical outputs, state numbering included.
 */
public final class FsmOperations {

    private static final Comparator<FsmEdge> EDGE_ORDER = Comparator
            .comparingInt((FsmEdge e) -> e.isEpsilon() ? 0 : e.isRuleRef() ? 1 : 2)
            .thenComparingInt(FsmEdge::target)
            .thenComparingInt(FsmEdge::min)
            .thenComparingInt(FsmEdge::max);

    private FsmOperations() {
        throw new AssertionError("No instances");
    }

    // ========================================================================
    // ATOMS
    // ========================================================================

    /**
     * Matches only the empty string.
     */
    public static Fsm emptyString() {
        Fsm.Builder b = Fsm.builder();
        int s = b.addState();
        return b.setStart(s).addAccepting(s).build();
    }

    /**
     * Matches nothing at all.
     */
    public static Fsm nothing() {
        Fsm.Builder b = Fsm.builder();
        return b.setStart(b.addState()).build();
    }

    /**
     * Matches one code point out of the given inclusive {@code [min, max]} ranges.
     */
    public static Fsm codePointRanges(List<int[]> ranges) {
        if (ranges.isEmpty()) {
            return nothing();
        }
        Fsm.Builder b = Fsm.builder();
        int start = b.addState();
        int end = b.addState();
        for (int[] range : ranges) {
            b.addCharRange(start, range[0], range[1], end);
        }
        return b.setStart(start).addAccepting(end).build();
    }

    public static Fsm literal(int[] codePoints) {
        Fsm.Builder b = Fsm.builder();
        int current = b.addState();
        b.setStart(current);
        for (int cp : codePoints) {
            int next = b.addState();
            b.addCharRange(current, cp, cp, next);
            current = next;
        }
        return b.addAccepting(current).build();
    }

    /**
     * A single rule-reference edge from the start state to the accepting state.
     */
    public static Fsm ruleRef(int ruleId) {
        Fsm.Builder b = Fsm.builder();
        int start = b.addState();
        int end = b.addState();
        return b.addRuleRef(start, ruleId, end).setStart(start).addAccepting(end).build();
    }

    // ========================================================================
    // COMBINATORS
    // ========================================================================

    /**
     * Alternation: a fresh start state with an epsilon edge into every operand.
     */
    public static Fsm union(List<Fsm> operands) {
        if (operands.isEmpty()) {
            return nothing();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        Fsm.Builder b = Fsm.builder();
        int start = b.addState();
        b.setStart(start);
        for (Fsm operand : operands) {
            int offset = copyInto(b, operand, true);
            b.addEpsilon(start, offset + operand.start());
        }
        return b.build();
    }

    /**
     * Sequencing: epsilon edges from the accepting states of each operand to the start of
     * the next one.
     */
    public static Fsm concatenate(List<Fsm> operands) {
        if (operands.isEmpty()) {
            return emptyString();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        Fsm.Builder b = Fsm.builder();
        int[] offsets = new int[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            offsets[i] = copyInto(b, operands.get(i), i == operands.size() - 1);
        }
        b.setStart(offsets[0] + operands.get(0).start());
        for (int i = 0; i + 1 < operands.size(); i++) {
            int nextStart = offsets[i + 1] + operands.get(i + 1).start();
            for (int accepting : operands.get(i).acceptingStates()) {
                b.addEpsilon(offsets[i] + accepting, nextStart);
            }
        }
        return b.build();
    }

    /**
     * One or more repetitions: epsilon edges from every accepting state back to the start.
     */
    public static Fsm plus(Fsm body) {
        Fsm.Builder b = body.toBuilder();
        for (int accepting : body.acceptingStates()) {
            b.addEpsilon(accepting, body.start());
        }
        return b.build();
    }

    /**
     * Zero or one occurrence: a fresh accepting start state with an epsilon edge into the body.
     */
    public static Fsm optional(Fsm body) {
        Fsm.Builder b = Fsm.builder();
        int start = b.addState();
        int offset = copyInto(b, body, true);
        b.addEpsilon(start, offset + body.start());
        return b.setStart(start).addAccepting(start).build();
    }

    public static Fsm star(Fsm body) {
        return optional(plus(body));
    }

    /**
     * Between {@code min} and {@code max} repetitions; {@code max < 0} means unbounded.
     */
    public static Fsm repeat(Fsm body, int min, int max) {
        List<Fsm> parts = new ArrayList<>();
        for (int i = 0; i < min; i++) {
            parts.add(body);
        }
        if (max < 0) {
            parts.add(star(body));
        } else if (max > min) {
            // nested optionals: (body (body (...)?)?)?
            Fsm tail = optional(body);
            for (int i = min + 1; i < max; i++) {
                tail = optional(concatenate(List.of(body, tail)));
            }
            parts.add(tail);
        }
        return concatenate(parts);
    }

    // ========================================================================
    // SIMPLIFICATION
    // ========================================================================

    /**
     * Removes every epsilon edge. Each state receives the non-epsilon edges of its epsilon
     * closure and becomes accepting if its closure holds an accepting state. States no
     * longer reachable from the start are dropped and the rest renumbered in BFS order.
     */
    public static Fsm simplifyEpsilon(Fsm fsm) {
        List<List<FsmEdge>> edges = new ArrayList<>(fsm.numStates());
        boolean[] accepting = new boolean[fsm.numStates()];
        for (int s = 0; s < fsm.numStates(); s++) {
            IntSet closure = fsm.epsilonClosure(IntArrayList.wrap(new int[]{s}));
            int[] members = closure.toIntArray();
            Arrays.sort(members);
            List<FsmEdge> stateEdges = new ArrayList<>();
            for (int member : members) {
                accepting[s] |= fsm.isAccepting(member);
                for (FsmEdge e : fsm.edges(member)) {
                    if (!e.isEpsilon()) {
                        stateEdges.add(e);
                    }
                }
            }
            edges.add(normalizeEdges(stateEdges));
        }
        return renumberReachable(fsm.start(), edges, accepting);
    }

    /**
     * Merges states that are accepting alike and carry identical outgoing edges, repeating
     * until no two states qualify. Input must be epsilon-free for the result to be minimal
     * in this sense; epsilon edges are carried along unchanged otherwise.
     */
    public static Fsm mergeEquivalentStates(Fsm fsm) {
        int n = fsm.numStates();
        List<List<FsmEdge>> edges = new ArrayList<>(n);
        boolean[] accepting = new boolean[n];
        for (int s = 0; s < n; s++) {
            edges.add(normalizeEdges(fsm.edges(s)));
            accepting[s] = fsm.isAccepting(s);
        }
        int[] representative = new int[n];
        for (int s = 0; s < n; s++) {
            representative[s] = s;
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            Map<List<Object>, Integer> firstWithSignature = new HashMap<>();
            for (int s = 0; s < n; s++) {
                if (representative[s] != s) {
                    continue;
                }
                List<Object> signature = List.of(accepting[s], edges.get(s));
                Integer existing = firstWithSignature.putIfAbsent(signature, s);
                if (existing != null) {
                    representative[s] = existing;
                    changed = true;
                }
            }
            if (changed) {
                for (int s = 0; s < n; s++) {
                    if (representative[s] != s) {
                        continue;
                    }
                    List<FsmEdge> redirected = new ArrayList<>(edges.get(s).size());
                    for (FsmEdge e : edges.get(s)) {
                        redirected.add(e.withTarget(resolve(representative, e.target())));
                    }
                    edges.set(s, normalizeEdges(redirected));
                }
            }
        }
        return renumberReachable(resolve(representative, fsm.start()), edges, accepting);
    }

    /**
     * Epsilon elimination followed by equivalent-state merging.
     */
    public static Fsm simplify(Fsm fsm) {
        return mergeEquivalentStates(simplifyEpsilon(fsm));
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static int resolve(int[] representative, int state) {
        while (representative[state] != state) {
            state = representative[state];
        }
        return state;
    }

    /**
     * Copies all states and edges of {@code source} into {@code target}.
     *
     * @return the id offset of the copied states
     */
    private static int copyInto(Fsm.Builder target, Fsm source, boolean keepAccepting) {
        int offset = target.numStates();
        for (int s = 0; s < source.numStates(); s++) {
            target.addState();
        }
        for (int s = 0; s < source.numStates(); s++) {
            final int from = offset + s;
            source.forEachEdge(s, (min, max, to) -> target.addEdge(from, new FsmEdge(min, max, offset + to)));
        }
        if (keepAccepting) {
            for (int accepting : source.acceptingStates()) {
                target.addAccepting(offset + accepting);
            }
        }
        return offset;
    }

    /**
     * Sorts edges, drops duplicates, and coalesces overlapping or adjacent character ranges
     * leading to the same target.
     */
    static List<FsmEdge> normalizeEdges(List<FsmEdge> edges) {
        List<FsmEdge> sorted = new ArrayList<>(edges);
        sorted.sort(EDGE_ORDER);
        List<FsmEdge> result = new ArrayList<>(sorted.size());
        for (FsmEdge e : sorted) {
            if (!result.isEmpty()) {
                FsmEdge last = result.get(result.size() - 1);
                if (last.equals(e)) {
                    continue;
                }
                if (last.isCharRange() && e.isCharRange() && last.target() == e.target()
                        && (long) e.min() <= (long) last.max() + 1) {
                    result.set(result.size() - 1,
                            FsmEdge.charRange(last.min(), Math.max(last.max(), e.max()), e.target()));
                    continue;
                }
            }
            result.add(e);
        }
        return result;
    }

    /**
     * Keeps the states reachable from {@code start}, numbered in BFS order with edges visited
     * in their normalized order.
     */
    private static Fsm renumberReachable(int start, List<List<FsmEdge>> edges, boolean[] accepting) {
        int[] newId = new int[edges.size()];
        Arrays.fill(newId, -1);
        IntArrayList order = new IntArrayList();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        newId[start] = 0;
        order.add(start);
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int s = queue.dequeueInt();
            for (FsmEdge e : edges.get(s)) {
                if (newId[e.target()] < 0) {
                    newId[e.target()] = order.size();
                    order.add(e.target());
                    queue.enqueue(e.target());
                }
            }
        }

        Fsm.Builder b = Fsm.builder();
        for (int i = 0; i < order.size(); i++) {
            b.addState();
        }
        for (IntIterator it = order.iterator(); it.hasNext(); ) {
            int old = it.nextInt();
            int from = newId[old];
            List<FsmEdge> renamed = new ArrayList<>(edges.get(old).size());
            for (FsmEdge e : edges.get(old)) {
                renamed.add(e.withTarget(newId[e.target()]));
            }
            for (FsmEdge e : normalizeEdges(renamed)) {
                b.addEdge(from, e);
            }
            if (accepting[old]) {
                b.addAccepting(from);
            }
        }
        return b.setStart(0).build();
    }
}
