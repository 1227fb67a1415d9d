/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable finite state machine over code points with rule-reference edges.
 *
 * <p>States are dense ids {@code 0..numStates-1}. Outgoing edges are stored per state in a
 * {@link CsrArray} whose rows hold flattened {@code (min, max, target)} triples, so walking
 * an FSM never allocates edge objects unless {@link #edges(int)} is used.
 *
 * <p>Instances are built through {@link Builder}; transformations produce new instances.
 */
public final class Fsm {

    private static final int EDGE_WIDTH = 3;

    private final int numStates;
    private final int start;
    private final RoaringBitmap accepting;
    private final CsrArray edgeTable;

    private Fsm(int numStates, int start, RoaringBitmap accepting, CsrArray edgeTable) {
        this.numStates = numStates;
        this.start = start;
        this.accepting = accepting;
        this.edgeTable = edgeTable;
    }

    /**
     * Primitive edge callback used by {@link #forEachEdge(int, EdgeVisitor)}.
     */
    @FunctionalInterface
    public interface EdgeVisitor {
        void visit(int min, int max, int target);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reassembles an FSM from its compact form.
     *
     * @param start     start state
     * @param accepting accepting states
     * @param edgeTable one row per state, each a run of {@code (min, max, target)} triples
     * @throws IllegalArgumentException if the parts do not describe a well-formed FSM
     * @throws com.tessera.grammar.api.exceptions.InvalidRangeException if an edge label is malformed
     */
    public static Fsm fromCompact(int start, RoaringBitmap accepting, CsrArray edgeTable) {
        Objects.requireNonNull(accepting, "accepting");
        Objects.requireNonNull(edgeTable, "edgeTable");
        int states = edgeTable.rowCount();
        if (states == 0) {
            throw new IllegalArgumentException("An FSM needs at least one state");
        }
        if (start < 0 || start >= states) {
            throw new IllegalArgumentException("Start state " + start + " out of range [0, " + states + ")");
        }
        for (int s : accepting.toArray()) {
            if (s < 0 || s >= states) {
                throw new IllegalArgumentException("Accepting state " + s + " out of range [0, " + states + ")");
            }
        }
        for (int s = 0; s < states; s++) {
            if (edgeTable.rowSize(s) % EDGE_WIDTH != 0) {
                throw new IllegalArgumentException("Edge row of state " + s + " is not a run of triples");
            }
            for (int i = edgeTable.rowStart(s); i < edgeTable.rowEnd(s); i += EDGE_WIDTH) {
                FsmEdge edge = new FsmEdge(edgeTable.at(i), edgeTable.at(i + 1), edgeTable.at(i + 2));
                if (edge.target() >= states) {
                    throw new IllegalArgumentException(
                            "Edge " + edge + " of state " + s + " targets a state out of range");
                }
            }
        }
        return new Fsm(states, start, accepting.clone(), edgeTable.copy());
    }

    public int numStates() {
        return numStates;
    }

    public int start() {
        return start;
    }

    public boolean isAccepting(int state) {
        return accepting.contains(state);
    }

    public int[] acceptingStates() {
        return accepting.toArray();
    }

    /**
     * @return a copy of the accepting set
     */
    public RoaringBitmap acceptingBitmap() {
        return accepting.clone();
    }

    public int edgeCount(int state) {
        return edgeTable.rowSize(state) / EDGE_WIDTH;
    }

    public int totalEdges() {
        return edgeTable.totalSize() / EDGE_WIDTH;
    }

    public FsmEdge edge(int state, int index) {
        int base = edgeTable.rowStart(state) + index * EDGE_WIDTH;
        if (index < 0 || base >= edgeTable.rowEnd(state)) {
            throw new IndexOutOfBoundsException("Edge " + index + " of state " + state);
        }
        return new FsmEdge(edgeTable.at(base), edgeTable.at(base + 1), edgeTable.at(base + 2));
    }

    public List<FsmEdge> edges(int state) {
        List<FsmEdge> result = new ArrayList<>(edgeCount(state));
        forEachEdge(state, (min, max, target) -> result.add(new FsmEdge(min, max, target)));
        return Collections.unmodifiableList(result);
    }

    public void forEachEdge(int state, EdgeVisitor visitor) {
        int end = edgeTable.rowEnd(state);
        for (int i = edgeTable.rowStart(state); i < end; i += EDGE_WIDTH) {
            visitor.visit(edgeTable.at(i), edgeTable.at(i + 1), edgeTable.at(i + 2));
        }
    }

    /**
     * @return a copy of the per-state edge rows
     */
    public CsrArray edgeTable() {
        return edgeTable.copy();
    }

    public boolean hasRuleRefs() {
        for (int i = 0; i < edgeTable.totalSize(); i += EDGE_WIDTH) {
            if (edgeTable.at(i) == FsmEdge.NO_CHAR && edgeTable.at(i + 1) != FsmEdge.NO_CHAR) {
                return true;
            }
        }
        return false;
    }

    public IntSet epsilonClosure(IntCollection states) {
        IntOpenHashSet closure = new IntOpenHashSet(states);
        IntArrayList stack = new IntArrayList(states);
        while (!stack.isEmpty()) {
            int s = stack.popInt();
            int end = edgeTable.rowEnd(s);
            for (int i = edgeTable.rowStart(s); i < end; i += EDGE_WIDTH) {
                if (edgeTable.at(i) == FsmEdge.NO_CHAR && edgeTable.at(i + 1) == FsmEdge.NO_CHAR) {
                    int target = edgeTable.at(i + 2);
                    if (closure.add(target)) {
                        stack.push(target);
                    }
                }
            }
        }
        return closure;
    }

    /**
     * Follows every character edge of {@code states} that covers {@code codePoint} and returns
     * the epsilon closure of the targets. The input set is expected to be closed already.
     */
    public IntSet advance(IntSet states, int codePoint) {
        IntOpenHashSet next = new IntOpenHashSet();
        for (IntIterator it = states.iterator(); it.hasNext(); ) {
            int s = it.nextInt();
            int end = edgeTable.rowEnd(s);
            for (int i = edgeTable.rowStart(s); i < end; i += EDGE_WIDTH) {
                int min = edgeTable.at(i);
                if (min >= 0 && min <= codePoint && codePoint <= edgeTable.at(i + 1)) {
                    next.add(edgeTable.at(i + 2));
                }
            }
        }
        return epsilonClosure(next);
    }

    /**
     * Follows every edge referencing {@code ruleId}, i.e. the continuation after the callee
     * has been matched, and returns the epsilon closure of the targets.
     */
    public IntSet advanceRule(IntSet states, int ruleId) {
        IntOpenHashSet next = new IntOpenHashSet();
        for (IntIterator it = states.iterator(); it.hasNext(); ) {
            int s = it.nextInt();
            int end = edgeTable.rowEnd(s);
            for (int i = edgeTable.rowStart(s); i < end; i += EDGE_WIDTH) {
                if (edgeTable.at(i) == FsmEdge.NO_CHAR && edgeTable.at(i + 1) == ruleId) {
                    next.add(edgeTable.at(i + 2));
                }
            }
        }
        return epsilonClosure(next);
    }

    /**
     * Runs the FSM on {@code input} using character edges only; rule-reference edges are not
     * expanded.
     */
    public boolean accepts(String input) {
        IntSet current = epsilonClosure(IntArrayList.wrap(new int[]{start}));
        int offset = 0;
        while (offset < input.length() && !current.isEmpty()) {
            int cp = input.codePointAt(offset);
            current = advance(current, cp);
            offset += Character.charCount(cp);
        }
        if (offset < input.length()) {
            return false;
        }
        for (IntIterator it = current.iterator(); it.hasNext(); ) {
            if (accepting.contains(it.nextInt())) {
                return true;
            }
        }
        return false;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        for (int s = 0; s < numStates; s++) {
            builder.addState();
        }
        for (int s = 0; s < numStates; s++) {
            final int from = s;
            forEachEdge(s, (min, max, target) -> builder.addEdge(from, new FsmEdge(min, max, target)));
        }
        builder.setStart(start);
        accepting.forEach((int s) -> builder.addAccepting(s));
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fsm)) return false;
        Fsm other = (Fsm) o;
        return numStates == other.numStates && start == other.start
                && accepting.equals(other.accepting) && edgeTable.equals(other.edgeTable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numStates, start, accepting, edgeTable);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("FSM(states=").append(numStates)
                .append(", start=").append(start)
                .append(", accepting=").append(accepting)
                .append(", edges=[");
        for (int s = 0; s < numStates; s++) {
            if (s > 0) sb.append(", ");
            sb.append(s).append(": ").append(edges(s));
        }
        return sb.append("])").toString();
    }

    /**
     * Mutable FSM under construction. States are added one by one and edges may be added in
     * any order; {@link #build()} freezes the result into CSR form.
     */
    public static final class Builder {
        private final ObjectArrayList<ObjectArrayList<FsmEdge>> edges = new ObjectArrayList<>();
        private final RoaringBitmap accepting = new RoaringBitmap();
        private int start = -1;

        private Builder() {
        }

        public int addState() {
            edges.add(new ObjectArrayList<>());
            return edges.size() - 1;
        }

        public int numStates() {
            return edges.size();
        }

        public Builder addEdge(int from, FsmEdge edge) {
            checkState(from);
            checkState(edge.target());
            edges.get(from).add(edge);
            return this;
        }

        public Builder addEpsilon(int from, int to) {
            return addEdge(from, FsmEdge.epsilon(to));
        }

        public Builder addCharRange(int from, int min, int max, int to) {
            return addEdge(from, FsmEdge.charRange(min, max, to));
        }

        public Builder addRuleRef(int from, int ruleId, int to) {
            return addEdge(from, FsmEdge.ruleRef(ruleId, to));
        }

        public List<FsmEdge> edges(int state) {
            checkState(state);
            return Collections.unmodifiableList(edges.get(state));
        }

        public Builder setStart(int state) {
            checkState(state);
            this.start = state;
            return this;
        }

        public int start() {
            return start;
        }

        public Builder addAccepting(int state) {
            checkState(state);
            accepting.add(state);
            return this;
        }

        public boolean isAccepting(int state) {
            return accepting.contains(state);
        }

        public Fsm build() {
            if (edges.isEmpty()) {
                throw new IllegalStateException("An FSM needs at least one state");
            }
            if (start < 0) {
                throw new IllegalStateException("Start state not set");
            }
            CsrArray table = new CsrArray();
            IntArrayList row = new IntArrayList();
            for (ObjectArrayList<FsmEdge> stateEdges : edges) {
                row.clear();
                for (FsmEdge e : stateEdges) {
                    row.add(e.min());
                    row.add(e.max());
                    row.add(e.target());
                }
                table.insert(row);
            }
            return new Fsm(edges.size(), start, accepting.clone(), table);
        }

        private void checkState(int state) {
            if (state < 0 || state >= edges.size()) {
                throw new IndexOutOfBoundsException("State " + state + " out of range [0, " + edges.size() + ")");
            }
        }
    }
}
