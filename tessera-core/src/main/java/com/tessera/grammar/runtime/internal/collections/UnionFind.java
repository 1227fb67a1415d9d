/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.internal.collections;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;

/**
 * Disjoint-set forest over arbitrary hashable keys.
 *
 * <p>Path compression is iterative (an explicit queue collects the chain, then every node
 * on it is pointed at the root), so long chains never grow the call stack. Unions attach
 * the lower-ranked root below the higher-ranked one. Not thread-safe.
 */
public final class UnionFind<K> {

    private final Map<K, K> parent = new HashMap<>();
    private final Map<K, Integer> rank = new HashMap<>();

    /**
     * Adds {@code key} as a singleton set.
     *
     * @return false, with no change, if the key is already present
     */
    public boolean make(K key) {
        if (parent.containsKey(key)) {
            return false;
        }
        parent.put(key, key);
        rank.put(key, 0);
        return true;
    }

    /**
     * Merges the sets of {@code a} and {@code b}.
     *
     * @return true if two sets were merged, false if both keys already shared a root
     * @throws IllegalArgumentException if either key was never made
     */
    public boolean union(K a, K b) {
        K rootA = find(a);
        K rootB = find(b);
        if (rootA.equals(rootB)) {
            return false;
        }
        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
        } else if (rankA > rankB) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootB, rootA);
            rank.put(rootA, rankA + 1);
        }
        return true;
    }

    /**
     * Returns the representative of the set containing {@code key}, compressing the path.
     *
     * @throws IllegalArgumentException if the key was never made
     */
    public K find(K key) {
        K current = parent.get(key);
        if (current == null) {
            throw new IllegalArgumentException("Unknown key: " + key);
        }
        ArrayDeque<K> chain = new ArrayDeque<>();
        K node = key;
        while (!current.equals(node)) {
            chain.add(node);
            node = current;
            current = parent.get(node);
        }
        while (!chain.isEmpty()) {
            parent.put(chain.poll(), node);
        }
        return node;
    }

    public boolean sameSet(K a, K b) {
        return find(a).equals(find(b));
    }

    public boolean contains(K key) {
        return parent.containsKey(key);
    }

    public int size() {
        return parent.size();
    }
}
