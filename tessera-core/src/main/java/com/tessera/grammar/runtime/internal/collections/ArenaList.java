/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.internal.collections;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Doubly linked list over a pool of nodes addressed by small integer handles.
 *
 * <p>Nodes form a circular list anchored at handle {@code 0}, a permanent sentinel that is
 * never handed out. Erased handles go to a free list and are reused by later
 * {@link #pushBack} calls, so the pool only grows to the peak number of live elements.
 *
 * <p>Typical scan with pruning:
 * <pre>
 * for (int h = list.begin(); h != list.end(); ) {
 *     if (done(list.get(h))) {
 *         h = list.erase(h);
 *     } else {
 *         h = list.next(h);
 *     }
 * }
 * </pre>
 *
 * Handles from two different lists must not be compared or mixed. Not thread-safe.
 */
public final class ArenaList<V> implements Iterable<V> {

    private static final int SENTINEL = 0;

    private final IntArrayList prev;
    private final IntArrayList next;
    private final ObjectArrayList<V> values;
    private final IntArrayList freeHandles = new IntArrayList();
    private final BitSet live = new BitSet();
    private int size;

    public ArenaList() {
        this(16);
    }

    public ArenaList(int reserved) {
        this.prev = new IntArrayList(reserved + 1);
        this.next = new IntArrayList(reserved + 1);
        this.values = new ObjectArrayList<>(reserved + 1);
        initSentinel();
    }

    /**
     * Appends {@code value} and returns its handle.
     */
    public int pushBack(V value) {
        int handle;
        if (freeHandles.isEmpty()) {
            handle = values.size();
            prev.add(SENTINEL);
            next.add(SENTINEL);
            values.add(value);
        } else {
            handle = freeHandles.popInt();
            values.set(handle, value);
        }
        live.set(handle);
        insertBefore(handle, SENTINEL);
        size++;
        return handle;
    }

    /**
     * Moves a live element to the tail without reallocating its node.
     */
    public void moveBack(int handle) {
        checkLive(handle);
        unlink(handle);
        insertBefore(handle, SENTINEL);
    }

    /**
     * Removes a live element and recycles its handle.
     *
     * @return the handle that followed the erased element, or {@link #end()}
     */
    public int erase(int handle) {
        checkLive(handle);
        int following = next.getInt(handle);
        unlink(handle);
        values.set(handle, null);
        live.clear(handle);
        freeHandles.push(handle);
        size--;
        return following;
    }

    public void clear() {
        prev.clear();
        next.clear();
        values.clear();
        freeHandles.clear();
        live.clear();
        size = 0;
        initSentinel();
    }

    public int begin() {
        return next.getInt(SENTINEL);
    }

    public int end() {
        return SENTINEL;
    }

    public int next(int handle) {
        checkLive(handle);
        return next.getInt(handle);
    }

    public V get(int handle) {
        checkLive(handle);
        return values.get(handle);
    }

    public void set(int handle, V value) {
        checkLive(handle);
        values.set(handle, value);
    }

    public boolean isLive(int handle) {
        return handle != SENTINEL && live.get(handle);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Number of node slots ever allocated, sentinel included.
     */
    public int poolSize() {
        return values.size();
    }

    @Override
    public Iterator<V> iterator() {
        return new Iterator<>() {
            private int cursor = begin();

            @Override
            public boolean hasNext() {
                return cursor != SENTINEL;
            }

            @Override
            public V next() {
                if (cursor == SENTINEL) {
                    throw new NoSuchElementException();
                }
                V value = values.get(cursor);
                cursor = ArenaList.this.next.getInt(cursor);
                return value;
            }
        };
    }

    private void initSentinel() {
        prev.add(SENTINEL);
        next.add(SENTINEL);
        values.add(null);
    }

    private void insertBefore(int handle, int successor) {
        int predecessor = prev.getInt(successor);
        prev.set(handle, predecessor);
        next.set(handle, successor);
        next.set(predecessor, handle);
        prev.set(successor, handle);
    }

    private void unlink(int handle) {
        int predecessor = prev.getInt(handle);
        int successor = next.getInt(handle);
        next.set(predecessor, successor);
        prev.set(successor, predecessor);
    }

    private void checkLive(int handle) {
        if (!isLive(handle)) {
            throw new IllegalArgumentException("Handle " + handle + " is not a live element");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int h = begin(); h != SENTINEL; h = next.getInt(h)) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(h).append('=').append(values.get(h));
        }
        return sb.append(']').toString();
    }
}
