/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Arrays;

/**
 * Compressed sparse row storage of integer rows.
 *
 * <p>All rows live back to back in one flat {@code data} buffer; {@code indptr} holds the
 * row boundaries ({@code rows + 1} entries, starting at 0, non-decreasing, last entry equal
 * to {@code data.size()}). Row {@code i} spans {@code data[indptr[i] .. indptr[i + 1])}.
 *
 * <p>Rows can only be appended. Instances that are handed out by immutable owners are
 * copies.
 */
public final class CsrArray {

    private final IntArrayList data;
    private final IntArrayList indptr;

    public CsrArray() {
        this.data = new IntArrayList();
        this.indptr = new IntArrayList();
        this.indptr.add(0);
    }

    private CsrArray(IntArrayList data, IntArrayList indptr) {
        this.data = data;
        this.indptr = indptr;
    }

    /**
     * Rebuilds an array from its two flat buffers in bulk.
     *
     * @throws IllegalArgumentException if {@code indptr} violates the CSR invariants
     */
    public static CsrArray of(IntList data, IntList indptr) {
        if (indptr.isEmpty() || indptr.getInt(0) != 0) {
            throw new IllegalArgumentException("indptr must start with 0");
        }
        for (int i = 1; i < indptr.size(); i++) {
            if (indptr.getInt(i) < indptr.getInt(i - 1)) {
                throw new IllegalArgumentException("indptr must be non-decreasing at index " + i);
            }
        }
        if (indptr.getInt(indptr.size() - 1) != data.size()) {
            throw new IllegalArgumentException(String.format(
                    "indptr ends at %d but data holds %d elements", indptr.getInt(indptr.size() - 1), data.size()));
        }
        return new CsrArray(new IntArrayList(data), new IntArrayList(indptr));
    }

    /**
     * Appends a row and returns its index.
     */
    public int insert(int... row) {
        data.addElements(data.size(), row);
        indptr.add(data.size());
        return indptr.size() - 2;
    }

    public int insert(IntList row) {
        data.addAll(row);
        indptr.add(data.size());
        return indptr.size() - 2;
    }

    public int rowCount() {
        return indptr.size() - 1;
    }

    public int rowStart(int row) {
        return indptr.getInt(row);
    }

    public int rowEnd(int row) {
        return indptr.getInt(row + 1);
    }

    public int rowSize(int row) {
        checkRow(row);
        return indptr.getInt(row + 1) - indptr.getInt(row);
    }

    public int get(int row, int column) {
        checkRow(row);
        int index = indptr.getInt(row) + column;
        if (column < 0 || index >= indptr.getInt(row + 1)) {
            throw new IndexOutOfBoundsException(String.format("Column %d out of row %d of size %d",
                    column, row, rowSize(row)));
        }
        return data.getInt(index);
    }

    /**
     * Raw element access by flat index, for owners iterating {@link #rowStart}..{@link #rowEnd}.
     */
    public int at(int flatIndex) {
        return data.getInt(flatIndex);
    }

    public IntList row(int row) {
        checkRow(row);
        return IntLists.unmodifiable(data.subList(indptr.getInt(row), indptr.getInt(row + 1)));
    }

    public IntList data() {
        return IntLists.unmodifiable(data);
    }

    public IntList indptr() {
        return IntLists.unmodifiable(indptr);
    }

    public int totalSize() {
        return data.size();
    }

    public CsrArray copy() {
        return new CsrArray(new IntArrayList(data), new IntArrayList(indptr));
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rowCount()) {
            throw new IndexOutOfBoundsException("Row " + row + " out of " + rowCount());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CsrArray)) return false;
        CsrArray other = (CsrArray) o;
        return data.equals(other.data) && indptr.equals(other.indptr);
    }

    @Override
    public int hashCode() {
        return 31 * data.hashCode() + indptr.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CsrArray[");
        for (int r = 0; r < rowCount(); r++) {
            if (r > 0) sb.append(", ");
            sb.append(Arrays.toString(row(r).toIntArray()));
        }
        return sb.append(']').toString();
    }
}
