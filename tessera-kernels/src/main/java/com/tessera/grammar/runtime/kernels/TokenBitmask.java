/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.kernels;

import java.nio.IntBuffer;
import java.util.Arrays;

/**
 * Packed per-sequence token masks: {@code ceil(V / 32)} 32-bit words per row, bit {@code t % 32}
 * of word {@code t / 32} set when token {@code t} is allowed.
 *
 * <p>Not thread-safe; each decoding step usually owns its mask.
 */
public final class TokenBitmask {

    public static final int BITS_PER_WORD = 32;

    private final int[] words;
    private final int batchSize;
    private final int vocabSize;
    private final int wordsPerRow;

    private TokenBitmask(int batchSize, int vocabSize) {
        if (batchSize <= 0 || vocabSize <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Batch size and vocabulary size must be positive, got %d and %d", batchSize, vocabSize));
        }
        this.batchSize = batchSize;
        this.vocabSize = vocabSize;
        this.wordsPerRow = bitmaskSize(vocabSize);
        this.words = new int[Math.multiplyExact(batchSize, wordsPerRow)];
    }

    /**
     * Number of 32-bit words per row for a vocabulary of {@code vocabSize} tokens.
     */
    public static int bitmaskSize(int vocabSize) {
        if (vocabSize < 0) {
            throw new IllegalArgumentException("Vocabulary size must be non-negative: " + vocabSize);
        }
        return (vocabSize + BITS_PER_WORD - 1) / BITS_PER_WORD;
    }

    /**
     * Allocates a mask with every token of every row allowed.
     */
    public static TokenBitmask allocate(int batchSize, int vocabSize) {
        TokenBitmask mask = new TokenBitmask(batchSize, vocabSize);
        mask.reset();
        return mask;
    }

    /**
     * Allows every token again, in every row.
     */
    public void reset() {
        Arrays.fill(words, -1);
    }

    public void setAllowed(int row, int token, boolean allowed) {
        int index = wordIndex(row, token);
        int bit = 1 << (token % BITS_PER_WORD);
        words[index] = allowed ? words[index] | bit : words[index] & ~bit;
    }

    public boolean isAllowed(int row, int token) {
        return (words[wordIndex(row, token)] & (1 << (token % BITS_PER_WORD))) != 0;
    }

    /**
     * Clears {@code row} and allows exactly the given tokens.
     */
    public void allowOnly(int row, int... tokens) {
        rejectAll(row);
        for (int token : tokens) {
            setAllowed(row, token, true);
        }
    }

    public void rejectAll(int row) {
        checkRow(row);
        Arrays.fill(words, row * wordsPerRow, (row + 1) * wordsPerRow, 0);
    }

    /**
     * Number of allowed tokens in {@code row}; bits beyond the vocabulary are not counted.
     */
    public int allowedCount(int row) {
        checkRow(row);
        int count = 0;
        for (int w = 0; w < wordsPerRow; w++) {
            count += Integer.bitCount(words[row * wordsPerRow + w] & validMask(w));
        }
        return count;
    }

    /**
     * Read-only view of one row's words.
     */
    public IntBuffer row(int row) {
        checkRow(row);
        return IntBuffer.wrap(words, row * wordsPerRow, wordsPerRow).slice().asReadOnlyBuffer();
    }

    /**
     * The whole mask as a buffer over the backing words, as consumed by
     * {@link TokenBitmaskKernel}.
     */
    public IntBuffer buffer() {
        return IntBuffer.wrap(words);
    }

    public int batchSize() {
        return batchSize;
    }

    public int vocabSize() {
        return vocabSize;
    }

    public int wordsPerRow() {
        return wordsPerRow;
    }

    /**
     * Bits of word {@code w} that correspond to tokens inside the vocabulary.
     */
    int validMask(int w) {
        return validMask(w, vocabSize);
    }

    static int validMask(int w, int vocabSize) {
        int remaining = vocabSize - w * BITS_PER_WORD;
        return remaining >= BITS_PER_WORD ? -1 : (1 << remaining) - 1;
    }

    private int wordIndex(int row, int token) {
        checkRow(row);
        if (token < 0 || token >= vocabSize) {
            throw new IndexOutOfBoundsException(String.format("Token %d outside vocabulary of %d", token, vocabSize));
        }
        return row * wordsPerRow + token / BITS_PER_WORD;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= batchSize) {
            throw new IndexOutOfBoundsException(String.format("Row %d outside batch of %d", row, batchSize));
        }
    }
}
