/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.kernels;

import com.tessera.grammar.api.exceptions.ShapeMismatchException;
import com.tessera.grammar.infra.config.TesseraConfig;

import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.util.function.IntConsumer;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Applies packed token bitmasks to logits in place.
 *
 * <p>For every processed row, each logit whose bit is clear is overwritten with the exact
 * negative-infinity bit pattern of the element type. Logits whose bit is set are never
 * written, so their bytes (NaN payloads included) stay untouched. Bits beyond the vocabulary
 * in the last word of a row are ignored.
 *
 * <p>Shapes are validated once per call, before any element is touched. The inner loop
 * walks the set bits of {@code ~word} only, so fully allowed words cost one comparison.
 * Rows are independent and are processed in parallel when the call covers at least
 * {@code parallelThreshold} logits.
 */
public final class TokenBitmaskKernel {

    private static final Logger logger = Logger.getLogger(TokenBitmaskKernel.class.getName());

    private static final TokenBitmaskKernel DEFAULT = new TokenBitmaskKernel(TesseraConfig.defaults());

    private final long parallelThreshold;

    public TokenBitmaskKernel(TesseraConfig config) {
        this(config.getKernelParallelThreshold());
    }

    /**
     * @param parallelThreshold minimum number of logits in one call for rows to be processed
     *                          in parallel
     */
    public TokenBitmaskKernel(long parallelThreshold) {
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException("Parallel threshold must be positive: " + parallelThreshold);
        }
        this.parallelThreshold = parallelThreshold;
        logger.fine(String.format("TokenBitmaskKernel created with parallel threshold %d", parallelThreshold));
    }

    // ========================================================================
    // STATIC ENTRY POINTS
    // ========================================================================

    /**
     * Masks a raw logits buffer of shape {@code [batchSize, vocabSize]} whose elements are
     * encoded as {@code dtype} in the buffer's byte order, starting at its position.
     *
     * @param bitmask   {@code batchSize * ceil(vocabSize / 32)} words starting at its position
     * @param indices   rows to process, or null for every row
     * @throws ShapeMismatchException if the buffers do not match the shape or an index is out of range
     */
    public static void applyTokenBitmaskInplace(IntBuffer bitmask, ByteBuffer logits, DType dtype,
                                                int batchSize, int vocabSize, int[] indices) {
        DEFAULT.apply(bitmask, logits, dtype, batchSize, vocabSize, indices);
    }

    public static void applyTokenBitmaskInplace(int[] bitmask, float[] logits,
                                                int batchSize, int vocabSize, int[] indices) {
        DEFAULT.apply(bitmask, logits, batchSize, vocabSize, indices);
    }

    public static void applyTokenBitmaskInplace(int[] bitmask, double[] logits,
                                                int batchSize, int vocabSize, int[] indices) {
        DEFAULT.apply(bitmask, logits, batchSize, vocabSize, indices);
    }

    /**
     * @param logits IEEE-754 binary16 bit patterns
     */
    public static void applyTokenBitmaskInplace(int[] bitmask, short[] logits,
                                                int batchSize, int vocabSize, int[] indices) {
        DEFAULT.apply(bitmask, logits, batchSize, vocabSize, indices);
    }

    // ========================================================================
    // INSTANCE API
    // ========================================================================

    public void apply(IntBuffer bitmask, ByteBuffer logits, DType dtype,
                      int batchSize, int vocabSize, int[] indices) {
        if (dtype == null) {
            throw new ShapeMismatchException("Logits dtype must be given explicitly");
        }
        int[] rows = validate(bitmask.remaining(), (long) logits.remaining() / dtype.byteSize(),
                batchSize, vocabSize, indices);
        if ((long) logits.remaining() % dtype.byteSize() != 0) {
            throw new ShapeMismatchException(String.format(
                    "Logits buffer of %d bytes is not a whole number of %s elements", logits.remaining(), dtype));
        }
        int maskBase = bitmask.position();
        int logitsBase = logits.position();
        int size = dtype.byteSize();

        run(rows, vocabSize, row -> {
            ByteBuffer out = logits.duplicate().order(logits.order());
            int rowBase = logitsBase + row * vocabSize * size;
            IntConsumer deny = switch (dtype) {
                case FLOAT16 -> token -> out.putShort(rowBase + token * 2, DType.FLOAT16_NEGATIVE_INFINITY);
                case FLOAT32 -> token -> out.putInt(rowBase + token * 4, DType.FLOAT32_NEGATIVE_INFINITY);
                case FLOAT64 -> token -> out.putLong(rowBase + token * 8, DType.FLOAT64_NEGATIVE_INFINITY);
            };
            maskRow(bitmask, maskBase + row * TokenBitmask.bitmaskSize(vocabSize), vocabSize, deny);
        });
    }

    public void apply(int[] bitmask, float[] logits, int batchSize, int vocabSize, int[] indices) {
        int[] rows = validate(bitmask.length, logits.length, batchSize, vocabSize, indices);
        IntBuffer mask = IntBuffer.wrap(bitmask);
        float negativeInfinity = Float.intBitsToFloat(DType.FLOAT32_NEGATIVE_INFINITY);
        run(rows, vocabSize, row -> {
            int rowBase = row * vocabSize;
            maskRow(mask, row * TokenBitmask.bitmaskSize(vocabSize), vocabSize,
                    token -> logits[rowBase + token] = negativeInfinity);
        });
    }

    public void apply(int[] bitmask, double[] logits, int batchSize, int vocabSize, int[] indices) {
        int[] rows = validate(bitmask.length, logits.length, batchSize, vocabSize, indices);
        IntBuffer mask = IntBuffer.wrap(bitmask);
        double negativeInfinity = Double.longBitsToDouble(DType.FLOAT64_NEGATIVE_INFINITY);
        run(rows, vocabSize, row -> {
            int rowBase = row * vocabSize;
            maskRow(mask, row * TokenBitmask.bitmaskSize(vocabSize), vocabSize,
                    token -> logits[rowBase + token] = negativeInfinity);
        });
    }

    public void apply(int[] bitmask, short[] logits, int batchSize, int vocabSize, int[] indices) {
        int[] rows = validate(bitmask.length, logits.length, batchSize, vocabSize, indices);
        IntBuffer mask = IntBuffer.wrap(bitmask);
        run(rows, vocabSize, row -> {
            int rowBase = row * vocabSize;
            maskRow(mask, row * TokenBitmask.bitmaskSize(vocabSize), vocabSize,
                    token -> logits[rowBase + token] = DType.FLOAT16_NEGATIVE_INFINITY);
        });
    }

    public long getParallelThreshold() {
        return parallelThreshold;
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private static void maskRow(IntBuffer bitmask, int offset, int vocabSize, IntConsumer deny) {
        int words = TokenBitmask.bitmaskSize(vocabSize);
        for (int w = 0; w < words; w++) {
            int word = bitmask.get(offset + w);
            if (word == -1) {
                continue;
            }
            int denied = ~word & TokenBitmask.validMask(w, vocabSize);
            int base = w * TokenBitmask.BITS_PER_WORD;
            while (denied != 0) {
                deny.accept(base + Integer.numberOfTrailingZeros(denied));
                denied &= denied - 1;
            }
        }
    }

    private void run(int[] rows, int vocabSize, IntConsumer rowTask) {
        if (rows.length > 1 && (long) rows.length * vocabSize >= parallelThreshold) {
            IntStream.of(rows).parallel().forEach(rowTask);
        } else {
            for (int row : rows) {
                rowTask.accept(row);
            }
        }
    }

    /**
     * @return the rows to process
     */
    private static int[] validate(long maskWords, long logitCount, int batchSize, int vocabSize, int[] indices) {
        if (batchSize <= 0 || vocabSize <= 0) {
            throw new ShapeMismatchException(String.format(
                    "Batch size and vocabulary size must be positive, got %d and %d", batchSize, vocabSize));
        }
        long expectedWords = (long) batchSize * TokenBitmask.bitmaskSize(vocabSize);
        if (maskWords != expectedWords) {
            throw new ShapeMismatchException(String.format(
                    "Bitmask has %d words, expected %d for batch %d and vocabulary %d",
                    maskWords, expectedWords, batchSize, vocabSize));
        }
        long expectedLogits = (long) batchSize * vocabSize;
        if (logitCount != expectedLogits) {
            throw new ShapeMismatchException(String.format(
                    "Logits have %d elements, expected %d for batch %d and vocabulary %d",
                    logitCount, expectedLogits, batchSize, vocabSize));
        }
        if (indices == null) {
            return IntStream.range(0, batchSize).toArray();
        }
        for (int index : indices) {
            if (index < 0 || index >= batchSize) {
                throw new ShapeMismatchException(String.format(
                        "Batch index %d outside [0, %d)", index, batchSize));
            }
        }
        return indices.clone();
    }
}
