/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.kernels;

/**
 * Element precision of a logits buffer. Always passed explicitly; never inferred from the
 * buffer.
 */
public enum DType {
    FLOAT16(2),
    FLOAT32(4),
    FLOAT64(8);

    /** IEEE-754 binary16 negative infinity. */
    public static final short FLOAT16_NEGATIVE_INFINITY = (short) 0xFC00;
    /** IEEE-754 binary32 negative infinity. */
    public static final int FLOAT32_NEGATIVE_INFINITY = 0xFF800000;
    /** IEEE-754 binary64 negative infinity. */
    public static final long FLOAT64_NEGATIVE_INFINITY = 0xFFF0000000000000L;

    private final int byteSize;

    DType(int byteSize) {
        this.byteSize = byteSize;
    }

    public int byteSize() {
        return byteSize;
    }
}
