/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Thrown when a character range is inverted ({@code min > max}), when a code point
 * lies outside the Unicode range, or when an edge's sentinel pair does not describe
 * one of the three legal edge kinds.
 */
public class InvalidRangeException extends GrammarException {

    private final int min;
    private final int max;

    public InvalidRangeException(int min, int max) {
        this(min, max, String.format("Invalid character range: min (%d) > max (%d)", min, max));
    }

    public InvalidRangeException(int min, int max, String message) {
        super(message);
        this.min = min;
        this.max = max;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }
}
