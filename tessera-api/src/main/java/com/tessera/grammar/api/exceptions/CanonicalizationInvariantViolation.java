/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Signals that color refinement did not reach a fixed point within its iteration cap.
 * This is an internal bug signal and never the result of user input.
 */
public class CanonicalizationInvariantViolation extends GrammarException {

    private final int iterations;

    public CanonicalizationInvariantViolation(int iterations, String message) {
        super(message);
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
