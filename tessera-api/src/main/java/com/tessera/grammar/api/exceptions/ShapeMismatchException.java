/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Thrown at the boundary of the bitmask kernels when the bitmask, the logits buffer,
 * the batch size and the vocabulary size do not agree.
 */
public class ShapeMismatchException extends GrammarException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
