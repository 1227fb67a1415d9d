/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Base class of every error raised by grammar compilation, serialization and
 * the bitmask kernels.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the codebase, while still providing clear error messages.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
