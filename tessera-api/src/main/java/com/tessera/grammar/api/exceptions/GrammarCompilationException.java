/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Thrown when a compilation stage fails for a reason that is not already described
 * by a more specific {@link GrammarException}.
 */
public class GrammarCompilationException extends GrammarException {

    private final String stage;

    public GrammarCompilationException(String stage, String message) {
        super(String.format("[%s] %s", stage, message));
        this.stage = stage;
    }

    public GrammarCompilationException(String stage, String message, Throwable cause) {
        super(String.format("[%s] %s", stage, message), cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
