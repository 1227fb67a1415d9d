/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api.exceptions;

/**
 * Thrown when a JSON document does not have the shape the target type expects.
 * The path points at the offending node, e.g. {@code $.rules[2].fsm.start}.
 */
public class MalformedPayloadException extends GrammarException {

    private final String path;
    private final String detail;

    public MalformedPayloadException(String path, String detail) {
        super(String.format("Malformed payload at %s: %s", path, detail));
        this.path = path;
        this.detail = detail;
    }

    public MalformedPayloadException(String path, String detail, Throwable cause) {
        super(String.format("Malformed payload at %s: %s", path, detail), cause);
        this.path = path;
        this.detail = detail;
    }

    public String getPath() {
        return path;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Re-anchors a failure raised by a nested codec below the given parent segment.
     */
    public MalformedPayloadException under(String parentSegment) {
        String nested = path.startsWith("$") ? path.substring(1) : path;
        MalformedPayloadException anchored =
                new MalformedPayloadException("$" + parentSegment + nested, detail, getCause());
        anchored.setStackTrace(getStackTrace());
        return anchored;
    }
}
