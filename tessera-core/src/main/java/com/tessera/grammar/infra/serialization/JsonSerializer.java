/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;

import java.io.UncheckedIOException;

/**
 * Text form of codec output.
 */
public final class JsonSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.INDENT_OUTPUT);

    private JsonSerializer() {
        throw new AssertionError("No instances");
    }

    public static String toJson(JsonNode node, boolean prettify) {
        try {
            return prettify
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write JSON tree", e);
        }
    }

    /**
     * @throws MalformedPayloadException if {@code text} is not a single JSON document
     */
    public static JsonNode parse(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new MalformedPayloadException("$", "empty document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("$", "not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> String serialize(JsonCodec<T> codec, T value) {
        return toJson(codec.serialize(value), false);
    }

    public static <T> T deserialize(JsonCodec<T> codec, String text) {
        return codec.deserialize(parse(text));
    }
}
