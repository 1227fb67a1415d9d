/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;

import java.util.function.Function;

/**
 * Two-way mapping between a Java type and a JSON tree.
 *
 * <p>Implementations satisfy {@code deserialize(serialize(x)).equals(x)} for every value
 * they accept. Decoding never returns a partially decoded value: it either returns a
 * complete value or throws.
 *
 * @param <T> the decoded type
 */
public interface JsonCodec<T> {

    JsonNode serialize(T value);

    /**
     * @throws MalformedPayloadException if the JSON shape does not match {@code T}; the
     *                                   exception path points at the offending node
     */
    T deserialize(JsonNode json);

    /**
     * Derives a codec for {@code R} through a lossless conversion to and from {@code T}.
     * Conversion failures surface as {@link MalformedPayloadException} at the current node.
     */
    default <R> JsonCodec<R> xmap(Function<R, T> to, Function<T, R> from) {
        JsonCodec<T> self = this;
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(R value) {
                return self.serialize(to.apply(value));
            }

            @Override
            public R deserialize(JsonNode json) {
                T decoded = self.deserialize(json);
                try {
                    return from.apply(decoded);
                } catch (MalformedPayloadException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new MalformedPayloadException("$", e.getMessage(), e);
                }
            }
        };
    }
}
