/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;

import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Codec for an aggregate type whose fields are declared once as a static descriptor list.
 *
 * <p>The aggregate is written as a JSON object keyed by field name, in declaration order.
 * Unknown members are ignored on read; a missing member decodes like {@code null}, which
 * only optional fields accept.
 *
 * <pre>{@code
 * static final Field<Point, Integer> X = ObjectCodec.field("x", Point::x, JsonCodecs.INT);
 * static final Field<Point, Integer> Y = ObjectCodec.field("y", Point::y, JsonCodecs.INT);
 * static final ObjectCodec<Point> POINT =
 *         ObjectCodec.immutable("Point", List.of(X, Y), v -> new Point(v.get(X), v.get(Y)));
 * }</pre>
 *
 * <p>Mutable aggregates declare setters and are decoded into an existing instance with
 * {@link #deserializeInto(Object, JsonNode)}. Every field is decoded before the first
 * setter runs, so a malformed payload leaves the target untouched.
 */
public final class ObjectCodec<T> implements JsonCodec<T> {

    private final String typeName;
    private final List<Field<T, ?>> fields;
    private final Function<Values, T> factory;
    private final Supplier<T> supplier;

    private ObjectCodec(String typeName, List<Field<T, ?>> fields, Function<Values, T> factory, Supplier<T> supplier) {
        this.typeName = typeName;
        this.fields = List.copyOf(fields);
        this.factory = factory;
        this.supplier = supplier;

        Set<String> names = new LinkedHashSet<>();
        for (Field<T, ?> field : this.fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in " + typeName);
            }
        }
    }

    /**
     * Describes one field of {@code T}.
     */
    public static final class Field<T, F> {
        private final String name;
        private final Function<T, F> getter;
        private final BiConsumer<T, F> setter;
        private final JsonCodec<F> codec;

        private Field(String name, Function<T, F> getter, BiConsumer<T, F> setter, JsonCodec<F> codec) {
            this.name = Objects.requireNonNull(name, "name");
            this.getter = Objects.requireNonNull(getter, "getter");
            this.setter = setter;
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        public String name() {
            return name;
        }

        JsonNode encode(T owner) {
            return codec.serialize(getter.apply(owner));
        }

        F decode(JsonNode json) {
            return JsonCodecs.decode(json, codec, "." + name);
        }
    }

    public static <T, F> Field<T, F> field(String name, Function<T, F> getter, JsonCodec<F> codec) {
        return new Field<>(name, getter, null, codec);
    }

    public static <T, F> Field<T, F> field(String name, Function<T, F> getter, BiConsumer<T, F> setter,
                                           JsonCodec<F> codec) {
        return new Field<>(name, getter, Objects.requireNonNull(setter, "setter"), codec);
    }

    /**
     * Codec for a type built from its decoded field values.
     */
    public static <T> ObjectCodec<T> immutable(String typeName, List<Field<T, ?>> fields, Function<Values, T> factory) {
        return new ObjectCodec<>(typeName, fields, Objects.requireNonNull(factory, "factory"), null);
    }

    /**
     * Codec for a type populated through setters; every field must declare one.
     */
    public static <T> ObjectCodec<T> mutable(String typeName, List<Field<T, ?>> fields, Supplier<T> supplier) {
        for (Field<T, ?> field : fields) {
            if (field.setter == null) {
                throw new IllegalArgumentException("Field '" + field.name + "' of " + typeName + " has no setter");
            }
        }
        return new ObjectCodec<>(typeName, fields, null, Objects.requireNonNull(supplier, "supplier"));
    }

    /**
     * Decoded field values, looked up by descriptor.
     */
    public static final class Values {
        private final Map<Field<?, ?>, Object> decoded = new IdentityHashMap<>();

        @SuppressWarnings("unchecked")
        public <F> F get(Field<?, F> field) {
            if (!decoded.containsKey(field)) {
                throw new IllegalArgumentException("Field '" + field.name() + "' was not decoded");
            }
            return (F) decoded.get(field);
        }
    }

    @Override
    public JsonNode serialize(T value) {
        ObjectNode object = JsonCodecs.NODES.objectNode();
        for (Field<T, ?> field : fields) {
            object.set(field.name(), field.encode(value));
        }
        return object;
    }

    @Override
    public T deserialize(JsonNode json) {
        if (supplier != null) {
            T target = supplier.get();
            deserializeInto(target, json);
            return target;
        }
        Values values = decodeAll(json);
        try {
            return factory.apply(values);
        } catch (MalformedPayloadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedPayloadException("$",
                    String.format("invalid %s: %s", typeName, e.getMessage()), e);
        }
    }

    /**
     * Decodes {@code json} into an existing mutable instance. On failure the target keeps its
     * previous state.
     *
     * @throws UnsupportedOperationException for codecs of immutable types
     */
    @SuppressWarnings("unchecked")
    public void deserializeInto(T target, JsonNode json) {
        if (supplier == null) {
            throw new UnsupportedOperationException(typeName + " is immutable; use deserialize");
        }
        Values values = decodeAll(json);
        for (Field<T, ?> field : fields) {
            ((BiConsumer<T, Object>) field.setter).accept(target, values.decoded.get(field));
        }
    }

    private Values decodeAll(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw JsonCodecs.mismatch("a " + typeName + " object", json);
        }
        Values values = new Values();
        for (Field<T, ?> field : fields) {
            JsonNode member = json.get(field.name());
            values.decoded.put(field, field.decode(member == null ? MissingNode.getInstance() : member));
        }
        return values;
    }

    public String typeName() {
        return typeName;
    }

    public List<Field<T, ?>> fields() {
        return fields;
    }
}
