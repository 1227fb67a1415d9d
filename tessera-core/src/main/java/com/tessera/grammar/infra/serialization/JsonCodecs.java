/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;

/**
 * Codecs for scalars, optionals and containers, and combinators to derive codecs for
 * nested shapes.
 *
 * <p>Encoding rules:
 * <ul>
 *   <li>numbers and booleans map to JSON numbers and booleans, strings to JSON strings</li>
 *   <li>an absent optional is {@code null}, a present one is its inner encoding</li>
 *   <li>lists and sets are arrays; sets are written in a deterministic order</li>
 *   <li>maps keyed by {@link #STRING} are objects, any other map is an array of {@code [key, value]} pairs</li>
 * </ul>
 */
public final class JsonCodecs {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonCodecs() {
        throw new AssertionError("No instances");
    }

    // ========================================================================
    // SCALARS
    // ========================================================================

    public static final JsonCodec<Integer> INT = new JsonCodec<>() {
        @Override
        public JsonNode serialize(Integer value) {
            return NODES.numberNode(value.intValue());
        }

        @Override
        public Integer deserialize(JsonNode json) {
            if (json == null || !json.isIntegralNumber() || !json.canConvertToInt()) {
                throw mismatch("an int", json);
            }
            return json.intValue();
        }
    };

    public static final JsonCodec<Long> LONG = new JsonCodec<>() {
        @Override
        public JsonNode serialize(Long value) {
            return NODES.numberNode(value.longValue());
        }

        @Override
        public Long deserialize(JsonNode json) {
            if (json == null || !json.isIntegralNumber() || !json.canConvertToLong()) {
                throw mismatch("a long", json);
            }
            return json.longValue();
        }
    };

    public static final JsonCodec<Double> DOUBLE = new JsonCodec<>() {
        @Override
        public JsonNode serialize(Double value) {
            return NODES.numberNode(value.doubleValue());
        }

        @Override
        public Double deserialize(JsonNode json) {
            if (json == null || !json.isNumber()) {
                throw mismatch("a number", json);
            }
            return json.doubleValue();
        }
    };

    public static final JsonCodec<Boolean> BOOLEAN = new JsonCodec<>() {
        @Override
        public JsonNode serialize(Boolean value) {
            return NODES.booleanNode(value);
        }

        @Override
        public Boolean deserialize(JsonNode json) {
            if (json == null || !json.isBoolean()) {
                throw mismatch("a boolean", json);
            }
            return json.booleanValue();
        }
    };

    public static final JsonCodec<String> STRING = new JsonCodec<>() {
        @Override
        public JsonNode serialize(String value) {
            return NODES.textNode(value);
        }

        @Override
        public String deserialize(JsonNode json) {
            if (json == null || !json.isTextual()) {
                throw mismatch("a string", json);
            }
            return json.textValue();
        }
    };

    public static final JsonCodec<OptionalLong> OPTIONAL_LONG = new JsonCodec<>() {
        @Override
        public JsonNode serialize(OptionalLong value) {
            return value.isPresent() ? NODES.numberNode(value.getAsLong()) : NODES.nullNode();
        }

        @Override
        public OptionalLong deserialize(JsonNode json) {
            if (isAbsent(json)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(LONG.deserialize(json));
        }
    };

    // ========================================================================
    // PRIMITIVE COLLECTIONS
    // ========================================================================

    public static final JsonCodec<IntList> INT_LIST = new JsonCodec<>() {
        @Override
        public JsonNode serialize(IntList value) {
            ArrayNode array = NODES.arrayNode(value.size());
            for (int i = 0; i < value.size(); i++) {
                array.add(value.getInt(i));
            }
            return array;
        }

        @Override
        public IntList deserialize(JsonNode json) {
            requireArray(json);
            IntArrayList result = new IntArrayList(json.size());
            for (int i = 0; i < json.size(); i++) {
                result.add(element(json, i, INT));
            }
            return result;
        }
    };

    /**
     * Array of {@code [key, value]} pairs in ascending key order.
     */
    public static final JsonCodec<Int2IntMap> INT2INT_MAP = new JsonCodec<>() {
        @Override
        public JsonNode serialize(Int2IntMap value) {
            int[] keys = value.keySet().toIntArray();
            Arrays.sort(keys);
            ArrayNode array = NODES.arrayNode(keys.length);
            for (int key : keys) {
                array.addArray().add(key).add(value.get(key));
            }
            return array;
        }

        @Override
        public Int2IntMap deserialize(JsonNode json) {
            requireArray(json);
            Int2IntOpenHashMap result = new Int2IntOpenHashMap(json.size());
            for (int i = 0; i < json.size(); i++) {
                JsonNode pair = json.get(i);
                if (!pair.isArray() || pair.size() != 2) {
                    throw mismatch("a [key, value] pair", pair).under("[" + i + "]");
                }
                int key = element(pair, 0, INT, "[" + i + "]");
                int mapped = element(pair, 1, INT, "[" + i + "]");
                if (result.containsKey(key)) {
                    throw new MalformedPayloadException("$[" + i + "]", "duplicate key " + key);
                }
                result.put(key, mapped);
            }
            return result;
        }
    };

    /**
     * Ascending array of the set members.
     */
    public static final JsonCodec<RoaringBitmap> ROARING_BITMAP = new JsonCodec<>() {
        @Override
        public JsonNode serialize(RoaringBitmap value) {
            ArrayNode array = NODES.arrayNode(value.getCardinality());
            value.forEach((int v) -> array.add(v));
            return array;
        }

        @Override
        public RoaringBitmap deserialize(JsonNode json) {
            requireArray(json);
            RoaringBitmap result = new RoaringBitmap();
            for (int i = 0; i < json.size(); i++) {
                result.add(element(json, i, INT));
            }
            return result;
        }
    };

    // ========================================================================
    // COMBINATORS
    // ========================================================================

    public static <T> JsonCodec<Optional<T>> optional(JsonCodec<T> inner) {
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(Optional<T> value) {
                return value.map(inner::serialize).orElseGet(NODES::nullNode);
            }

            @Override
            public Optional<T> deserialize(JsonNode json) {
                if (isAbsent(json)) {
                    return Optional.empty();
                }
                return Optional.of(inner.deserialize(json));
            }
        };
    }

    public static <T> JsonCodec<List<T>> list(JsonCodec<T> element) {
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(List<T> value) {
                ArrayNode array = NODES.arrayNode(value.size());
                for (T item : value) {
                    array.add(element.serialize(item));
                }
                return array;
            }

            @Override
            public List<T> deserialize(JsonNode json) {
                requireArray(json);
                List<T> result = new ArrayList<>(json.size());
                for (int i = 0; i < json.size(); i++) {
                    result.add(element(json, i, element));
                }
                return Collections.unmodifiableList(result);
            }
        };
    }

    /**
     * Unordered container; members are written sorted by their JSON text so equal sets
     * always produce identical documents.
     */
    public static <T> JsonCodec<Set<T>> set(JsonCodec<T> element) {
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(Set<T> value) {
                List<JsonNode> encoded = new ArrayList<>(value.size());
                for (T item : value) {
                    encoded.add(element.serialize(item));
                }
                encoded.sort(Comparator.comparing(JsonNode::toString));
                ArrayNode array = NODES.arrayNode(encoded.size());
                array.addAll(encoded);
                return array;
            }

            @Override
            public Set<T> deserialize(JsonNode json) {
                requireArray(json);
                Set<T> result = new LinkedHashSet<>();
                for (int i = 0; i < json.size(); i++) {
                    if (!result.add(element(json, i, element))) {
                        throw new MalformedPayloadException("$[" + i + "]", "duplicate set member");
                    }
                }
                return Collections.unmodifiableSet(result);
            }
        };
    }

    /**
     * Associative container. With {@link #STRING} keys the map becomes a JSON object,
     * otherwise an array of {@code [key, value]} pairs; both are written in a deterministic
     * key order.
     */
    public static <K, V> JsonCodec<Map<K, V>> map(JsonCodec<K> keyCodec, JsonCodec<V> valueCodec) {
        boolean objectEncoding = keyCodec == STRING;
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(Map<K, V> value) {
                List<Map.Entry<JsonNode, V>> entries = new ArrayList<>(value.size());
                for (Map.Entry<K, V> e : value.entrySet()) {
                    entries.add(Map.entry(keyCodec.serialize(e.getKey()), e.getValue()));
                }
                entries.sort(Comparator.comparing(
                        e -> objectEncoding ? e.getKey().textValue() : e.getKey().toString()));
                if (objectEncoding) {
                    ObjectNode object = NODES.objectNode();
                    for (Map.Entry<JsonNode, V> e : entries) {
                        object.set(e.getKey().textValue(), valueCodec.serialize(e.getValue()));
                    }
                    return object;
                }
                ArrayNode array = NODES.arrayNode(entries.size());
                for (Map.Entry<JsonNode, V> e : entries) {
                    array.addArray().add(e.getKey()).add(valueCodec.serialize(e.getValue()));
                }
                return array;
            }

            @Override
            public Map<K, V> deserialize(JsonNode json) {
                Map<K, V> result = new LinkedHashMap<>();
                if (objectEncoding) {
                    if (json == null || !json.isObject()) {
                        throw mismatch("an object", json);
                    }
                    for (Iterator<Map.Entry<String, JsonNode>> it = json.fields(); it.hasNext(); ) {
                        Map.Entry<String, JsonNode> field = it.next();
                        result.put(keyCodec.deserialize(NODES.textNode(field.getKey())),
                                decode(field.getValue(), valueCodec, "." + field.getKey()));
                    }
                    return Collections.unmodifiableMap(result);
                }
                requireArray(json);
                for (int i = 0; i < json.size(); i++) {
                    JsonNode pair = json.get(i);
                    if (!pair.isArray() || pair.size() != 2) {
                        throw mismatch("a [key, value] pair", pair).under("[" + i + "]");
                    }
                    K key = element(pair, 0, keyCodec, "[" + i + "]");
                    if (result.containsKey(key)) {
                        throw new MalformedPayloadException("$[" + i + "]", "duplicate key " + key);
                    }
                    result.put(key, element(pair, 1, valueCodec, "[" + i + "]"));
                }
                return Collections.unmodifiableMap(result);
            }
        };
    }

    public static <E extends Enum<E>> JsonCodec<E> enumCodec(Class<E> type) {
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(E value) {
                return NODES.textNode(value.name());
            }

            @Override
            public E deserialize(JsonNode json) {
                String name = STRING.deserialize(json);
                try {
                    return Enum.valueOf(type, name);
                } catch (IllegalArgumentException e) {
                    throw new MalformedPayloadException("$",
                            String.format("unknown %s constant '%s'", type.getSimpleName(), name));
                }
            }
        };
    }

    /**
     * Array with a fixed number of elements decoded by position, e.g. tuples.
     */
    public static <T> JsonCodec<T> tuple(int arity, Function<T, JsonNode[]> encoder, Function<JsonNode, T> decoder) {
        return new JsonCodec<>() {
            @Override
            public JsonNode serialize(T value) {
                ArrayNode array = NODES.arrayNode(arity);
                for (JsonNode node : encoder.apply(value)) {
                    array.add(node);
                }
                return array;
            }

            @Override
            public T deserialize(JsonNode json) {
                requireArray(json);
                if (json.size() != arity) {
                    throw new MalformedPayloadException("$",
                            String.format("expected %d elements, got %d", arity, json.size()));
                }
                try {
                    return decoder.apply(json);
                } catch (MalformedPayloadException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new MalformedPayloadException("$", e.getMessage(), e);
                }
            }
        };
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    static boolean isAbsent(JsonNode json) {
        return json == null || json.isNull() || json.isMissingNode();
    }

    static void requireArray(JsonNode json) {
        if (json == null || !json.isArray()) {
            throw mismatch("an array", json);
        }
    }

    /**
     * Decodes a nested value, re-anchoring failures below {@code segment}.
     */
    static <T> T decode(JsonNode json, JsonCodec<T> codec, String segment) {
        try {
            return codec.deserialize(json);
        } catch (MalformedPayloadException e) {
            throw e.under(segment);
        }
    }

    static <T> T element(JsonNode array, int index, JsonCodec<T> codec) {
        return decode(array.get(index), codec, "[" + index + "]");
    }

    private static <T> T element(JsonNode array, int index, JsonCodec<T> codec, String parentSegment) {
        try {
            return element(array, index, codec);
        } catch (MalformedPayloadException e) {
            throw e.under(parentSegment);
        }
    }

    static MalformedPayloadException mismatch(String expected, JsonNode actual) {
        String found = actual == null || actual.isMissingNode() ? "nothing" : actual.getNodeType().name().toLowerCase();
        return new MalformedPayloadException("$", "expected " + expected + ", found " + found);
    }
}
