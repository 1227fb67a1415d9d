/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecsTest {

    private enum Mode { STRICT, LENIENT }

    private static String write(JsonNode node) {
        return JsonSerializer.toJson(node, false);
    }

    private static JsonNode json(String text) {
        return JsonSerializer.parse(text);
    }

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        @DisplayName("Should write scalars as native JSON values")
        void shouldWriteScalars() {
            assertThat(write(JsonCodecs.INT.serialize(42))).isEqualTo("42");
            assertThat(write(JsonCodecs.LONG.serialize(1L << 40))).isEqualTo("1099511627776");
            assertThat(write(JsonCodecs.BOOLEAN.serialize(true))).isEqualTo("true");
            assertThat(write(JsonCodecs.STRING.serialize("a\"b"))).isEqualTo("\"a\\\"b\"");
            assertThat(JsonCodecs.DOUBLE.deserialize(JsonCodecs.DOUBLE.serialize(0.5))).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should reject a string where an int is expected")
        void shouldRejectStringForInt() {
            assertThatThrownBy(() -> JsonCodecs.INT.deserialize(json("\"7\"")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("expected an int, found string");
        }

        @Test
        @DisplayName("Should reject fractional and out-of-range ints")
        void shouldRejectNonIntNumbers() {
            assertThatThrownBy(() -> JsonCodecs.INT.deserialize(json("1.5")))
                    .isInstanceOf(MalformedPayloadException.class);
            assertThatThrownBy(() -> JsonCodecs.INT.deserialize(json("4294967296")))
                    .isInstanceOf(MalformedPayloadException.class);
            assertThat(JsonCodecs.LONG.deserialize(json("4294967296"))).isEqualTo(4294967296L);
        }

        @Test
        @DisplayName("Should decode null as an absent optional")
        void shouldDecodeNullAsAbsent() {
            assertThat(JsonCodecs.OPTIONAL_LONG.deserialize(json("null"))).isEqualTo(OptionalLong.empty());
            assertThat(JsonCodecs.OPTIONAL_LONG.deserialize(json("-3"))).isEqualTo(OptionalLong.of(-3));
            assertThat(write(JsonCodecs.OPTIONAL_LONG.serialize(OptionalLong.empty()))).isEqualTo("null");

            JsonCodec<Optional<String>> codec = JsonCodecs.optional(JsonCodecs.STRING);
            assertThat(codec.deserialize(json("null"))).isEmpty();
            assertThat(codec.deserialize(json("\"x\""))).contains("x");
            assertThat(write(codec.serialize(Optional.empty()))).isEqualTo("null");
        }

        @Test
        @DisplayName("Should map enum constants by name")
        void shouldMapEnumsByName() {
            JsonCodec<Mode> codec = JsonCodecs.enumCodec(Mode.class);
            assertThat(write(codec.serialize(Mode.LENIENT))).isEqualTo("\"LENIENT\"");
            assertThat(codec.deserialize(json("\"STRICT\""))).isEqualTo(Mode.STRICT);
            assertThatThrownBy(() -> codec.deserialize(json("\"LOOSE\"")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("unknown Mode constant 'LOOSE'");
        }
    }

    @Nested
    @DisplayName("Containers")
    class Containers {

        @Test
        @DisplayName("Should round-trip empty and non-empty lists")
        void shouldHandleLists() {
            JsonCodec<List<String>> codec = JsonCodecs.list(JsonCodecs.STRING);
            assertThat(write(codec.serialize(List.of()))).isEqualTo("[]");
            assertThat(codec.deserialize(json("[]"))).isEmpty();
            assertThat(codec.deserialize(json("[\"b\",\"a\"]"))).containsExactly("b", "a");

            IntList ints = IntArrayList.wrap(new int[]{3, 1, 2});
            assertThat(write(JsonCodecs.INT_LIST.serialize(ints))).isEqualTo("[3,1,2]");
            assertThat(JsonCodecs.INT_LIST.deserialize(json("[3,1,2]")).toIntArray()).containsExactly(3, 1, 2);
        }

        @Test
        @DisplayName("Should write sets in a deterministic order and reject duplicates")
        void shouldHandleSets() {
            JsonCodec<Set<Integer>> codec = JsonCodecs.set(JsonCodecs.INT);
            assertThat(write(codec.serialize(Set.of(3, 1, 2)))).isEqualTo("[1,2,3]");
            assertThat(codec.deserialize(json("[2,1]"))).containsExactlyInAnyOrder(1, 2);
            assertThatThrownBy(() -> codec.deserialize(json("[1,2,1]")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .satisfies(e -> assertThat(((MalformedPayloadException) e).getPath()).isEqualTo("$[2]"));
        }

        @Test
        @DisplayName("Should encode string-keyed maps as objects sorted by key")
        void shouldEncodeStringKeyedMapsAsObjects() {
            Map<String, Integer> map = new LinkedHashMap<>();
            map.put("zeta", 1);
            map.put("alpha", 2);
            JsonCodec<Map<String, Integer>> codec = JsonCodecs.map(JsonCodecs.STRING, JsonCodecs.INT);

            assertThat(write(codec.serialize(map))).isEqualTo("{\"alpha\":2,\"zeta\":1}");
            assertThat(write(codec.serialize(Map.of()))).isEqualTo("{}");
            assertThat(codec.deserialize(json("{\"alpha\":2,\"zeta\":1}"))).isEqualTo(map);
        }

        @Test
        @DisplayName("Should encode other maps as arrays of pairs")
        void shouldEncodeOtherMapsAsPairs() {
            JsonCodec<Map<Integer, String>> codec = JsonCodecs.map(JsonCodecs.INT, JsonCodecs.STRING);
            assertThat(write(codec.serialize(Map.of(2, "b", 1, "a")))).isEqualTo("[[1,\"a\"],[2,\"b\"]]");
            assertThat(codec.deserialize(json("[[1,\"a\"],[2,\"b\"]]"))).containsEntry(1, "a").containsEntry(2, "b");
            assertThatThrownBy(() -> codec.deserialize(json("[[1,\"a\"],[1,\"b\"]]")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("duplicate key 1");
        }

        @Test
        @DisplayName("Should write int maps in ascending key order")
        void shouldWriteIntMapsSorted() {
            Int2IntMap map = new Int2IntOpenHashMap();
            map.put(5, 0);
            map.put(-1, 7);
            assertThat(write(JsonCodecs.INT2INT_MAP.serialize(map))).isEqualTo("[[-1,7],[5,0]]");
            assertThat(JsonCodecs.INT2INT_MAP.deserialize(json("[[-1,7],[5,0]]"))).isEqualTo(map);
        }

        @Test
        @DisplayName("Should reject a duplicate key in an int map")
        void shouldRejectDuplicateIntMapKey() {
            assertThatThrownBy(() -> JsonCodecs.INT2INT_MAP.deserialize(json("[[0,1],[0,2]]")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .satisfies(e -> assertThat(((MalformedPayloadException) e).getPath()).isEqualTo("$[1]"));
        }

        @Test
        @DisplayName("Should write bitmaps as ascending arrays")
        void shouldWriteBitmaps() {
            RoaringBitmap bitmap = RoaringBitmap.bitmapOf(9, 2, 4);
            assertThat(write(JsonCodecs.ROARING_BITMAP.serialize(bitmap))).isEqualTo("[2,4,9]");
            assertThat(JsonCodecs.ROARING_BITMAP.deserialize(json("[9,2,4]"))).isEqualTo(bitmap);
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Should report the path of a bad list element")
        void shouldReportElementPath() {
            JsonCodec<List<List<Integer>>> codec = JsonCodecs.list(JsonCodecs.list(JsonCodecs.INT));
            assertThatThrownBy(() -> codec.deserialize(json("[[1],[2,true]]")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .satisfies(e -> {
                        MalformedPayloadException m = (MalformedPayloadException) e;
                        assertThat(m.getPath()).isEqualTo("$[1][1]");
                        assertThat(m.getDetail()).isEqualTo("expected an int, found boolean");
                    });
        }

        @Test
        @DisplayName("Should reject an object where an array is expected")
        void shouldRejectObjectForArray() {
            assertThatThrownBy(() -> JsonCodecs.INT_LIST.deserialize(json("{}")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("expected an array, found object");
        }

        @Test
        @DisplayName("Should reject a tuple of the wrong arity")
        void shouldRejectWrongTupleArity() {
            assertThatThrownBy(() -> GrammarJsonCodecs.FSM_EDGE.deserialize(json("[1,2]")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("expected 3 elements, got 2");
        }

        @Test
        @DisplayName("Should reject a malformed map pair")
        void shouldRejectMalformedPair() {
            assertThatThrownBy(() -> JsonCodecs.INT2INT_MAP.deserialize(json("[[1,2],[3]]")))
                    .isInstanceOf(MalformedPayloadException.class)
                    .satisfies(e -> assertThat(((MalformedPayloadException) e).getPath()).isEqualTo("$[1]"));
        }
    }
}
