/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;
import com.tessera.grammar.api.model.GrammarExpr;
import com.tessera.grammar.api.model.GrammarSource;
import com.tessera.grammar.api.model.RuleDefinition;
import com.tessera.grammar.runtime.model.CsrArray;
import com.tessera.grammar.runtime.model.Fsm;
import com.tessera.grammar.runtime.model.FsmEdge;
import com.tessera.grammar.runtime.model.Grammar;
import com.tessera.grammar.runtime.model.Rule;
import com.tessera.grammar.infra.serialization.ObjectCodec.Field;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntList;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static com.tessera.grammar.infra.serialization.JsonCodecs.BOOLEAN;
import static com.tessera.grammar.infra.serialization.JsonCodecs.INT;
import static com.tessera.grammar.infra.serialization.JsonCodecs.INT2INT_MAP;
import static com.tessera.grammar.infra.serialization.JsonCodecs.INT_LIST;
import static com.tessera.grammar.infra.serialization.JsonCodecs.OPTIONAL_LONG;
import static com.tessera.grammar.infra.serialization.JsonCodecs.ROARING_BITMAP;
import static com.tessera.grammar.infra.serialization.JsonCodecs.STRING;
import static com.tessera.grammar.infra.serialization.JsonCodecs.list;
import static com.tessera.grammar.infra.serialization.JsonCodecs.optional;

/**
 * JSON codecs for the compiled grammar model, the rule expression tree and the cache
 * document.
 *
 * <p>A compiled grammar is written as:
 * <pre>
 * {
 *   "rootRuleId": 0,
 *   "rules": [ {"id": 0, "name": "root", "body": {...}, "fsm": {...}} ],
 *   "perRuleFsmHashes": [ 1234 ],
 *   "perRuleFsmNewStateIds": [ [[0, 0], [1, 1]] ]
 * }
 * </pre>
 * where each FSM is {@code {"start": 0, "accepting": [1], "edges": {"data": [...], "indptr": [...]}}}
 * and each edge row of the CSR table holds flattened {@code (min, max, target)} triples.
 */
public final class GrammarJsonCodecs {

    public static final int CACHE_FORMAT_VERSION = 1;

    private GrammarJsonCodecs() {
        throw new AssertionError("No instances");
    }

    // ========================================================================
    // RUNTIME MODEL
    // ========================================================================

    /**
     * {@code [min, max, target]}.
     */
    public static final JsonCodec<FsmEdge> FSM_EDGE = JsonCodecs.tuple(3,
            edge -> new JsonNode[]{
                    INT.serialize(edge.min()), INT.serialize(edge.max()), INT.serialize(edge.target())},
            json -> new FsmEdge(
                    JsonCodecs.element(json, 0, INT),
                    JsonCodecs.element(json, 1, INT),
                    JsonCodecs.element(json, 2, INT)));

    private static final Field<CsrArray, IntList> CSR_DATA = ObjectCodec.field("data", CsrArray::data, INT_LIST);
    private static final Field<CsrArray, IntList> CSR_INDPTR = ObjectCodec.field("indptr", CsrArray::indptr, INT_LIST);

    public static final ObjectCodec<CsrArray> CSR_ARRAY = ObjectCodec.immutable("CsrArray",
            List.of(CSR_DATA, CSR_INDPTR),
            v -> CsrArray.of(v.get(CSR_DATA), v.get(CSR_INDPTR)));

    private static final Field<Fsm, Integer> FSM_START = ObjectCodec.field("start", Fsm::start, INT);
    private static final Field<Fsm, RoaringBitmap> FSM_ACCEPTING =
            ObjectCodec.field("accepting", Fsm::acceptingBitmap, ROARING_BITMAP);
    private static final Field<Fsm, CsrArray> FSM_EDGES = ObjectCodec.field("edges", Fsm::edgeTable, CSR_ARRAY);

    public static final ObjectCodec<Fsm> FSM = ObjectCodec.immutable("Fsm",
            List.of(FSM_START, FSM_ACCEPTING, FSM_EDGES),
            v -> Fsm.fromCompact(v.get(FSM_START), v.get(FSM_ACCEPTING), v.get(FSM_EDGES)));

    // ========================================================================
    // EXPRESSION TREE
    // ========================================================================

    /**
     * Tagged objects, e.g. {@code {"type": "literal", "text": "abc"}}.
     */
    public static final JsonCodec<GrammarExpr> GRAMMAR_EXPR = new GrammarExprCodec();

    private static final Field<Rule, Integer> RULE_ID = ObjectCodec.field("id", Rule::id, INT);
    private static final Field<Rule, String> RULE_NAME = ObjectCodec.field("name", Rule::name, STRING);
    private static final Field<Rule, GrammarExpr> RULE_BODY = ObjectCodec.field("body", Rule::body, GRAMMAR_EXPR);
    private static final Field<Rule, Fsm> RULE_FSM = ObjectCodec.field("fsm", Rule::fsm, FSM);

    public static final ObjectCodec<Rule> RULE = ObjectCodec.immutable("Rule",
            List.of(RULE_ID, RULE_NAME, RULE_BODY, RULE_FSM),
            v -> new Rule(v.get(RULE_ID), v.get(RULE_NAME), v.get(RULE_BODY), v.get(RULE_FSM)));

    private static final Field<Grammar, Integer> GRAMMAR_ROOT =
            ObjectCodec.field("rootRuleId", Grammar::getRootRuleId, INT);
    private static final Field<Grammar, List<Rule>> GRAMMAR_RULES =
            ObjectCodec.field("rules", Grammar::getRules, list(RULE));
    private static final Field<Grammar, List<OptionalLong>> GRAMMAR_HASHES =
            ObjectCodec.field("perRuleFsmHashes", Grammar::getPerRuleFsmHashes, list(OPTIONAL_LONG));
    private static final Field<Grammar, List<Optional<Int2IntMap>>> GRAMMAR_NEW_STATE_IDS =
            ObjectCodec.field("perRuleFsmNewStateIds", Grammar::getPerRuleFsmNewStateIds, list(optional(INT2INT_MAP)));

    public static final ObjectCodec<Grammar> GRAMMAR = ObjectCodec.immutable("Grammar",
            List.of(GRAMMAR_ROOT, GRAMMAR_RULES, GRAMMAR_HASHES, GRAMMAR_NEW_STATE_IDS),
            v -> Grammar.restore(v.get(GRAMMAR_RULES), v.get(GRAMMAR_ROOT),
                    v.get(GRAMMAR_HASHES), v.get(GRAMMAR_NEW_STATE_IDS)));

    private static final Field<RuleDefinition, String> DEFINITION_NAME =
            ObjectCodec.field("name", RuleDefinition::name, STRING);
    private static final Field<RuleDefinition, GrammarExpr> DEFINITION_BODY =
            ObjectCodec.field("body", RuleDefinition::body, GRAMMAR_EXPR);

    public static final ObjectCodec<RuleDefinition> RULE_DEFINITION = ObjectCodec.immutable("RuleDefinition",
            List.of(DEFINITION_NAME, DEFINITION_BODY),
            v -> new RuleDefinition(v.get(DEFINITION_NAME), v.get(DEFINITION_BODY)));

    private static final Field<GrammarSource, String> SOURCE_ROOT =
            ObjectCodec.field("rootRuleName", GrammarSource::rootRuleName, STRING);
    private static final Field<GrammarSource, List<RuleDefinition>> SOURCE_RULES =
            ObjectCodec.field("rules", GrammarSource::rules, list(RULE_DEFINITION));

    public static final ObjectCodec<GrammarSource> GRAMMAR_SOURCE = ObjectCodec.immutable("GrammarSource",
            List.of(SOURCE_ROOT, SOURCE_RULES),
            v -> new GrammarSource(v.get(SOURCE_RULES), v.get(SOURCE_ROOT)));

    // ========================================================================
    // CACHE DOCUMENT
    // ========================================================================

    /**
     * Persisted form of one cache entry.
     */
    public record CacheDocument(int version, String fingerprint, Grammar grammar) {
    }

    private static final Field<CacheDocument, Integer> DOC_VERSION =
            ObjectCodec.field("version", CacheDocument::version, INT);
    private static final Field<CacheDocument, String> DOC_FINGERPRINT =
            ObjectCodec.field("fingerprint", CacheDocument::fingerprint, STRING);
    private static final Field<CacheDocument, Grammar> DOC_GRAMMAR =
            ObjectCodec.field("grammar", CacheDocument::grammar, GRAMMAR);

    public static final ObjectCodec<CacheDocument> CACHE_DOCUMENT = ObjectCodec.immutable("CacheDocument",
            List.of(DOC_VERSION, DOC_FINGERPRINT, DOC_GRAMMAR),
            v -> new CacheDocument(v.get(DOC_VERSION), v.get(DOC_FINGERPRINT), v.get(DOC_GRAMMAR)));

    public static JsonNode writeCacheDocument(String fingerprint, Grammar grammar) {
        return CACHE_DOCUMENT.serialize(new CacheDocument(CACHE_FORMAT_VERSION, fingerprint, grammar));
    }

    /**
     * Reads a cache document written by any version of this codec.
     *
     * @return empty if the document was written in another format version
     * @throws MalformedPayloadException if the document is damaged
     */
    public static Optional<CacheDocument> readCacheDocument(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw JsonCodecs.mismatch("a CacheDocument object", json);
        }
        int version = JsonCodecs.decode(json.get("version"), INT, ".version");
        if (version != CACHE_FORMAT_VERSION) {
            return Optional.empty();
        }
        return Optional.of(CACHE_DOCUMENT.deserialize(json));
    }

    // ========================================================================
    // EXPRESSION CODEC
    // ========================================================================

    private static final class GrammarExprCodec implements JsonCodec<GrammarExpr> {

        private static final String TYPE = "type";

        @Override
        public JsonNode serialize(GrammarExpr value) {
            return value.accept(new GrammarExpr.Visitor<JsonNode>() {
                @Override
                public JsonNode visitCharacterClass(GrammarExpr.CharacterClass expr) {
                    ObjectNode node = tagged("char_class");
                    node.put("negated", expr.negated());
                    var ranges = node.putArray("ranges");
                    for (GrammarExpr.CodePointRange range : expr.ranges()) {
                        ranges.addArray().add(range.min()).add(range.max());
                    }
                    return node;
                }

                @Override
                public JsonNode visitLiteral(GrammarExpr.Literal expr) {
                    return tagged("literal").put("text", expr.text());
                }

                @Override
                public JsonNode visitSequence(GrammarExpr.Sequence expr) {
                    ObjectNode node = tagged("sequence");
                    node.set("items", children(expr.items()));
                    return node;
                }

                @Override
                public JsonNode visitChoice(GrammarExpr.Choice expr) {
                    ObjectNode node = tagged("choice");
                    node.set("alternatives", children(expr.alternatives()));
                    return node;
                }

                @Override
                public JsonNode visitRepetition(GrammarExpr.Repetition expr) {
                    ObjectNode node = tagged("repetition");
                    node.set("body", serialize(expr.body()));
                    node.put("min", expr.min());
                    node.put("max", expr.max());
                    return node;
                }

                @Override
                public JsonNode visitRuleRef(GrammarExpr.RuleRef expr) {
                    return tagged("rule_ref").put("rule", expr.ruleName());
                }

                @Override
                public JsonNode visitEmptyString(GrammarExpr.EmptyString expr) {
                    return tagged("empty");
                }
            });
        }

        @Override
        public GrammarExpr deserialize(JsonNode json) {
            if (json == null || !json.isObject()) {
                throw JsonCodecs.mismatch("an expression object", json);
            }
            String type = JsonCodecs.decode(json.get(TYPE), STRING, "." + TYPE);
            switch (type) {
                case "char_class": {
                    boolean negated = JsonCodecs.decode(json.get("negated"), BOOLEAN, ".negated");
                    JsonNode rangesNode = json.get("ranges");
                    try {
                        JsonCodecs.requireArray(rangesNode);
                    } catch (MalformedPayloadException e) {
                        throw e.under(".ranges");
                    }
                    List<GrammarExpr.CodePointRange> ranges = new ArrayList<>(rangesNode.size());
                    for (int i = 0; i < rangesNode.size(); i++) {
                        ranges.add(JsonCodecs.decode(rangesNode.get(i), CODE_POINT_RANGE, ".ranges[" + i + "]"));
                    }
                    return new GrammarExpr.CharacterClass(negated, ranges);
                }
                case "literal":
                    return new GrammarExpr.Literal(JsonCodecs.decode(json.get("text"), STRING, ".text"));
                case "sequence":
                    return new GrammarExpr.Sequence(JsonCodecs.decode(json.get("items"), list(this), ".items"));
                case "choice":
                    return new GrammarExpr.Choice(
                            JsonCodecs.decode(json.get("alternatives"), list(this), ".alternatives"));
                case "repetition":
                    return new GrammarExpr.Repetition(
                            JsonCodecs.decode(json.get("body"), this, ".body"),
                            JsonCodecs.decode(json.get("min"), INT, ".min"),
                            JsonCodecs.decode(json.get("max"), INT, ".max"));
                case "rule_ref":
                    return new GrammarExpr.RuleRef(JsonCodecs.decode(json.get("rule"), STRING, ".rule"));
                case "empty":
                    return new GrammarExpr.EmptyString();
                default:
                    throw new MalformedPayloadException("$." + TYPE, "unknown expression type '" + type + "'");
            }
        }

        private ObjectNode tagged(String type) {
            ObjectNode node = JsonCodecs.NODES.objectNode();
            node.put(TYPE, type);
            return node;
        }

        private JsonNode children(List<GrammarExpr> items) {
            return list(this).serialize(items);
        }
    }

    private static final JsonCodec<GrammarExpr.CodePointRange> CODE_POINT_RANGE = JsonCodecs.tuple(2,
            range -> new JsonNode[]{INT.serialize(range.min()), INT.serialize(range.max())},
            json -> new GrammarExpr.CodePointRange(
                    JsonCodecs.element(json, 0, INT),
                    JsonCodecs.element(json, 1, INT)));
}
