/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.compiler;

import com.tessera.grammar.api.CompilationListener;
import com.tessera.grammar.api.IGrammarCache;
import com.tessera.grammar.api.IGrammarCompiler;
import com.tessera.grammar.api.exceptions.GrammarCompilationException;
import com.tessera.grammar.api.exceptions.GrammarException;
import com.tessera.grammar.api.model.GrammarSource;
import com.tessera.grammar.compiler.canonical.GrammarFsmHasher;
import com.tessera.grammar.compiler.fsm.GrammarFsmBuilder;
import com.tessera.grammar.infra.cache.GrammarCacheFactory;
import com.tessera.grammar.infra.config.TesseraConfig;
import com.tessera.grammar.infra.metrics.MetricsRegistry;
import com.tessera.grammar.infra.metrics.internal.MetricsRegistryHolder;
import com.tessera.grammar.infra.serialization.GrammarJsonCodecs;
import com.tessera.grammar.infra.serialization.JsonSerializer;
import com.tessera.grammar.runtime.model.Grammar;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles grammar sources into canonicalized {@link Grammar}s, serving repeated sources from
 * an injected {@link IGrammarCache}.
 *
 * <p>A compilation from scratch validates the rule table, builds one FSM per rule, computes
 * the canonical hashes and stores the result under the fingerprint of the source. Every such
 * compilation yields a fresh immutable grammar; cached grammars are never modified.
 */
public class GrammarCompiler implements IGrammarCompiler {

    private static final Logger logger = Logger.getLogger(GrammarCompiler.class.getName());

    private final TesseraConfig config;
    private final IGrammarCache cache;
    private final MetricsRegistry metrics;
    private final GrammarFsmBuilder builder;
    private final GrammarFsmHasher hasher;

    private volatile Tracer tracer;
    private volatile CompilationListener listener;

    public GrammarCompiler() {
        this(TesseraConfig.defaults());
    }

    public GrammarCompiler(TesseraConfig config) {
        this(config, GrammarCacheFactory.create(config), MetricsRegistryHolder.INSTANCE,
                OpenTelemetry.noop().getTracer("tessera-compiler"));
    }

    public GrammarCompiler(TesseraConfig config, IGrammarCache cache, MetricsRegistry metrics, Tracer tracer) {
        this.config = Objects.requireNonNull(config, "config");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.builder = new GrammarFsmBuilder(config.isBuilderSimplify());
        this.hasher = new GrammarFsmHasher();
        logger.info(String.format("GrammarCompiler initialized: cache=%s, simplify=%s, hasher=%s",
                config.getCacheType(), config.isBuilderSimplify(), config.isHasherEnabled()));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public Grammar compile(GrammarSource source) {
        Objects.requireNonNull(source, "source");
        long startTime = System.nanoTime();
        Span span = tracer.spanBuilder("compile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleCount", source.rules().size());
            span.setAttribute("rootRule", source.rootRuleName());

            runStage(CompilationListener.VALIDATION, 1,
                    () -> builder.resolveRuleIds(source),
                    ids -> Map.of("ruleCount", ids.size()));

            String fingerprint = cacheKey(source);
            span.setAttribute("fingerprint", fingerprint);

            Optional<Grammar> cached = lookup(fingerprint);
            if (cached.isPresent()) {
                metrics.counter("tessera.cache.hits").increment();
                span.setAttribute("cacheHit", true);
                logger.fine(String.format("Cache hit for grammar %s", fingerprint));
                return cached.get();
            }
            metrics.counter("tessera.cache.misses").increment();
            span.setAttribute("cacheHit", false);

            Grammar built = runStage(CompilationListener.FSM_BUILDING, 2,
                    () -> buildFsms(source),
                    g -> Map.of("ruleCount", g.numRules(), "stateCount", g.totalStates(),
                            "edgeCount", g.totalEdges()));

            Grammar grammar = built;
            if (config.isHasherEnabled()) {
                grammar = runStage(CompilationListener.CANONICALIZATION, 3,
                        () -> canonicalize(built),
                        g -> Map.of("ruleCount", g.numRules()));
            }

            final Grammar result = grammar;
            runStage(CompilationListener.CACHING, 4,
                    () -> {
                        store(fingerprint, result);
                        return result;
                    },
                    g -> Map.of("fingerprint", fingerprint));

            long elapsed = System.nanoTime() - startTime;
            metrics.counter("tessera.compile.count").increment();
            metrics.timer("tessera.compile.duration").record(Duration.ofNanos(elapsed));
            metrics.gauge("tessera.fsm.states").set(result.totalStates());
            span.setAttribute("stateCount", result.totalStates());
            span.setAttribute("compilationTimeMs", Duration.ofNanos(elapsed).toMillis());
            logger.info(String.format("Compiled grammar %s: %d rules, %d states in %.2f ms",
                    fingerprint, result.numRules(), result.totalStates(), elapsed / 1_000_000.0));
            return result;
        } catch (RuntimeException e) {
            metrics.counter("tessera.compile.failures").increment();
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void clearCache() {
        cache.clear();
        logger.info("Grammar cache cleared");
    }

    public IGrammarCache getCache() {
        return cache;
    }

    /**
     * Hex SHA-256 of the canonical JSON encoding of {@code source}. Equal sources always
     * produce equal fingerprints.
     */
    public static String fingerprint(GrammarSource source) {
        String json = JsonSerializer.serialize(GrammarJsonCodecs.GRAMMAR_SOURCE, source);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Cache key of {@code source} under this compiler's options. Grammars compiled without
     * simplification or hashing are stored apart from default ones.
     */
    String cacheKey(GrammarSource source) {
        String key = fingerprint(source);
        if (!config.isBuilderSimplify()) {
            key += "-raw";
        }
        if (!config.isHasherEnabled()) {
            key += "-unhashed";
        }
        return key;
    }

    private Grammar buildFsms(GrammarSource source) {
        Span span = tracer.spanBuilder("build-fsms").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Grammar grammar = builder.build(source);
            span.setAttribute("stateCount", grammar.totalStates());
            span.setAttribute("edgeCount", grammar.totalEdges());
            return grammar;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Grammar canonicalize(Grammar grammar) {
        Span span = tracer.spanBuilder("canonicalize").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Grammar canonical = hasher.canonicalize(grammar);
            span.setAttribute("ruleCount", canonical.numRules());
            return canonical;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Optional<Grammar> lookup(String fingerprint) {
        Span span = tracer.spanBuilder("cache-lookup").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Optional<Grammar> hit = cache.get(fingerprint);
            span.setAttribute("hit", hit.isPresent());
            return hit;
        } finally {
            span.end();
        }
    }

    /**
     * Writes the grammar to the cache. A failed write only costs a later recompilation, so it
     * is logged and the compilation still succeeds.
     */
    private void store(String fingerprint, Grammar grammar) {
        Span span = tracer.spanBuilder("cache-store").startSpan();
        try (Scope scope = span.makeCurrent()) {
            cache.put(fingerprint, grammar);
        } catch (RuntimeException e) {
            span.recordException(e);
            metrics.counter("tessera.cache.store.failures").increment();
            logger.log(Level.WARNING, String.format("Failed to cache grammar %s: %s", fingerprint, e.getMessage()), e);
        } finally {
            span.end();
        }
    }

    /**
     * Runs one stage with listener callbacks. Failures that are not already
     * {@link GrammarException}s are wrapped with the stage name.
     */
    private <T> T runStage(String stage, int number, Supplier<T> body, Function<T, Map<String, Object>> stageMetrics) {
        CompilationListener current = listener;
        if (current != null) {
            current.onStageStart(stage, number, CompilationListener.TOTAL_STAGES);
        }
        long start = System.nanoTime();
        T result;
        try {
            result = body.get();
        } catch (GrammarException e) {
            if (current != null) {
                current.onError(stage, e);
            }
            throw e;
        } catch (RuntimeException e) {
            if (current != null) {
                current.onError(stage, e);
            }
            throw new GrammarCompilationException(stage, e.getMessage(), e);
        }
        if (current != null) {
            current.onStageComplete(stage,
                    new CompilationListener.StageResult(stage, System.nanoTime() - start, stageMetrics.apply(result)));
        }
        return result;
    }
}
