/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.benchmark;

import com.tessera.grammar.api.model.GrammarExpr;
import com.tessera.grammar.api.model.GrammarSource;
import com.tessera.grammar.api.model.RuleDefinition;
import com.tessera.grammar.compiler.GrammarCompiler;
import com.tessera.grammar.compiler.canonical.GrammarFsmHasher;
import com.tessera.grammar.compiler.fsm.GrammarFsmBuilder;
import com.tessera.grammar.infra.cache.InMemoryGrammarCache;
import com.tessera.grammar.infra.config.TesseraConfig;
import com.tessera.grammar.infra.metrics.internal.NoOpMetricsRegistry;
import com.tessera.grammar.runtime.model.Grammar;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.tessera.grammar.api.model.GrammarExprs.*;

/**
 * Compilation cost of a JSON-like grammar with a growing number of object rules, split into
 * FSM building, canonicalization, and a cache hit through the compiler facade.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 2)
public class GrammarCompilerBenchmark {

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    @Param({"10", "100", "500"})
    private int objectRules;

    private GrammarSource source;
    private GrammarFsmBuilder builder;
    private GrammarFsmHasher hasher;
    private Grammar built;
    private GrammarCompiler cachedCompiler;

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("com.tessera").setLevel(java.util.logging.Level.WARNING);

        source = jsonLikeGrammar(objectRules);
        builder = new GrammarFsmBuilder(true);
        hasher = new GrammarFsmHasher();
        built = builder.build(source);

        TesseraConfig config = TesseraConfig.forTesting();
        cachedCompiler = new GrammarCompiler(config,
                InMemoryGrammarCache.builder().maxEntries(16).build(),
                NoOpMetricsRegistry.INSTANCE, NOOP_TRACER);
        cachedCompiler.compile(source);
    }

    @Benchmark
    public Grammar buildFsms() {
        return builder.build(source);
    }

    @Benchmark
    public Grammar canonicalize() {
        return hasher.canonicalize(built);
    }

    @Benchmark
    public Grammar compileCacheHit() {
        return cachedCompiler.compile(source);
    }

    /**
     * {@code root ::= value}, {@code value ::= string | number | obj_0 | ... | obj_n}, each
     * object rule listing a distinct key followed by a nested value.
     */
    static GrammarSource jsonLikeGrammar(int objectRules) {
        List<RuleDefinition> rules = new ArrayList<>();
        List<GrammarExpr> valueChoices = new ArrayList<>();
        valueChoices.add(ref("string"));
        valueChoices.add(ref("number"));
        for (int i = 0; i < objectRules; i++) {
            valueChoices.add(ref("obj_" + i));
        }
        rules.add(rule("root", ref("value")));
        rules.add(rule("value", choice(valueChoices.toArray(new GrammarExpr[0]))));
        rules.add(rule("string", seq(literal("\""), star(charClass(true, '"', '"', '\\', '\\')), literal("\""))));
        rules.add(rule("number", seq(optional(literal("-")), plus(charClass('0', '9')))));
        for (int i = 0; i < objectRules; i++) {
            rules.add(rule("obj_" + i, seq(
                    literal("{\"key" + i + "\":"),
                    ref("value"),
                    star(seq(literal(","), ref("value"))),
                    literal("}"))));
        }
        return new GrammarSource(rules, GrammarSource.DEFAULT_ROOT_RULE);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(GrammarCompilerBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
