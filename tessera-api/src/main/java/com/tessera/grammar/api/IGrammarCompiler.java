/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api;

import com.tessera.grammar.api.model.GrammarSource;
import com.tessera.grammar.api.model.RuleDefinition;
import com.tessera.grammar.runtime.model.Grammar;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Contract for compiling rule tables into per-rule FSMs with canonical hashes.
 */
public interface IGrammarCompiler {

    /**
     * Compiles a grammar source. Identical sources may be served from a cache.
     *
     * @param source rules in declaration order plus the root rule name
     * @return the compiled grammar, never partially built
     * @throws com.tessera.grammar.api.exceptions.GrammarException if compilation fails
     */
    Grammar compile(GrammarSource source);

    /**
     * Compiles rules with an explicit root rule name.
     */
    default Grammar compile(List<RuleDefinition> rules, String rootRuleName) {
        return compile(new GrammarSource(rules, rootRuleName == null ? GrammarSource.DEFAULT_ROOT_RULE : rootRuleName));
    }

    /**
     * Drops every cached compilation result.
     */
    void clearCache();

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
