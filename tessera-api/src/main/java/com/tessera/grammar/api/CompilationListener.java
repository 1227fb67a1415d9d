/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>A compilation from scratch runs four stages:
 * <ol>
 *   <li>VALIDATION - rule names, root rule and duplicate checks</li>
 *   <li>FSM_BUILDING - one FSM per rule, rule calls kept as edges</li>
 *   <li>CANONICALIZATION - color refinement and per-rule hashes</li>
 *   <li>CACHING - storing the result under the source fingerprint</li>
 * </ol>
 * A cache hit skips every stage after VALIDATION.
 */
public interface CompilationListener {

    String VALIDATION = "VALIDATION";
    String FSM_BUILDING = "FSM_BUILDING";
    String CANONICALIZATION = "CANONICALIZATION";
    String CACHING = "CACHING";
    int TOTAL_STAGES = 4;

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName   name of the stage
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called before the exception of a failing stage propagates to the caller.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName     name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics       stage-specific metrics (e.g. "ruleCount", "stateCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
