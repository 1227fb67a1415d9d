/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.runtime.model;

import com.tessera.grammar.api.exceptions.InvalidRangeException;

/**
 * A labeled FSM transition {@code (min, max, target)}.
 *
 * <p>The sentinel {@code -1} in {@code min} is the sole discriminator between the kinds:
 * <ul>
 *   <li>epsilon: {@code min == -1 && max == -1}</li>
 *   <li>rule reference: {@code min == -1 && max >= 0}; {@code max} is the referenced rule id and
 *       {@code target} is the state to continue at once the callee returns</li>
 *   <li>character range: {@code min >= 0 && max >= 0}, inclusive code point range with {@code min <= max}</li>
 * </ul>
 * Any other combination is rejected at construction.
 */
public record FsmEdge(int min, int max, int target) {

    public static final int NO_CHAR = -1;

    public FsmEdge {
        if (min < NO_CHAR || max < NO_CHAR || (min >= 0 && max < 0)) {
            throw new InvalidRangeException(min, max,
                    String.format("Invalid FSM edge: min=%d, max=%d does not describe an edge kind", min, max));
        }
        if (min >= 0 && min > max) {
            throw new InvalidRangeException(min, max);
        }
        if (target < 0) {
            throw new IllegalArgumentException("Edge target must be a state id, got " + target);
        }
    }

    public static FsmEdge epsilon(int target) {
        return new FsmEdge(NO_CHAR, NO_CHAR, target);
    }

    public static FsmEdge ruleRef(int ruleId, int target) {
        if (ruleId < 0) {
            throw new IllegalArgumentException("Rule id must be non-negative, got " + ruleId);
        }
        return new FsmEdge(NO_CHAR, ruleId, target);
    }

    public static FsmEdge charRange(int min, int max, int target) {
        if (min < 0 || max < 0) {
            throw new InvalidRangeException(min, max,
                    String.format("Character range bounds must be non-negative: [%d, %d]", min, max));
        }
        return new FsmEdge(min, max, target);
    }

    public boolean isEpsilon() {
        return min == NO_CHAR && max == NO_CHAR;
    }

    public boolean isRuleRef() {
        return min == NO_CHAR && max != NO_CHAR;
    }

    public boolean isCharRange() {
        return min >= 0;
    }

    /**
     * @throws IllegalStateException if this is not a rule-reference edge
     */
    public int refRuleId() {
        if (!isRuleRef()) {
            throw new IllegalStateException("Not a rule reference edge: " + this);
        }
        return max;
    }

    public FsmEdge withTarget(int newTarget) {
        return new FsmEdge(min, max, newTarget);
    }

    @Override
    public String toString() {
        if (isEpsilon()) {
            return "eps->" + target;
        }
        if (isRuleRef()) {
            return "rule(" + max + ")->" + target;
        }
        return "[" + describe(min) + "-" + describe(max) + "]->" + target;
    }

    private static String describe(int codePoint) {
        if (codePoint >= 0x21 && codePoint < 0x7F) {
            return String.valueOf((char) codePoint);
        }
        return String.format("\\u%04X", codePoint);
    }
}
