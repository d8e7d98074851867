package com.triageplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Divergence signal between a reported and a governed confidence.
 *
 * <p>{@link #CONFIRMED} is never derived from divergence; it marks a batch item whose
 * calculation failed outright.
 */
public enum AnomalyFlag {
    NONE,
    POTENTIAL,
    LIKELY,
    CONFIRMED;

    public static final double POTENTIAL_THRESHOLD = 0.2;
    public static final double LIKELY_THRESHOLD    = 0.3;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AnomalyFlag forDivergence(double divergence) {
        if (divergence < POTENTIAL_THRESHOLD) return NONE;
        if (divergence < LIKELY_THRESHOLD)    return POTENTIAL;
        return LIKELY;
    }

    /** True for flags that must force human review. */
    public boolean forcesReview() {
        return this == LIKELY || this == CONFIRMED;
    }
}
