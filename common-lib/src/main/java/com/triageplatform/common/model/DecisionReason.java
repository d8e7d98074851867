package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DecisionReason {
    WEIGHTED_CONSENSUS,
    UNANIMOUS_AGREEMENT,
    MAJORITY_VOTE,
    EXPERT_DECISION,
    LOW_CONFIDENCE,
    CONFLICTING_OPINIONS,
    INSUFFICIENT_DATA,
    HALLUCINATION_DETECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
