package com.triageplatform.common.consensus;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative agreement among the opinions of a round.
 *
 * <p>{@link #NO_UNANIMOUS_AGREEMENT} and {@link #NO_MAJORITY} are only produced by the
 * strict {@link UnanimousStrategy} and {@link MajorityStrategy} variants.
 */
public enum ConsensusKind {
    EMPTY,
    SINGLE_AGENT,
    UNANIMOUS,
    STRONG_MAJORITY,
    MAJORITY,
    SPLIT,
    NO_UNANIMOUS_AGREEMENT,
    NO_MAJORITY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMajority() {
        return this == MAJORITY || this == STRONG_MAJORITY;
    }
}
