package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of evaluator roles, each carrying the static weight it contributes
 * to weighted consensus. New roles are added as new constants, never as free-form strings.
 *
 * <pre>
 *   THREAT_INTEL      2.0   (×1.5 when the round is security-flagged)
 *   LOG_ANALYZER      1.5
 *   METRICS_ANALYZER  1.0
 *   POLICY_ENGINE     1.5
 *   HUMAN_ANALYST     3.0
 * </pre>
 */
public enum AgentRole {
    THREAT_INTEL("threat_intel", 2.0),
    LOG_ANALYZER("log_analyzer", 1.5),
    METRICS_ANALYZER("metrics_analyzer", 1.0),
    POLICY_ENGINE("policy_engine", 1.5),
    HUMAN_ANALYST("human_analyst", 3.0);

    /** Multiplier applied to {@link #THREAT_INTEL} on security-flagged rounds. */
    public static final double SECURITY_BOOST = 1.5;

    private final String wireName;
    private final double baseWeight;

    AgentRole(String wireName, double baseWeight) {
        this.wireName   = wireName;
        this.baseWeight = baseWeight;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public double baseWeight() {
        return baseWeight;
    }

    /**
     * Weight of this role inside the given round. A {@code null} context yields the base weight.
     */
    public double weightIn(DecisionContext context) {
        if (this == THREAT_INTEL && context != null && context.securityDecision()) {
            return baseWeight * SECURITY_BOOST;
        }
        return baseWeight;
    }

    @JsonCreator
    public static AgentRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AgentRole role : values()) {
            if (role.wireName.equals(normalized) || role.name().equalsIgnoreCase(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + value);
    }
}
