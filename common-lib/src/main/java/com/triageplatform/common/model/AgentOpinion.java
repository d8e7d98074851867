package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.triageplatform.common.exception.ValidationException;

import java.time.Instant;
import java.util.Locale;

/**
 * One evaluator's assessment for a triage round. Validated eagerly: a confidence
 * outside [0,1], a negative evidence count or a missing label can never reach the
 * consensus engine.
 */
public record AgentOpinion(
    @JsonProperty("agentId")       String agentId,
    @JsonProperty("role")          AgentRole role,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("evidenceCount") int evidenceCount,
    @JsonProperty("resultLabel")   String resultLabel,
    @JsonProperty("rationale")     String rationale,
    @JsonProperty("timestamp")     Instant timestamp
) {
    public AgentOpinion {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("AgentOpinion", "agentId is required");
        }
        if (role == null) {
            throw new ValidationException("AgentOpinion", "role is required for agent " + agentId);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("AgentOpinion",
                "confidence must be within [0.0, 1.0], got " + confidence + " for agent " + agentId);
        }
        if (evidenceCount < 0) {
            throw new ValidationException("AgentOpinion",
                "evidenceCount must not be negative, got " + evidenceCount + " for agent " + agentId);
        }
        if (resultLabel == null || resultLabel.isBlank()) {
            throw new ValidationException("AgentOpinion", "resultLabel is required for agent " + agentId);
        }
        rationale = rationale == null ? "" : rationale;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentOpinion of(String agentId, AgentRole role, double confidence,
                                  int evidenceCount, String resultLabel, String rationale) {
        return new AgentOpinion(agentId, role, confidence, evidenceCount, resultLabel, rationale, Instant.now());
    }

    /** Label used for vote grouping: trimmed and lower-cased. */
    public String normalizedLabel() {
        return resultLabel.trim().toLowerCase(Locale.ROOT);
    }
}
