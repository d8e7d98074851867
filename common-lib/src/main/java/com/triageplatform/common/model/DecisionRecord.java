package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one triage round. Created once per round; the only later changes are
 * the checkpoint id assigned after persistence and the human validation annotation,
 * both applied by copying.
 */
public record DecisionRecord(
    @JsonProperty("id")                  String id,
    @JsonProperty("state")               DecisionState state,
    @JsonProperty("reason")              DecisionReason reason,
    @JsonProperty("confidenceScore")     double confidenceScore,
    @JsonProperty("weightedScore")       double weightedScore,
    @JsonProperty("requiresHumanReview") boolean requiresHumanReview,
    @JsonProperty("evidenceSummary")     String evidenceSummary,
    @JsonProperty("recommendedAction")   String recommendedAction,
    @JsonProperty("metadata")            Map<String, Object> metadata,
    @JsonProperty("timestamp")           Instant timestamp,
    @JsonProperty("checkpointId")        String checkpointId,
    @JsonProperty("validation")          HumanValidation validation
) {
    public DecisionRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DecisionRecord create(DecisionState state, DecisionReason reason,
                                        double confidenceScore, double weightedScore,
                                        boolean requiresHumanReview, String evidenceSummary,
                                        Map<String, Object> metadata, Instant timestamp) {
        return new DecisionRecord(UUID.randomUUID().toString(), state, reason,
                                  confidenceScore, weightedScore, requiresHumanReview,
                                  evidenceSummary, state.recommendedAction(),
                                  metadata, timestamp, null, null);
    }

    public DecisionRecord withCheckpointId(String newCheckpointId) {
        return new DecisionRecord(id, state, reason, confidenceScore, weightedScore,
                                  requiresHumanReview, evidenceSummary, recommendedAction,
                                  metadata, timestamp, newCheckpointId, validation);
    }

    public DecisionRecord withValidation(HumanValidation newValidation) {
        return new DecisionRecord(id, state, reason, confidenceScore, weightedScore,
                                  requiresHumanReview, evidenceSummary, recommendedAction,
                                  metadata, timestamp, checkpointId, newValidation);
    }

    public boolean isValidated() {
        return validation != null;
    }
}
