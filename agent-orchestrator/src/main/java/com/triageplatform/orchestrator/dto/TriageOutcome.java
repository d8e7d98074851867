package com.triageplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.triageplatform.common.model.DecisionRecord;
import com.triageplatform.dedup.model.DeduplicationAction;
import com.triageplatform.dedup.model.DeduplicationResult;

/**
 * Result of {@code TriageRoundService.triage}. {@code decision} is only present when the
 * alert started a new round; duplicates reference the original execution instead.
 */
public record TriageOutcome(
    @JsonProperty("executionId")     String executionId,
    @JsonProperty("dedupAction")     DeduplicationAction dedupAction,
    @JsonProperty("dedupKey")        String dedupKey,
    @JsonProperty("decision")        DecisionRecord decision,
    @JsonProperty("occurrenceCount") int occurrenceCount
) {
    public static TriageOutcome decided(DeduplicationResult dedup, DecisionRecord decision) {
        return new TriageOutcome(dedup.executionId(), dedup.action(), dedup.key(), decision, dedup.occurrenceCount());
    }

    public static TriageOutcome withoutDecision(DeduplicationResult dedup) {
        return new TriageOutcome(dedup.executionId(), dedup.action(), dedup.key(), null, dedup.occurrenceCount());
    }

    public boolean hasDecision() {
        return decision != null;
    }
}
