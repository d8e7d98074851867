package com.triageplatform.common.confidence;

import com.triageplatform.common.model.DecisionContext;

import java.util.List;

/** Input of {@link ConfidencePolicy#batchCalculate}. */
public record ConfidenceRequest(double agentConfidence, List<EvidenceItem> evidence, DecisionContext context) {

    public ConfidenceRequest {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static ConfidenceRequest of(double agentConfidence, List<EvidenceItem> evidence) {
        return new ConfidenceRequest(agentConfidence, evidence, null);
    }
}
