package com.triageplatform.orchestrator.pipeline;

import com.triageplatform.common.confidence.ConfidenceAssessment;
import com.triageplatform.common.consensus.ConsensusOutcome;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionRecord;

import java.util.List;

/**
 * Everything one pass of {@link DecisionPipelineEngine} produced. Audit consumers read
 * the consensus and confidence values as they are; {@code timedOut} rounds are never
 * checkpointed.
 */
public record DecisionEvaluation(
    DecisionRecord record,
    List<AgentOpinion> opinions,
    ConsensusOutcome consensus,
    ConfidenceAssessment assessment,
    boolean timedOut
) {
    public DecisionEvaluation {
        opinions = opinions == null ? List.of() : List.copyOf(opinions);
    }

    public DecisionEvaluation withRecord(DecisionRecord updated) {
        return new DecisionEvaluation(updated, opinions, consensus, assessment, timedOut);
    }
}
