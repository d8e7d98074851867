package com.triageplatform.common.consensus;

import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;

import java.util.List;

/**
 * Strategy contract for aggregating evaluator opinions into a {@link ConsensusOutcome}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently from parallel rounds</li>
 *   <li><b>Total</b>: never throw; empty or degenerate input yields {@link ConsensusOutcome#empty}</li>
 *   <li><b>Non-null</b>: always return a valid outcome</li>
 * </ul>
 *
 * <p>Implementations: {@link WeightedScoreStrategy} (default), {@link UnanimousStrategy},
 * {@link MajorityStrategy}. The active one is chosen in {@code OrchestratorConfig}.
 */
public interface ConsensusEngine {

    /**
     * @param opinions validated opinions for this round (may be null or empty)
     * @param context  round context; may scale role weights (may be null)
     * @return a {@link ConsensusOutcome}: never {@code null}
     */
    ConsensusOutcome calculate(List<AgentOpinion> opinions, DecisionContext context);

    default ConsensusOutcome calculate(List<AgentOpinion> opinions) {
        return calculate(opinions, DecisionContext.empty());
    }

    /** Short identifier recorded on every outcome and in decision metadata. */
    String name();
}
