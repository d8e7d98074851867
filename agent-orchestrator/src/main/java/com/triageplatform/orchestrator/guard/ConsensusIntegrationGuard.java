package com.triageplatform.orchestrator.guard;

import com.triageplatform.common.consensus.ConsensusEngine;
import com.triageplatform.common.consensus.ConsensusOutcome;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;

import java.util.List;

/**
 * Pipeline safety wrapper for {@link ConsensusEngine} invocations.
 *
 * <p>A round whose evaluators all timed out or failed reaches the decision stage with
 * no opinions; this guard answers such rounds with {@link ConsensusOutcome#empty}
 * without invoking the engine.
 *
 * <p>Pure utility: no reactive types, no logging, no state.
 */
public final class ConsensusIntegrationGuard {

    private ConsensusIntegrationGuard() {}

    /**
     * @param opinions collected opinions (may be null or empty)
     * @param engine   the active consensus strategy
     * @param context  round context (may be null)
     * @return a valid {@link ConsensusOutcome}, never {@code null}
     */
    public static ConsensusOutcome resolve(List<AgentOpinion> opinions, ConsensusEngine engine,
                                           DecisionContext context) {
        if (opinions == null || opinions.isEmpty()) {
            return ConsensusOutcome.empty(engine.name());
        }
        return engine.calculate(opinions, context == null ? DecisionContext.empty() : context);
    }
}
