package com.triageplatform.orchestrator.agent;

import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.AgentRole;
import com.triageplatform.common.model.AlertEvent;
import com.triageplatform.common.model.DecisionContext;
import reactor.core.publisher.Mono;

/**
 * An independent evaluator consulted once per triage round. How the opinion is produced
 * (rule engine, model call, analyst console) is the implementation's business.
 *
 * <p>An opinion that fails validation aborts the whole round; any other error or a
 * timeout only excludes this evaluator from the round.
 */
public interface EvaluatorAgent {

    Mono<AgentOpinion> evaluate(AlertEvent event, DecisionContext context);

    String agentId();

    AgentRole role();
}
