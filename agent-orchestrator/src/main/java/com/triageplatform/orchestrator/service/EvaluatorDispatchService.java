package com.triageplatform.orchestrator.service;

import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.AlertEvent;
import com.triageplatform.common.model.DecisionContext;
import com.triageplatform.orchestrator.agent.EvaluatorAgent;
import com.triageplatform.orchestrator.agent.EvaluatorRegistry;
import com.triageplatform.orchestrator.config.RoundProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fans a round out to every registered evaluator concurrently and gathers the opinions.
 *
 * <p>Each evaluator is bounded by {@code triage.round.agent-timeout}. A timed-out or failing
 * evaluator is left out of the round; an invalid opinion ({@link ValidationException})
 * fails the whole collection.
 */
@Service
public class EvaluatorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorDispatchService.class);

    private final EvaluatorRegistry registry;
    private final RoundProperties roundProperties;

    public EvaluatorDispatchService(EvaluatorRegistry registry, RoundProperties roundProperties) {
        this.registry        = registry;
        this.roundProperties = roundProperties;
    }

    public Mono<List<AgentOpinion>> collect(AlertEvent event, DecisionContext context) {
        List<EvaluatorAgent> agents = registry.all();
        Duration agentTimeout = roundProperties.getAgentTimeout();
        log.info("[Dispatch] consulting {} evaluator(s) source={} threadId={}",
            agents.size(), event.sourceId(), context.threadId());

        return Flux.fromIterable(agents)
            .flatMap(agent -> Mono.defer(() -> agent.evaluate(event, context))
                .timeout(agentTimeout)
                .doOnNext(opinion -> log.info("[Dispatch] agent={} role={} label={} confidence={}",
                    agent.agentId(), agent.role().wireName(), opinion.normalizedLabel(), opinion.confidence()))
                .onErrorResume(e -> !(e instanceof ValidationException), e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("[Dispatch] agent={} timed out after {}ms, excluded", agent.agentId(),
                            agentTimeout.toMillis());
                    } else {
                        log.warn("[Dispatch] agent={} failed, excluded. error={}", agent.agentId(), e.getMessage());
                    }
                    return Mono.empty();
                }))
            .collectList()
            .doOnError(ValidationException.class, e ->
                log.error("[Dispatch] invalid opinion, aborting round. threadId={} error={}",
                    context.threadId(), e.getMessage()));
    }
}
