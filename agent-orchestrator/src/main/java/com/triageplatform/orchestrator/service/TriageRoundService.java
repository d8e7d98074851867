package com.triageplatform.orchestrator.service;

import com.triageplatform.checkpoint.dto.CheckpointPayload;
import com.triageplatform.common.model.AlertEvent;
import com.triageplatform.common.model.DecisionContext;
import com.triageplatform.common.trace.TraceContextUtil;
import com.triageplatform.dedup.config.DeduplicationProperties;
import com.triageplatform.dedup.engine.DeduplicationKeyGenerator;
import com.triageplatform.dedup.engine.EventDeduplicator;
import com.triageplatform.dedup.model.DeduplicationAction;
import com.triageplatform.dedup.model.DeduplicationRequest;
import com.triageplatform.dedup.model.DeduplicationResult;
import com.triageplatform.orchestrator.config.RoundProperties;
import com.triageplatform.orchestrator.dto.TriageOutcome;
import com.triageplatform.orchestrator.logger.DecisionFlowLogger;
import com.triageplatform.orchestrator.pipeline.DecisionEvaluation;
import com.triageplatform.orchestrator.pipeline.DecisionPipelineEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for one alert: dedup check, then a decision round or a duplicate record.
 *
 * <ul>
 *   <li>{@code NEW}: evaluators are consulted, the pipeline decides, the decision is
 *       checkpointed as the thread's next step and the dedup lock is released.</li>
 *   <li>{@code UPDATE_EXISTING}: a {@code duplicate_occurrence} step is appended to the
 *       original execution's thread; no new round starts.</li>
 *   <li>{@code SKIP}: nothing happens.</li>
 * </ul>
 *
 * <p>Collection and evaluation are bounded by {@code triage.round.round-timeout}; a round
 * that exceeds it resolves to INVESTIGATING and writes no checkpoint. An invalid opinion
 * fails the round with a {@code ValidationException}.
 */
@Service
public class TriageRoundService {

    private static final Logger log = LoggerFactory.getLogger(TriageRoundService.class);

    public static final String DUPLICATE_STAGE = "duplicate_occurrence";

    private final EventDeduplicator deduplicator;
    private final DeduplicationProperties dedupProperties;
    private final EvaluatorDispatchService dispatchService;
    private final DecisionPipelineEngine pipelineEngine;
    private final DecisionOrchestrator decisionOrchestrator;
    private final ThreadCheckpointer checkpointer;
    private final DecisionLedger ledger;
    private final DecisionFlowLogger decisionFlowLogger;
    private final RoundProperties roundProperties;

    public TriageRoundService(EventDeduplicator deduplicator,
                              DeduplicationProperties dedupProperties,
                              EvaluatorDispatchService dispatchService,
                              DecisionPipelineEngine pipelineEngine,
                              DecisionOrchestrator decisionOrchestrator,
                              ThreadCheckpointer checkpointer,
                              DecisionLedger ledger,
                              DecisionFlowLogger decisionFlowLogger,
                              RoundProperties roundProperties) {
        this.deduplicator         = deduplicator;
        this.dedupProperties      = dedupProperties;
        this.dispatchService      = dispatchService;
        this.pipelineEngine       = pipelineEngine;
        this.decisionOrchestrator = decisionOrchestrator;
        this.checkpointer         = checkpointer;
        this.ledger               = ledger;
        this.decisionFlowLogger   = decisionFlowLogger;
        this.roundProperties      = roundProperties;
    }

    public Mono<TriageOutcome> triage(AlertEvent event) {
        Mono<TriageOutcome> round = Mono.just(event)
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.ALERT_RECEIVED))
            .flatMap(this::checkDuplicate)
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.DEDUP_CHECKED))
            .flatMap(dedup -> switch (dedup.action()) {
                case NEW -> Mono.usingWhen(Mono.just(dedup),
                    d -> runRound(event, d),
                    this::releaseLock);
                case UPDATE_EXISTING -> recordDuplicate(event, dedup);
                case SKIP -> {
                    log.info("[Triage] skipped source={} key={}", event.sourceId(), dedup.key());
                    yield Mono.just(TriageOutcome.withoutDecision(dedup));
                }
            });
        return TraceContextUtil.withTraceId(round, event.traceId());
    }

    private Mono<DeduplicationResult> checkDuplicate(AlertEvent event) {
        if (!dedupProperties.isEnabled()) {
            return Mono.just(new DeduplicationResult(DeduplicationAction.NEW, null,
                DeduplicationKeyGenerator.newExecutionId(), 1));
        }
        return deduplicator.check(DeduplicationRequest.from(event));
    }

    private Mono<TriageOutcome> runRound(AlertEvent event, DeduplicationResult dedup) {
        DecisionContext context = contextFor(event, dedup.executionId());
        Duration roundTimeout = roundProperties.getRoundTimeout();

        Mono<DecisionEvaluation> evaluation = dispatchService.collect(event, context)
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.OPINIONS_COLLECTED))
            .map(opinions -> pipelineEngine.evaluate(opinions, context))
            .timeout(roundTimeout)
            .onErrorResume(TimeoutException.class, e -> Mono.just(pipelineEngine.timedOut(context, roundTimeout)));

        return evaluation
            .doOnNext(e -> decisionFlowLogger.logEvaluation(e, event.traceId()))
            .flatMap(e -> decisionOrchestrator.checkpoint(e, context))
            .doOnNext(e -> {
                if (e.record().checkpointId() != null) {
                    decisionFlowLogger.logWithTraceId(DecisionFlowLogger.CHECKPOINT_PERSISTED, event.traceId());
                }
                ledger.record(e.record());
            })
            .map(e -> TriageOutcome.decided(dedup, e.record()));
    }

    private Mono<TriageOutcome> recordDuplicate(AlertEvent event, DeduplicationResult dedup) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put(DecisionOrchestrator.STAGE_KEY, DUPLICATE_STAGE);
        state.put("sourceId", event.sourceId());
        state.put("eventType", event.eventType());
        state.put("severity", event.severity());
        state.put("occurrenceCount", dedup.occurrenceCount());
        state.put("receivedAt", event.receivedAt().toString());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("threadId", dedup.executionId());
        context.put("traceId", event.traceId());

        return checkpointer.append(dedup.executionId(), new CheckpointPayload(state, context))
            .doOnNext(checkpointId -> log.info("[Triage] duplicate recorded executionId={} occurrences={} checkpointId={}",
                dedup.executionId(), dedup.occurrenceCount(), checkpointId))
            .onErrorResume(e -> {
                log.warn("[Triage] duplicate step not checkpointed executionId={} error={}",
                    dedup.executionId(), e.getMessage());
                return Mono.empty();
            })
            .then(Mono.fromSupplier(() -> TriageOutcome.withoutDecision(dedup)));
    }

    private Mono<Void> releaseLock(DeduplicationResult dedup) {
        if (dedup.key() == null) {
            return Mono.empty();
        }
        return deduplicator.release(dedup.key())
            .onErrorResume(e -> {
                log.warn("[Triage] dedup lock release failed key={} error={}", dedup.key(), e.getMessage());
                return Mono.empty();
            });
    }

    private static DecisionContext contextFor(AlertEvent event, String executionId) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("sourceId", event.sourceId());
        if (event.eventType() != null) {
            attributes.put("eventType", event.eventType());
        }
        if (event.severity() != null) {
            attributes.put("severity", event.severity());
        }
        return new DecisionContext(executionId, event.traceId(), event.isSecurityRelated(), attributes);
    }
}
