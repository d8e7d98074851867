package com.triageplatform.orchestrator.service;

import com.triageplatform.checkpoint.dto.CheckpointPayload;
import com.triageplatform.checkpoint.service.CheckpointCodec;
import com.triageplatform.checkpoint.service.CheckpointEngine;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;
import com.triageplatform.orchestrator.pipeline.DecisionEvaluation;
import com.triageplatform.orchestrator.pipeline.DecisionPipelineEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision stage of a round: runs {@link DecisionPipelineEngine} and checkpoints the result.
 *
 * <p>Checkpointing is best-effort. When it fails after retries the decision is returned
 * without a {@code checkpointId}; the decision itself stands.
 */
@Service
public class DecisionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DecisionOrchestrator.class);

    public static final String STAGE_KEY      = "stage";
    public static final String DECISION_STAGE = "decision";

    private final DecisionPipelineEngine pipelineEngine;
    private final ThreadCheckpointer checkpointer;
    private final CheckpointCodec codec;

    public DecisionOrchestrator(DecisionPipelineEngine pipelineEngine, ThreadCheckpointer checkpointer,
                                CheckpointCodec codec) {
        this.pipelineEngine = pipelineEngine;
        this.checkpointer   = checkpointer;
        this.codec          = codec;
    }

    public Mono<DecisionEvaluation> decide(List<AgentOpinion> opinions, DecisionContext context) {
        return Mono.fromCallable(() -> pipelineEngine.evaluate(opinions, context))
            .flatMap(evaluation -> checkpoint(evaluation, context));
    }

    /**
     * Persists the evaluation as the thread's next step. Timed-out rounds and rounds without
     * a thread are returned untouched.
     */
    public Mono<DecisionEvaluation> checkpoint(DecisionEvaluation evaluation, DecisionContext context) {
        if (evaluation.timedOut() || context == null || !context.hasThread()) {
            return Mono.just(evaluation);
        }
        return Mono.fromCallable(() -> payloadFor(evaluation, context))
            .flatMap(payload -> checkpointer.append(context.threadId(), payload))
            .map(checkpointId -> {
                log.info("[Orchestrator] decision checkpointed decisionId={} threadId={} checkpointId={}",
                    evaluation.record().id(), context.threadId(), checkpointId);
                return evaluation.withRecord(evaluation.record().withCheckpointId(checkpointId));
            })
            .onErrorResume(e -> {
                log.error("[Orchestrator] checkpoint failed, decision kept without checkpointId. "
                    + "decisionId={} threadId={} error={}", evaluation.record().id(), context.threadId(), e.getMessage());
                return Mono.just(evaluation);
            });
    }

    private CheckpointPayload payloadFor(DecisionEvaluation evaluation, DecisionContext context) {
        List<Map<String, Object>> opinions = evaluation.opinions().stream().map(codec::toDocument).toList();

        Map<String, Object> state = new LinkedHashMap<>();
        state.put(STAGE_KEY, DECISION_STAGE);
        state.put(CheckpointEngine.AGENT_OPINIONS_KEY, opinions);
        state.put("consensus", codec.toDocument(evaluation.consensus()));
        state.put("confidence", codec.toDocument(evaluation.assessment()));
        state.put("decision", codec.toDocument(evaluation.record()));
        return new CheckpointPayload(state, codec.toDocument(context));
    }
}
