package com.triageplatform.orchestrator.logger;

import com.triageplatform.common.trace.TraceContextUtil;
import com.triageplatform.orchestrator.pipeline.DecisionEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the triage round lifecycle. Logs each stage without
 * touching pipeline behaviour.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #ALERT_RECEIVED}</li>
 *   <li>{@link #DEDUP_CHECKED}</li>
 *   <li>{@link #OPINIONS_COLLECTED}</li>
 *   <li>{@link #CONSENSUS_CALCULATED}</li>
 *   <li>{@link #CONFIDENCE_ASSESSED}</li>
 *   <li>{@link #DECISION_CREATED}</li>
 *   <li>{@link #CHECKPOINT_PERSISTED}</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.OPINIONS_COLLECTED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String ALERT_RECEIVED       = "ALERT_RECEIVED";
    public static final String DEDUP_CHECKED        = "DEDUP_CHECKED";
    public static final String OPINIONS_COLLECTED   = "OPINIONS_COLLECTED";
    public static final String CONSENSUS_CALCULATED = "CONSENSUS_CALCULATED";
    public static final String CONFIDENCE_ASSESSED  = "CONFIDENCE_ASSESSED";
    public static final String DECISION_CREATED     = "DECISION_CREATED";
    public static final String CHECKPOINT_PERSISTED = "CHECKPOINT_PERSISTED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The traceId comes from the signal's Reactor Context and is bridged to MDC for the
     * duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** For handlers where the traceId is already at hand. */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /**
     * Logs the consensus, confidence and decision stages of one evaluation as three
     * compact lines.
     */
    public void logEvaluation(DecisionEvaluation evaluation, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            log.info("[DecisionFlow] stage={} strategy={} kind={} score={} anomaly={} traceId={}",
                CONSENSUS_CALCULATED,
                evaluation.consensus().strategyName(),
                evaluation.consensus().consensusKind().wireName(),
                String.format("%.3f", evaluation.consensus().aggregateScore()),
                evaluation.consensus().hasAnomaly(),
                traceId);
            log.info("[DecisionFlow] stage={} final={} level={} flag={} traceId={}",
                CONFIDENCE_ASSESSED,
                String.format("%.3f", evaluation.assessment().finalScore()),
                evaluation.assessment().confidenceLevel().wireName(),
                evaluation.assessment().anomalyFlag().wireName(),
                traceId);
            log.info("[DecisionFlow] stage={} decisionId={} state={} reason={} review={} traceId={}",
                DECISION_CREATED,
                evaluation.record().id(),
                evaluation.record().state().wireName(),
                evaluation.record().reason().wireName(),
                evaluation.record().requiresHumanReview(),
                traceId);
        });
    }
}
