package com.triageplatform.orchestrator.service;

import com.triageplatform.checkpoint.dto.CheckpointPayload;
import com.triageplatform.checkpoint.service.CheckpointCodec;
import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.model.DecisionRecord;
import com.triageplatform.common.model.HumanValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Governance seam: records an operator's verdict on a decision.
 *
 * <p>The verdict is an annotation only. Scores, state and reason of the decision are
 * never recomputed. When the decision belongs to a thread, the verdict is also appended
 * to that thread as a {@code human_validation} step (best-effort).
 */
@Service
public class HumanReviewService {

    private static final Logger log = LoggerFactory.getLogger(HumanReviewService.class);

    public static final String VALIDATION_STAGE = "human_validation";

    private final DecisionLedger ledger;
    private final ThreadCheckpointer checkpointer;
    private final CheckpointCodec codec;
    private final Clock clock;

    public HumanReviewService(DecisionLedger ledger, ThreadCheckpointer checkpointer,
                              CheckpointCodec codec, Clock clock) {
        this.ledger       = ledger;
        this.checkpointer = checkpointer;
        this.codec        = codec;
        this.clock        = clock;
    }

    /**
     * @throws ValidationException (as an error signal) for an unknown or already validated decision
     */
    public Mono<DecisionRecord> review(String decisionId, boolean approved, String validatedBy, String feedback) {
        return Mono.defer(() -> {
            HumanValidation validation = HumanValidation.of(decisionId, approved, validatedBy, feedback, clock.instant());
            DecisionRecord annotated = ledger.annotateIfUnvalidated(validation);
            log.info("[HumanReview] decisionId={} approved={} validatedBy={} state={}",
                decisionId, approved, validatedBy, annotated.state().wireName());

            Object threadId = annotated.metadata().get("threadId");
            if (threadId == null) {
                return Mono.just(annotated);
            }
            return appendValidationStep(String.valueOf(threadId), validation).thenReturn(annotated);
        });
    }

    private Mono<String> appendValidationStep(String threadId, HumanValidation validation) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put(DecisionOrchestrator.STAGE_KEY, VALIDATION_STAGE);
        state.put("validation", codec.toDocument(validation));
        return checkpointer.append(threadId, new CheckpointPayload(state, Map.<String, Object>of("threadId", threadId)))
            .onErrorResume(e -> {
                log.warn("[HumanReview] validation step not checkpointed threadId={} error={}",
                    threadId, e.getMessage());
                return Mono.empty();
            });
    }
}
