package com.triageplatform.checkpoint.service;

import com.triageplatform.checkpoint.dto.CheckpointPayload;
import com.triageplatform.checkpoint.dto.CheckpointRecord;
import com.triageplatform.checkpoint.dto.ReplayState;
import com.triageplatform.checkpoint.store.CheckpointStore;
import com.triageplatform.common.exception.StepOrderingException;
import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable, ordered storage of orchestration steps per execution thread.
 *
 * <p>Every store call is wrapped in the configured {@link RetryPolicy}. Once retries are
 * exhausted the last error reaches the caller, which decides whether the failure is soft.
 * Steps are append-only: there is no update operation.
 *
 * <p>Ordering: {@link #persistStep} rejects a {@code stepIndex} that is not strictly greater
 * than the thread's latest with {@link StepOrderingException}, which is never retried.
 */
public class CheckpointEngine {

    private static final Logger log = LoggerFactory.getLogger(CheckpointEngine.class);

    public static final String AGENT_OPINIONS_KEY = "agentOpinions";

    private final CheckpointStore store;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public CheckpointEngine(CheckpointStore store, RetryPolicy retryPolicy, Clock clock) {
        this.store       = store;
        this.retryPolicy = retryPolicy;
        this.clock       = clock;
    }

    public String storeName() {
        return store.name();
    }

    /**
     * Creates or merges the thread and appends an immutable step.
     *
     * @return the new checkpoint id
     */
    public Mono<String> persistStep(String threadId, int stepIndex, CheckpointPayload payload) {
        return Mono.defer(() -> {
            requireThread(threadId);
            if (stepIndex < 0) {
                return Mono.error(new ValidationException("CheckpointEngine",
                    "stepIndex must not be negative, got " + stepIndex));
            }
            if (payload == null) {
                return Mono.error(new ValidationException("CheckpointEngine", "payload is required"));
            }
            CheckpointRecord record = new CheckpointRecord(UUID.randomUUID().toString(), threadId, stepIndex,
                payload.stateBlob(), extractAgentMemory(payload.stateBlob()), payload.decisionContext(),
                clock.instant());

            Mono<CheckpointRecord> write = store.findLatest(threadId)
                .map(CheckpointRecord::stepIndex)
                .defaultIfEmpty(-1)
                .flatMap(latest -> stepIndex <= latest
                    ? Mono.error(new StepOrderingException(threadId, stepIndex, latest))
                    : store.append(record));

            return retryPolicy.apply(write, "persistStep")
                .map(CheckpointRecord::checkpointId)
                .doOnSuccess(id -> log.info("[Checkpoint] persisted threadId={} stepIndex={} checkpointId={}",
                    threadId, stepIndex, id))
                .doOnError(e -> log.error("[Checkpoint] persist failed threadId={} stepIndex={} error={}",
                    threadId, stepIndex, e.getMessage()));
        });
    }

    /** Empty when the step does not exist. */
    public Mono<CheckpointRecord> loadStep(String threadId, int stepIndex) {
        return Mono.defer(() -> {
            requireThread(threadId);
            return retryPolicy.apply(store.findStep(threadId, stepIndex), "loadStep");
        });
    }

    public Flux<CheckpointRecord> listSteps(String threadId) {
        return Flux.defer(() -> {
            requireThread(threadId);
            return retryPolicy.apply(store.findSteps(threadId), "listSteps");
        });
    }

    public Mono<CheckpointRecord> latestStep(String threadId) {
        return Mono.defer(() -> {
            requireThread(threadId);
            return retryPolicy.apply(store.findLatest(threadId), "latestStep");
        });
    }

    /** State to resume the thread from {@code stepIndex}; empty when the step is missing. */
    public Mono<ReplayState> replayFrom(String threadId, int stepIndex) {
        return loadStep(threadId, stepIndex)
            .map(ReplayState::from)
            .doOnNext(state -> log.info("[Checkpoint] replay threadId={} fromStep={}", threadId, stepIndex));
    }

    /**
     * Keeps the {@code keepLast} highest steps of the thread and deletes the rest in one transaction.
     *
     * @return number of deleted steps
     */
    public Mono<Long> cleanupOld(String threadId, int keepLast) {
        return Mono.defer(() -> {
            requireThread(threadId);
            if (keepLast < 0) {
                return Mono.error(new ValidationException("CheckpointEngine",
                    "keepLast must not be negative, got " + keepLast));
            }
            return retryPolicy.apply(store.deleteAllButLast(threadId, keepLast), "cleanupOld")
                .doOnSuccess(deleted -> log.info("[Checkpoint] cleanup threadId={} keepLast={} deleted={}",
                    threadId, keepLast, deleted));
        });
    }

    public Mono<Boolean> deleteStep(String checkpointId) {
        return Mono.defer(() -> {
            if (checkpointId == null || checkpointId.isBlank()) {
                return Mono.error(new ValidationException("CheckpointEngine", "checkpointId is required"));
            }
            return retryPolicy.apply(store.deleteStep(checkpointId), "deleteStep")
                .doOnSuccess(deleted -> log.info("[Checkpoint] delete checkpointId={} deleted={}",
                    checkpointId, deleted));
        });
    }

    /**
     * agentId → {role, confidence, label} from {@code stateBlob.agentOpinions}; entries
     * without an agent id are skipped.
     */
    static Map<String, Object> extractAgentMemory(Map<String, Object> stateBlob) {
        Map<String, Object> memory = new LinkedHashMap<>();
        if (stateBlob == null || !(stateBlob.get(AGENT_OPINIONS_KEY) instanceof List<?> opinions)) {
            return memory;
        }
        for (Object element : opinions) {
            if (!(element instanceof Map<?, ?> opinion) || opinion.get("agentId") == null) {
                continue;
            }
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("role", opinion.get("role"));
            snapshot.put("confidence", opinion.get("confidence"));
            snapshot.put("label", opinion.get("resultLabel"));
            memory.put(String.valueOf(opinion.get("agentId")), snapshot);
        }
        return memory;
    }

    private static void requireThread(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            throw new ValidationException("CheckpointEngine", "threadId is required");
        }
    }
}
