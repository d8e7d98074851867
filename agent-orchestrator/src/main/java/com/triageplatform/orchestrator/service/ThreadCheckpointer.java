package com.triageplatform.orchestrator.service;

import com.triageplatform.checkpoint.config.CheckpointProperties;
import com.triageplatform.checkpoint.dto.CheckpointPayload;
import com.triageplatform.checkpoint.dto.CheckpointRecord;
import com.triageplatform.checkpoint.service.CheckpointEngine;
import com.triageplatform.common.exception.StepOrderingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Appends a step at the thread's next index ({@code latest + 1}, 0 for a new thread) and
 * then prunes the thread down to {@code triage.checkpoint.keep-last} steps.
 *
 * <p>Appends to the same thread are queued in arrival order within this process, so a
 * decision step and a duplicate-occurrence step never race for one index. A write from
 * another process that takes the index first surfaces as {@link StepOrderingException};
 * the index is then recomputed, up to {@link #MAX_REINDEX_ATTEMPTS} times.
 *
 * <p>Other errors from the append reach the caller. Pruning is best-effort;
 * {@code keep-last: 0} disables it.
 */
@Component
public class ThreadCheckpointer {

    private static final Logger log = LoggerFactory.getLogger(ThreadCheckpointer.class);

    static final int MAX_REINDEX_ATTEMPTS = 3;

    private final CheckpointEngine checkpointEngine;
    private final int keepLast;

    /** threadId → completion signal of the last queued append */
    private final ConcurrentMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public ThreadCheckpointer(CheckpointEngine checkpointEngine, CheckpointProperties properties) {
        this.checkpointEngine = checkpointEngine;
        this.keepLast         = properties.getKeepLast();
    }

    /** @return the new checkpoint id */
    public Mono<String> append(String threadId, CheckpointPayload payload) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> mine = done.asMono();
            Mono<Void> previous = tails.put(threadId, mine);

            return (previous == null ? Mono.<Void>empty() : previous)
                .then(appendAtNextIndex(threadId, payload))
                .doFinally(signal -> {
                    done.tryEmitEmpty();
                    tails.remove(threadId, mine);
                });
        });
    }

    private Mono<String> appendAtNextIndex(String threadId, CheckpointPayload payload) {
        return Mono.defer(() -> checkpointEngine.latestStep(threadId)
                .map(CheckpointRecord::stepIndex)
                .map(latest -> latest + 1)
                .defaultIfEmpty(0)
                .flatMap(next -> checkpointEngine.persistStep(threadId, next, payload)))
            .retryWhen(Retry.max(MAX_REINDEX_ATTEMPTS)
                .filter(StepOrderingException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("[Checkpoint] step index taken concurrently, re-indexing. "
                    + "threadId={} attempt={}", threadId, signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .flatMap(checkpointId -> prune(threadId).thenReturn(checkpointId));
    }

    private Mono<Long> prune(String threadId) {
        if (keepLast <= 0) {
            return Mono.just(0L);
        }
        return checkpointEngine.cleanupOld(threadId, keepLast)
            .onErrorResume(e -> {
                log.warn("[Checkpoint] retention cleanup failed threadId={} error={}", threadId, e.getMessage());
                return Mono.just(0L);
            });
    }
}
