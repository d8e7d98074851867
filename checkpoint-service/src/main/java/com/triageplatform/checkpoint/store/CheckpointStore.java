package com.triageplatform.checkpoint.store;

import com.triageplatform.checkpoint.dto.CheckpointRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage port for Thread → Step (ordered) → AgentMemory. Adapters never retry; retries
 * and ordering checks belong to {@code CheckpointEngine}.
 */
public interface CheckpointStore {

    /** Creates or touches the thread and appends the step with its agent memory, atomically. */
    Mono<CheckpointRecord> append(CheckpointRecord record);

    Mono<CheckpointRecord> findStep(String threadId, int stepIndex);

    /** Steps of a thread in ascending {@code stepIndex} order. */
    Flux<CheckpointRecord> findSteps(String threadId);

    Mono<CheckpointRecord> findLatest(String threadId);

    /** Deletes all but the {@code keepLast} highest steps; emits the number deleted. */
    Mono<Long> deleteAllButLast(String threadId, int keepLast);

    Mono<Boolean> deleteStep(String checkpointId);

    String name();
}
