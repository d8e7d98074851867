package com.triageplatform.checkpoint.repository;

import com.triageplatform.checkpoint.model.ExecutionStep;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface ExecutionStepRepository extends ReactiveCrudRepository<ExecutionStep, Long> {

    Mono<ExecutionStep> findByThreadIdAndStepIndex(String threadId, int stepIndex);

    Mono<ExecutionStep> findByCheckpointId(String checkpointId);

    Flux<ExecutionStep> findByThreadIdOrderByStepIndexAsc(String threadId);

    Flux<ExecutionStep> findByThreadIdOrderByStepIndexDesc(String threadId);

    Mono<ExecutionStep> findFirstByThreadIdOrderByStepIndexDesc(String threadId);

    @Modifying
    @Query("DELETE FROM execution_step WHERE checkpoint_id IN (:checkpointIds)")
    Mono<Integer> deleteByCheckpointIds(Collection<String> checkpointIds);
}
