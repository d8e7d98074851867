package com.triageplatform.checkpoint.repository;

import com.triageplatform.checkpoint.model.AgentMemory;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface AgentMemoryRepository extends ReactiveCrudRepository<AgentMemory, Long> {

    Flux<AgentMemory> findByCheckpointId(String checkpointId);

    @Modifying
    @Query("DELETE FROM agent_memory WHERE checkpoint_id IN (:checkpointIds)")
    Mono<Integer> deleteByCheckpointIds(Collection<String> checkpointIds);
}
