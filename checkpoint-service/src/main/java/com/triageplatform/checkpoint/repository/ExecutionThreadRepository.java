package com.triageplatform.checkpoint.repository;

import com.triageplatform.checkpoint.model.ExecutionThread;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface ExecutionThreadRepository extends ReactiveCrudRepository<ExecutionThread, String> {

    /**
     * Creates the thread or bumps {@code updated_at}; {@code created_at} is never overwritten.
     */
    @Modifying
    @Query("""
        INSERT INTO execution_thread (thread_id, created_at, updated_at)
        VALUES (:threadId, :now, :now)
        ON CONFLICT (thread_id) DO UPDATE SET
            updated_at = :now
        """)
    Mono<Void> upsertThread(String threadId, Instant now);
}
