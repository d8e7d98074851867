package com.triageplatform.checkpoint.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triageplatform.checkpoint.repository.AgentMemoryRepository;
import com.triageplatform.checkpoint.repository.ExecutionStepRepository;
import com.triageplatform.checkpoint.repository.ExecutionThreadRepository;
import com.triageplatform.checkpoint.service.CheckpointCodec;
import com.triageplatform.checkpoint.service.CheckpointEngine;
import com.triageplatform.checkpoint.store.CheckpointStore;
import com.triageplatform.checkpoint.store.InMemoryCheckpointStore;
import com.triageplatform.checkpoint.store.R2dbcCheckpointStore;
import com.triageplatform.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;

/**
 * Wires the checkpoint engine over the store chosen by {@code triage.checkpoint.store}.
 */
@Configuration
public class CheckpointConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointConfig.class);

    @Bean
    public CheckpointCodec checkpointCodec(ObjectMapper objectMapper) {
        return new CheckpointCodec(objectMapper);
    }

    @Bean
    public CheckpointEngine checkpointEngine(CheckpointStore store, CheckpointProperties properties, Clock clock) {
        if (properties.getKeepLast() < 0) {
            throw new ConfigurationException("CheckpointEngine",
                "triage.checkpoint.keep-last must not be negative, got " + properties.getKeepLast());
        }
        log.info("[Checkpoint] engine ready. store={} maxAttempts={} keepLast={}",
            store.name(), properties.getRetry().getMaxAttempts(), properties.getKeepLast());
        return new CheckpointEngine(store, properties.toRetryPolicy(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "triage.checkpoint", name = "store", havingValue = "memory")
    public CheckpointStore inMemoryCheckpointStore(CheckpointCodec codec) {
        return new InMemoryCheckpointStore(codec);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "triage.checkpoint", name = "store", havingValue = "r2dbc", matchIfMissing = true)
    @EnableR2dbcRepositories(basePackageClasses = ExecutionStepRepository.class)
    static class R2dbcStoreConfig {

        @Bean
        public CheckpointStore r2dbcCheckpointStore(ExecutionThreadRepository threadRepository,
                                                    ExecutionStepRepository stepRepository,
                                                    AgentMemoryRepository memoryRepository,
                                                    TransactionalOperator transactionalOperator,
                                                    CheckpointCodec codec) {
            return new R2dbcCheckpointStore(threadRepository, stepRepository, memoryRepository,
                transactionalOperator, codec);
        }
    }
}
