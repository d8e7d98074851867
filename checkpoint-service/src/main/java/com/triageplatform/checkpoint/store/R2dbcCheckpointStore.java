package com.triageplatform.checkpoint.store;

import com.triageplatform.checkpoint.dto.CheckpointRecord;
import com.triageplatform.checkpoint.model.AgentMemory;
import com.triageplatform.checkpoint.model.ExecutionStep;
import com.triageplatform.checkpoint.repository.AgentMemoryRepository;
import com.triageplatform.checkpoint.repository.ExecutionStepRepository;
import com.triageplatform.checkpoint.repository.ExecutionThreadRepository;
import com.triageplatform.checkpoint.service.CheckpointCodec;
import com.triageplatform.common.exception.StepOrderingException;
import com.triageplatform.common.exception.StoreUnavailableException;
import com.triageplatform.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * PostgreSQL adapter over Spring Data R2DBC. Multi-row writes run inside the
 * {@link TransactionalOperator}, so a step never exists without its memory rows.
 */
public class R2dbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcCheckpointStore.class);

    private final ExecutionThreadRepository threadRepository;
    private final ExecutionStepRepository stepRepository;
    private final AgentMemoryRepository memoryRepository;
    private final TransactionalOperator transactionalOperator;
    private final CheckpointCodec codec;

    public R2dbcCheckpointStore(ExecutionThreadRepository threadRepository,
                                ExecutionStepRepository stepRepository,
                                AgentMemoryRepository memoryRepository,
                                TransactionalOperator transactionalOperator,
                                CheckpointCodec codec) {
        this.threadRepository      = threadRepository;
        this.stepRepository        = stepRepository;
        this.memoryRepository      = memoryRepository;
        this.transactionalOperator = transactionalOperator;
        this.codec                 = codec;
    }

    @Override
    public String name() {
        return "r2dbc";
    }

    @Override
    public Mono<CheckpointRecord> append(CheckpointRecord record) {
        Mono<CheckpointRecord> write = Mono.defer(() -> {
            ExecutionStep step = toEntity(record);
            List<AgentMemory> memories = toMemories(record);
            return threadRepository.upsertThread(record.threadId(), record.createdAt())
                .then(stepRepository.save(step))
                .flatMap(saved -> Flux.fromIterable(memories)
                    .concatMap(memoryRepository::save)
                    .then(Mono.just(record)));
        });

        return transactionalOperator.transactional(write)
            .onErrorMap(DuplicateKeyException.class,
                e -> new StepOrderingException(record.threadId(), record.stepIndex(), record.stepIndex()))
            .onErrorMap(e -> e instanceof DataIntegrityViolationException && !(e instanceof DuplicateKeyException),
                e -> new ValidationException("R2dbcCheckpointStore",
                    "integrity violation writing step " + record.stepIndex() + " of thread " + record.threadId()))
            .onErrorMap(e -> !(e instanceof ValidationException) && !(e instanceof StoreUnavailableException),
                e -> new StoreUnavailableException("R2dbcCheckpointStore",
                    "append failed for thread " + record.threadId(), e))
            .doOnSuccess(r -> log.debug("[Checkpoint] step row written. threadId={} stepIndex={} memories={}",
                record.threadId(), record.stepIndex(), record.agentMemory().size()));
    }

    @Override
    public Mono<CheckpointRecord> findStep(String threadId, int stepIndex) {
        return stepRepository.findByThreadIdAndStepIndex(threadId, stepIndex).flatMap(this::hydrate);
    }

    @Override
    public Flux<CheckpointRecord> findSteps(String threadId) {
        return stepRepository.findByThreadIdOrderByStepIndexAsc(threadId).concatMap(this::hydrate);
    }

    @Override
    public Mono<CheckpointRecord> findLatest(String threadId) {
        return stepRepository.findFirstByThreadIdOrderByStepIndexDesc(threadId).flatMap(this::hydrate);
    }

    @Override
    public Mono<Long> deleteAllButLast(String threadId, int keepLast) {
        Mono<Long> delete = stepRepository.findByThreadIdOrderByStepIndexDesc(threadId)
            .skip(keepLast)
            .map(ExecutionStep::getCheckpointId)
            .collectList()
            .flatMap(ids -> ids.isEmpty()
                ? Mono.just(0L)
                : memoryRepository.deleteByCheckpointIds(ids)
                    .then(stepRepository.deleteByCheckpointIds(ids))
                    .map(Integer::longValue));
        return transactionalOperator.transactional(delete);
    }

    @Override
    public Mono<Boolean> deleteStep(String checkpointId) {
        List<String> ids = List.of(checkpointId);
        Mono<Boolean> delete = memoryRepository.deleteByCheckpointIds(ids)
            .then(stepRepository.deleteByCheckpointIds(ids))
            .map(deleted -> deleted > 0);
        return transactionalOperator.transactional(delete);
    }

    private Mono<CheckpointRecord> hydrate(ExecutionStep step) {
        return memoryRepository.findByCheckpointId(step.getCheckpointId())
            .collectMap(AgentMemory::getAgentId, m -> (Object) codec.read(m.getMemoryData()))
            .map(memory -> new CheckpointRecord(step.getCheckpointId(), step.getThreadId(), step.getStepIndex(),
                codec.read(step.getStateBlob()), memory, codec.read(step.getDecisionContext()),
                step.getCreatedAt()));
    }

    private ExecutionStep toEntity(CheckpointRecord record) {
        ExecutionStep step = new ExecutionStep();
        step.setCheckpointId(record.checkpointId());
        step.setThreadId(record.threadId());
        step.setStepIndex(record.stepIndex());
        step.setStateBlob(codec.write(record.stateBlob()));
        step.setDecisionContext(codec.write(record.decisionContext()));
        step.setCreatedAt(record.createdAt());
        return step;
    }

    @SuppressWarnings("unchecked")
    private List<AgentMemory> toMemories(CheckpointRecord record) {
        return record.agentMemory().entrySet().stream()
            .map(e -> {
                AgentMemory memory = new AgentMemory();
                memory.setCheckpointId(record.checkpointId());
                memory.setAgentId(e.getKey());
                Object value = e.getValue();
                memory.setMemoryData(codec.write(value instanceof Map<?, ?> m
                    ? (Map<String, Object>) m
                    : Map.of("value", String.valueOf(value))));
                memory.setCreatedAt(record.createdAt());
                return memory;
            })
            .toList();
    }
}
