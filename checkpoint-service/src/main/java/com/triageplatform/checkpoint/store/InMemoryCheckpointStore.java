package com.triageplatform.checkpoint.store;

import com.triageplatform.checkpoint.dto.CheckpointRecord;
import com.triageplatform.checkpoint.service.CheckpointCodec;
import com.triageplatform.common.exception.StepOrderingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Single-process adapter for tests and local runs. Documents are kept as JSON so a
 * read never hands out the caller's mutable maps.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private record StoredStep(String checkpointId, String threadId, int stepIndex, String stateBlob,
                              String agentMemory, String decisionContext, Instant createdAt) {}

    private final Map<String, NavigableMap<Integer, StoredStep>> threads = new ConcurrentHashMap<>();
    private final CheckpointCodec codec;

    public InMemoryCheckpointStore(CheckpointCodec codec) {
        this.codec = codec;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Mono<CheckpointRecord> append(CheckpointRecord record) {
        return Mono.fromCallable(() -> {
            StoredStep stored = new StoredStep(record.checkpointId(), record.threadId(), record.stepIndex(),
                codec.write(record.stateBlob()), codec.write(record.agentMemory()),
                codec.write(record.decisionContext()), record.createdAt());
            NavigableMap<Integer, StoredStep> steps =
                threads.computeIfAbsent(record.threadId(), k -> new ConcurrentSkipListMap<>());
            if (steps.putIfAbsent(record.stepIndex(), stored) != null) {
                throw new StepOrderingException(record.threadId(), record.stepIndex(), steps.lastKey());
            }
            return record;
        });
    }

    @Override
    public Mono<CheckpointRecord> findStep(String threadId, int stepIndex) {
        return Mono.fromCallable(() -> {
            NavigableMap<Integer, StoredStep> steps = threads.get(threadId);
            StoredStep stored = steps == null ? null : steps.get(stepIndex);
            return stored == null ? null : toRecord(stored);
        });
    }

    @Override
    public Flux<CheckpointRecord> findSteps(String threadId) {
        return Flux.defer(() -> {
            NavigableMap<Integer, StoredStep> steps = threads.get(threadId);
            return steps == null ? Flux.empty() : Flux.fromIterable(new ArrayList<>(steps.values())).map(this::toRecord);
        });
    }

    @Override
    public Mono<CheckpointRecord> findLatest(String threadId) {
        return Mono.fromCallable(() -> {
            NavigableMap<Integer, StoredStep> steps = threads.get(threadId);
            if (steps == null || steps.isEmpty()) {
                return null;
            }
            return toRecord(steps.lastEntry().getValue());
        });
    }

    @Override
    public Mono<Long> deleteAllButLast(String threadId, int keepLast) {
        return Mono.fromCallable(() -> {
            NavigableMap<Integer, StoredStep> steps = threads.get(threadId);
            if (steps == null) {
                return 0L;
            }
            synchronized (steps) {
                List<Integer> doomed = new ArrayList<>(steps.descendingKeySet()).stream().skip(keepLast).toList();
                doomed.forEach(steps::remove);
                if (!doomed.isEmpty()) {
                    log.debug("[Checkpoint] in-memory cleanup threadId={} deleted={}", threadId, doomed.size());
                }
                return (long) doomed.size();
            }
        });
    }

    @Override
    public Mono<Boolean> deleteStep(String checkpointId) {
        return Mono.fromCallable(() -> {
            for (NavigableMap<Integer, StoredStep> steps : threads.values()) {
                boolean removed = steps.values().removeIf(s -> s.checkpointId().equals(checkpointId));
                if (removed) {
                    return true;
                }
            }
            return false;
        });
    }

    private CheckpointRecord toRecord(StoredStep stored) {
        return new CheckpointRecord(stored.checkpointId(), stored.threadId(), stored.stepIndex(),
            codec.read(stored.stateBlob()), codec.read(stored.agentMemory()),
            codec.read(stored.decisionContext()), stored.createdAt());
    }
}
