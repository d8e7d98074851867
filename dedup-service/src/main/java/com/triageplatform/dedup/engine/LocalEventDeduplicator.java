package com.triageplatform.dedup.engine;

import com.triageplatform.dedup.config.DeduplicationProperties;
import com.triageplatform.dedup.model.DeduplicationAction;
import com.triageplatform.dedup.model.DeduplicationEntry;
import com.triageplatform.dedup.model.DeduplicationRequest;
import com.triageplatform.dedup.model.DeduplicationResult;
import com.triageplatform.dedup.model.DeduplicationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process deduplicator over a {@link ConcurrentHashMap}. Each key is decided inside
 * one {@code compute} call, which serialises concurrent checks of the same key.
 *
 * <p>Expired entries are purged lazily on every check. When the cache grows beyond
 * {@code maxEntries}, the entry with the oldest {@code lastSeen} is evicted.
 */
@Component
@ConditionalOnProperty(prefix = "triage.dedup", name = "mode", havingValue = "local", matchIfMissing = true)
public class LocalEventDeduplicator implements EventDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(LocalEventDeduplicator.class);

    private final Map<String, DeduplicationEntry> cache = new ConcurrentHashMap<>();
    private final DeduplicationProperties properties;
    private final DeduplicationKeyGenerator keyGenerator;
    private final Clock clock;

    private final AtomicLong totalEvents     = new AtomicLong();
    private final AtomicLong duplicateEvents = new AtomicLong();

    public LocalEventDeduplicator(DeduplicationProperties properties, Clock clock) {
        this.properties   = properties;
        this.keyGenerator = new DeduplicationKeyGenerator(
            properties.keyPrefixOr(DeduplicationProperties.LOCAL_KEY_PREFIX));
        this.clock        = clock;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public Mono<DeduplicationResult> check(DeduplicationRequest request) {
        return Mono.fromCallable(() -> checkNow(request));
    }

    /** Synchronous core of {@link #check}. */
    public DeduplicationResult checkNow(DeduplicationRequest request) {
        String key = keyGenerator.keyFor(request);
        Instant now = clock.instant();
        purgeExpired(now);
        totalEvents.incrementAndGet();

        AtomicReference<DeduplicationResult> result = new AtomicReference<>();
        cache.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                DeduplicationEntry touched = existing.touch(now);
                result.set(DeduplicationResult.duplicate(properties.getActionOnDuplicate(), touched));
                return touched;
            }
            DeduplicationEntry created = DeduplicationEntry.first(k,
                DeduplicationKeyGenerator.newExecutionId(), now, properties.getTtl());
            result.set(DeduplicationResult.fresh(k, created.executionId()));
            return created;
        });

        DeduplicationResult answer = result.get();
        if (answer.isNew()) {
            evictIfOverCapacity(key);
            log.info("[Dedup] new key={} executionId={} source={}", key, answer.executionId(), request.sourceId());
        } else {
            duplicateEvents.incrementAndGet();
            log.info("[Dedup] duplicate key={} executionId={} occurrences={} action={}",
                key, answer.executionId(), answer.occurrenceCount(), answer.action().wireName());
        }
        return answer;
    }

    @Override
    public Mono<Void> release(String key) {
        return Mono.empty();
    }

    public DeduplicationStats stats() {
        purgeExpired(clock.instant());
        long total = totalEvents.get();
        long duplicates = duplicateEvents.get();
        double rate = total == 0 ? 0.0 : duplicates * 100.0 / total;
        return new DeduplicationStats(cache.size(), properties.getMaxEntries(), total, duplicates,
            rate, properties.getTtl());
    }

    public void clear() {
        cache.clear();
        totalEvents.set(0);
        duplicateEvents.set(0);
        log.info("[Dedup] cache cleared");
    }

    private void purgeExpired(Instant now) {
        int before = cache.size();
        cache.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int purged = before - cache.size();
        if (purged > 0) {
            log.debug("[Dedup] purged {} expired entries", purged);
        }
    }

    private void evictIfOverCapacity(String currentKey) {
        while (cache.size() > properties.getMaxEntries()) {
            String oldest = cache.entrySet().stream()
                .filter(e -> !e.getKey().equals(currentKey))
                .min(Map.Entry.comparingByValue(Comparator.comparing(DeduplicationEntry::lastSeen)))
                .map(Map.Entry::getKey)
                .orElse(null);
            if (oldest == null) {
                return;
            }
            cache.remove(oldest);
            log.debug("[Dedup] evicted key={} cacheSize={}", oldest, cache.size());
        }
    }
}
