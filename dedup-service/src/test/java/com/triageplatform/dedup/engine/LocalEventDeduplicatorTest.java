package com.triageplatform.dedup.engine;

import com.triageplatform.dedup.config.DeduplicationProperties;
import com.triageplatform.dedup.model.DeduplicationAction;
import com.triageplatform.dedup.model.DeduplicationRequest;
import com.triageplatform.dedup.model.DeduplicationResult;
import com.triageplatform.dedup.model.DeduplicationStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class LocalEventDeduplicatorTest {

    private MutableClock clock;
    private DeduplicationProperties properties;
    private LocalEventDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new DeduplicationProperties();
        properties.setTtl(Duration.ofMinutes(30));
        properties.setMaxEntries(3);
        deduplicator = new LocalEventDeduplicator(properties, clock);
    }

    @Nested
    @DisplayName("check()")
    class CheckTests {

        @Test
        @DisplayName("first occurrence → NEW with a fresh execution id")
        void firstOccurrence() {
            DeduplicationResult result = deduplicator.check(DeduplicationRequest.of("alert-1")).block();
            assertNotNull(result);
            assertEquals(DeduplicationAction.NEW, result.action());
            assertTrue(result.executionId().startsWith("exec_"));
            assertTrue(result.key().startsWith(DeduplicationProperties.LOCAL_KEY_PREFIX));
            assertEquals(1, result.occurrenceCount());
        }

        @Test
        @DisplayName("repeat within TTL → UPDATE_EXISTING, same execution id, count increments")
        void duplicateWithinTtl() {
            DeduplicationRequest request = new DeduplicationRequest("alert-1", "security_alert", "prometheus", "high");
            DeduplicationResult first = deduplicator.checkNow(request);
            clock.advance(Duration.ofMinutes(10));
            DeduplicationResult second = deduplicator.checkNow(request);
            clock.advance(Duration.ofMinutes(10));
            DeduplicationResult third = deduplicator.checkNow(request);

            assertEquals(DeduplicationAction.UPDATE_EXISTING, second.action());
            assertEquals(first.executionId(), second.executionId());
            assertEquals(first.executionId(), third.executionId());
            assertEquals(2, second.occurrenceCount());
            assertEquals(3, third.occurrenceCount());
        }

        @Test
        @DisplayName("after TTL since last occurrence → NEW again")
        void afterTtl() {
            DeduplicationRequest request = DeduplicationRequest.of("alert-1");
            DeduplicationResult first = deduplicator.checkNow(request);
            clock.advance(Duration.ofMinutes(31));
            DeduplicationResult again = deduplicator.checkNow(request);

            assertEquals(DeduplicationAction.NEW, again.action());
            assertNotEquals(first.executionId(), again.executionId());
        }

        @Test
        @DisplayName("SKIP policy answers SKIP but keeps the original execution id")
        void skipPolicy() {
            properties.setActionOnDuplicate(DeduplicationAction.SKIP);
            DeduplicationResult first = deduplicator.checkNow(DeduplicationRequest.of("alert-1"));
            DeduplicationResult second = deduplicator.checkNow(DeduplicationRequest.of("alert-1"));
            assertEquals(DeduplicationAction.SKIP, second.action());
            assertEquals(first.executionId(), second.executionId());
        }

        @Test
        @DisplayName("different discriminators → different keys")
        void discriminators() {
            DeduplicationResult a = deduplicator.checkNow(new DeduplicationRequest("alert-1", "cpu", null, null));
            DeduplicationResult b = deduplicator.checkNow(new DeduplicationRequest("alert-1", "memory", null, null));
            assertNotEquals(a.key(), b.key());
            assertEquals(DeduplicationAction.NEW, b.action());
        }

        @Test
        @DisplayName("concurrent checks of one key start exactly one execution")
        void concurrentChecks() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<DeduplicationResult>> futures = new ArrayList<>();
                for (int i = 0; i < 32; i++) {
                    futures.add(pool.submit(() -> deduplicator.checkNow(DeduplicationRequest.of("storm"))));
                }
                Set<String> executionIds = new HashSet<>();
                int fresh = 0;
                for (Future<DeduplicationResult> future : futures) {
                    DeduplicationResult result = future.get();
                    executionIds.add(result.executionId());
                    if (result.isNew()) {
                        fresh++;
                    }
                }
                assertEquals(1, fresh);
                assertEquals(1, executionIds.size());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("over capacity → entry with oldest lastSeen evicted")
    void eviction() {
        DeduplicationResult a = deduplicator.checkNow(DeduplicationRequest.of("a"));
        clock.advance(Duration.ofSeconds(1));
        deduplicator.checkNow(DeduplicationRequest.of("b"));
        clock.advance(Duration.ofSeconds(1));
        deduplicator.checkNow(DeduplicationRequest.of("c"));
        clock.advance(Duration.ofSeconds(1));
        // refresh "a" so "b" becomes the oldest
        deduplicator.checkNow(DeduplicationRequest.of("a"));
        clock.advance(Duration.ofSeconds(1));
        deduplicator.checkNow(DeduplicationRequest.of("d"));

        assertEquals(3, deduplicator.stats().cacheSize());
        assertEquals(a.executionId(), deduplicator.checkNow(DeduplicationRequest.of("a")).executionId());
        assertEquals(DeduplicationAction.NEW, deduplicator.checkNow(DeduplicationRequest.of("b")).action());
    }

    @Test
    @DisplayName("stats() reports duplicates as a percentage; clear() resets")
    void statsAndClear() {
        deduplicator.checkNow(DeduplicationRequest.of("a"));
        deduplicator.checkNow(DeduplicationRequest.of("a"));
        deduplicator.checkNow(DeduplicationRequest.of("a"));
        deduplicator.checkNow(DeduplicationRequest.of("b"));

        DeduplicationStats stats = deduplicator.stats();
        assertEquals(2, stats.cacheSize());
        assertEquals(4, stats.totalEventsSeen());
        assertEquals(2, stats.duplicateEvents());
        assertEquals(50.0, stats.deduplicationRate(), 1e-9);
        assertEquals(3, stats.maxEntries());

        deduplicator.clear();
        assertEquals(0, deduplicator.stats().cacheSize());
        assertEquals(DeduplicationAction.NEW, deduplicator.checkNow(DeduplicationRequest.of("a")).action());
    }
}
