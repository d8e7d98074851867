package com.triageplatform.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.triageplatform.checkpoint.config.CheckpointProperties;
import com.triageplatform.checkpoint.dto.CheckpointRecord;
import com.triageplatform.checkpoint.service.CheckpointCodec;
import com.triageplatform.checkpoint.service.CheckpointEngine;
import com.triageplatform.checkpoint.store.InMemoryCheckpointStore;
import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.model.DecisionReason;
import com.triageplatform.common.model.DecisionRecord;
import com.triageplatform.common.model.DecisionState;
import com.triageplatform.common.model.HumanValidation;
import com.triageplatform.common.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class HumanReviewServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private DecisionLedger ledger;
    private CheckpointEngine checkpointEngine;
    private HumanReviewService service;

    @BeforeEach
    void setUp() {
        CheckpointCodec codec = new CheckpointCodec(new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        checkpointEngine = new CheckpointEngine(new InMemoryCheckpointStore(codec), RetryPolicy.noRetry(), FIXED);
        ledger = new DecisionLedger(10);
        service = new HumanReviewService(ledger,
            new ThreadCheckpointer(checkpointEngine, new CheckpointProperties()), codec, FIXED);
    }

    private static DecisionRecord pending(Map<String, Object> metadata) {
        return DecisionRecord.create(DecisionState.PENDING_HUMAN_APPROVAL, DecisionReason.CONFLICTING_OPINIONS,
            0.82, 0.78, true, "2 agent(s) voted 'escalate': ti-1, log-1", metadata, Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Nested
    @DisplayName("review()")
    class ReviewTests {

        @Test
        @DisplayName("annotates the decision without recomputing its scores")
        void annotates() {
            DecisionRecord decision = pending(Map.of());
            ledger.record(decision);

            DecisionRecord reviewed = service.review(decision.id(), true, "analyst@soc", "confirmed").block();

            assertNotNull(reviewed);
            assertTrue(reviewed.isValidated());
            assertTrue(reviewed.validation().approved());
            assertEquals("analyst@soc", reviewed.validation().validatedBy());
            assertEquals(Instant.parse("2024-05-01T12:00:00Z"), reviewed.validation().validatedAt());
            assertEquals(decision.confidenceScore(), reviewed.confidenceScore());
            assertEquals(decision.weightedScore(), reviewed.weightedScore());
            assertEquals(decision.state(), reviewed.state());
            assertTrue(ledger.find(decision.id()).orElseThrow().isValidated());
        }

        @Test
        @DisplayName("decision on a thread gets a human_validation step")
        void checkpointsValidation() {
            DecisionRecord decision = pending(Map.of("threadId", "exec_9"));
            ledger.record(decision);

            service.review(decision.id(), false, "analyst@soc", null).block();

            List<CheckpointRecord> steps = checkpointEngine.listSteps("exec_9").collectList().block();
            assertEquals(1, steps.size());
            assertEquals(HumanReviewService.VALIDATION_STAGE,
                steps.get(0).stateBlob().get(DecisionOrchestrator.STAGE_KEY));
        }

        @Test
        @DisplayName("unknown decision → ValidationException")
        void unknownDecision() {
            StepVerifier.create(service.review("missing", true, "analyst@soc", null))
                .expectError(ValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("second verdict on the same decision → ValidationException")
        void alreadyValidated() {
            DecisionRecord decision = pending(Map.of());
            ledger.record(decision);
            service.review(decision.id(), true, "analyst@soc", null).block();

            StepVerifier.create(service.review(decision.id(), false, "lead@soc", "override"))
                .expectError(ValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("concurrent verdicts on one decision → exactly one is accepted")
        void concurrentVerdicts() throws Exception {
            DecisionRecord decision = pending(Map.of());
            ledger.record(decision);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> futures = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    String analyst = "analyst-" + i + "@soc";
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            service.review(decision.id(), true, analyst, null).block();
                            return true;
                        } catch (ValidationException e) {
                            return false;
                        }
                    }));
                }
                start.countDown();
                int accepted = 0;
                for (Future<Boolean> future : futures) {
                    if (future.get()) {
                        accepted++;
                    }
                }
                assertEquals(1, accepted);
                assertTrue(ledger.find(decision.id()).orElseThrow().isValidated());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("DecisionLedger")
    class LedgerTests {

        @Test
        @DisplayName("drops the oldest decision when full")
        void bounded() {
            DecisionLedger small = new DecisionLedger(2);
            DecisionRecord first = pending(Map.of());
            small.record(first);
            small.record(pending(Map.of()));
            small.record(pending(Map.of()));

            assertEquals(2, small.size());
            assertTrue(small.find(first.id()).isEmpty());
        }

        @Test
        @DisplayName("annotateIfUnvalidated keeps the first verdict")
        void firstVerdictWins() {
            DecisionRecord decision = pending(Map.of());
            ledger.record(decision);
            Instant at = Instant.parse("2024-05-01T12:00:00Z");

            ledger.annotateIfUnvalidated(HumanValidation.of(decision.id(), true, "analyst@soc", null, at));

            assertThrows(ValidationException.class, () -> ledger.annotateIfUnvalidated(
                HumanValidation.of(decision.id(), false, "lead@soc", "override", at)));
            assertEquals("analyst@soc", ledger.find(decision.id()).orElseThrow().validation().validatedBy());
        }

        @Test
        @DisplayName("capacity must be positive")
        void capacity() {
            assertThrows(ConfigurationException.class, () -> new DecisionLedger(0));
        }
    }
}
