package com.triageplatform.common.retry;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.exception.StoreUnavailableException;
import com.triageplatform.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy fast = new RetryPolicy(3, Duration.ofMillis(5), 2.0);

    @Test
    @DisplayName("recovers when a later attempt succeeds")
    void recovers() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> flaky = Mono.defer(() -> attempts.incrementAndGet() < 3
            ? Mono.error(new StoreUnavailableException("store", "down"))
            : Mono.just("ok"));

        StepVerifier.create(fast.apply(flaky, "flaky"))
            .expectNext("ok")
            .verifyComplete();
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("exhaustion surfaces the last error")
    void exhaustion() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> broken = Mono.defer(() ->
            Mono.error(new StoreUnavailableException("store", "down-" + attempts.incrementAndGet())));

        StepVerifier.create(fast.apply(broken, "broken"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(StoreUnavailableException.class, e);
                assertTrue(e.getMessage().endsWith("down-3"));
            })
            .verify();
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("validation errors are not retried")
    void validationNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> invalid = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new ValidationException("store", "bad"));
        });

        StepVerifier.create(fast.apply(invalid, "invalid"))
            .expectError(ValidationException.class)
            .verify();
        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("delay grows by the backoff factor")
    void backoff() {
        RetryPolicy policy = RetryPolicy.DEFAULT;
        assertEquals(Duration.ofSeconds(1), policy.delayAfter(0));
        assertEquals(Duration.ofSeconds(2), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(2));
    }

    @Test
    @DisplayName("invalid settings rejected")
    void invalidSettings() {
        assertThrows(ConfigurationException.class, () -> new RetryPolicy(0, Duration.ofSeconds(1), 2.0));
        assertThrows(ConfigurationException.class, () -> new RetryPolicy(3, Duration.ofSeconds(-1), 2.0));
        assertThrows(ConfigurationException.class, () -> new RetryPolicy(3, Duration.ofSeconds(1), 0.5));
    }
}
