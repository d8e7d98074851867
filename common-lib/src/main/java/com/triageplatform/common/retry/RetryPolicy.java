package com.triageplatform.common.retry;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry settings applied functionally around a store call.
 *
 * <p>Attempt {@code n} (1-based) that fails is followed by a delay of
 * {@code initialDelay × backoffFactor^(n-1)} before the next attempt, up to
 * {@code maxAttempts} attempts in total. Once exhausted, the last error is surfaced
 * unchanged. {@link ValidationException} and {@link ConfigurationException} are never retried.
 *
 * <pre>
 *     return retryPolicy.apply(store.append(record), "persistStep");
 * </pre>
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double backoffFactor) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), 2.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ConfigurationException("RetryPolicy", "maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new ConfigurationException("RetryPolicy", "initialDelay must not be negative, got " + initialDelay);
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
            throw new ConfigurationException("RetryPolicy", "backoffFactor must be >= 1.0, got " + backoffFactor);
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0);
    }

    /** Delay after the given (0-based) failed attempt. */
    public Duration delayAfter(long failedAttempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, failedAttempt);
        return Duration.ofMillis((long) Math.min(millis, Long.MAX_VALUE));
    }

    public <T> Mono<T> apply(Mono<T> operation, String operationName) {
        return operation.retryWhen(toRetrySpec(operationName));
    }

    public <T> Flux<T> apply(Flux<T> operation, String operationName) {
        return operation.retryWhen(toRetrySpec(operationName));
    }

    public static boolean isRetryable(Throwable error) {
        return !(error instanceof ValidationException) && !(error instanceof ConfigurationException);
    }

    private Retry toRetrySpec(String operationName) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long failed = signal.totalRetries();
            Throwable failure = signal.failure();
            if (!isRetryable(failure)) {
                return Mono.error(failure);
            }
            if (failed + 1 >= maxAttempts) {
                log.error("[Retry] {} failed after {} attempt(s). error={}",
                    operationName, failed + 1, failure.getMessage());
                return Mono.error(failure);
            }
            Duration delay = delayAfter(failed);
            log.warn("[Retry] {} attempt {}/{} failed, retrying in {}ms. error={}",
                operationName, failed + 1, maxAttempts, delay.toMillis(), failure.getMessage());
            return Mono.delay(delay).thenReturn(failed);
        }));
    }
}
