package com.triageplatform.dedup.engine;

import com.triageplatform.dedup.model.DeduplicationRequest;
import com.triageplatform.dedup.model.DeduplicationResult;
import reactor.core.publisher.Mono;

/**
 * Maps repeated source events onto one logical execution.
 *
 * <p>A {@code NEW} answer obliges the caller to {@link #release} the key once its round ends;
 * for variants without a lock this is a no-op.
 */
public interface EventDeduplicator {

    Mono<DeduplicationResult> check(DeduplicationRequest request);

    Mono<Void> release(String key);

    String name();
}
