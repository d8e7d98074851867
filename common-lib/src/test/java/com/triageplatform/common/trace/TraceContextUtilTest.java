package com.triageplatform.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    @DisplayName("withTraceId makes the id visible to the whole upstream pipeline")
    void propagatesUpstream() {
        Mono<String> seen = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx)));

        assertEquals("trace-42", TraceContextUtil.withTraceId(seen, "trace-42").block());
    }

    @Test
    @DisplayName("null traceId and missing context entry both read as unknown")
    void unknownFallback() {
        Mono<String> seen = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx)));

        assertEquals(TraceContextUtil.UNKNOWN, TraceContextUtil.withTraceId(seen, null).block());
        assertEquals(TraceContextUtil.UNKNOWN, TraceContextUtil.getTraceId(Context.empty()));
    }

    @Test
    @DisplayName("withMdc runs the action and leaves no traceId behind")
    void mdcBridgeIsScoped() {
        AtomicBoolean ran = new AtomicBoolean();

        TraceContextUtil.withMdc("trace-42", () -> ran.set(true));

        assertTrue(ran.get());
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }
}
