package com.triageplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Reactor Context is the single source of truth for the round's traceId. MDC is only
 * written as a temporary bridge around a log statement.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(round, alert.traceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context. {@code contextWrite} propagates upstream
     * during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId));
    }

    /** Returns {@code "unknown"} when absent, never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
