package com.nftgateway.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the per-request trace id through reactive pipelines.
 *
 * <p>The Reactor Context is the only store for the trace id. MDC is written just for the
 * duration of a single log statement through {@link #withMdc}, never as a persistent
 * ThreadLocal, because a request may hop threads at every suspension point (cache access,
 * upstream call, retry delay).
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(chain.filter(exchange), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream at subscription time, so apply it at the end of the assembly.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * @return the trace id from {@code ctx}, or {@code "unknown"}; never {@code null}
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} bridged into MDC, then removes it.
     * Only for logging side-effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
