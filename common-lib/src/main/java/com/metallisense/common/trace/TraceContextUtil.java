package com.metallisense.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Request id propagation for reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the request id. MDC is only
 * written as a temporary bridge during a log statement, never as a persistent
 * ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withRequestId(pipeline, requestId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    /** Returns {@code "unknown"} if absent, never {@code null}. */
    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, "unknown");
    }

    /** Uses the caller-supplied id when present, otherwise generates one. */
    public static String resolveRequestId(String candidate) {
        return candidate == null || candidate.isBlank() ? UUID.randomUUID().toString() : candidate;
    }

    /**
     * Bridges {@code requestId} into MDC for the duration of {@code logAction},
     * then removes it. Only for logging side effects.
     */
    public static void withMdc(String requestId, Runnable logAction) {
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
