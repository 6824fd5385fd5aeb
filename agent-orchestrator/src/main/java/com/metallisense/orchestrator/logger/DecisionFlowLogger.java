package com.metallisense.orchestrator.logger;

import com.metallisense.common.trace.TraceContextUtil;
import com.metallisense.orchestrator.pipeline.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the analysis lifecycle. Pure side effects; never changes
 * pipeline behaviour.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: analysis request accepted at the boundary</li>
 *   <li>{@link PipelineState} transitions inside the orchestrator</li>
 *   <li>{@link #RESPONSE_DISPATCHED}: aggregated result handed back to the caller</li>
 * </ol>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String RESPONSE_DISPATCHED = "RESPONSE_DISPATCHED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on {@code onNext}.
     * Reads the request id from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String requestId = TraceContextUtil.getRequestId(signal.getContextView());
            TraceContextUtil.withMdc(requestId, () ->
                log.info("[DecisionFlow] stage={} requestId={}", stageName, requestId)
            );
        };
    }

    public void logWithRequestId(String stageName, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[DecisionFlow] stage={} requestId={}", stageName, requestId)
        );
    }

    public void logTransition(PipelineState state, String detail, String requestId) {
        TraceContextUtil.withMdc(requestId, () ->
            log.info("[DecisionFlow] state={} {} requestId={}", state, detail, requestId)
        );
    }
}
