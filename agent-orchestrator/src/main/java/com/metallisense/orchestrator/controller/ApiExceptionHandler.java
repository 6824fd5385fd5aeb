package com.metallisense.orchestrator.controller;

import com.metallisense.common.exception.AgentException;
import com.metallisense.common.exception.InvalidCompositionException;
import com.metallisense.common.exception.ModelNotReadyException;
import com.metallisense.common.exception.UnknownGradeException;
import com.metallisense.orchestrator.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps pipeline exceptions to {@code {error, status_code}} bodies.
 *
 * <p>Only single-stage endpoints can surface {@link AgentException}s; the full
 * pipeline absorbs stage failures into ERROR-tagged results.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidCompositionException.class, UnknownGradeException.class,
                       IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        log.info("[ApiExceptionHandler] Rejected request. reason={}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(ServerWebInputException e) {
        log.info("[ApiExceptionHandler] Unreadable request. reason={}", e.getReason());
        return respond(HttpStatus.BAD_REQUEST, e.getReason());
    }

    @ExceptionHandler(ModelNotReadyException.class)
    public ResponseEntity<ErrorResponse> notReady(ModelNotReadyException e) {
        log.warn("[ApiExceptionHandler] Stage unavailable. agent={} reason={}", e.getAgentName(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<ErrorResponse> stageFailure(AgentException e) {
        log.error("[ApiExceptionHandler] Stage failed. agent={}", e.getAgentName(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("[ApiExceptionHandler] Unexpected failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error: " + e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message, status.value()));
    }
}
