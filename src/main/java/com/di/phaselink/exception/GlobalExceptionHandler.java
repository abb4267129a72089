package com.di.phaselink.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps exceptions from the operator endpoints to {@link ErrorResponse} bodies.
 * <ul>
 *   <li>{@link NotReadyException}: 409 with the blocking sources</li>
 *   <li>{@link StoreUnavailableException}: 503</li>
 *   <li>Bad input or unknown stage / record ({@link IllegalArgumentException}, bean validation): 400</li>
 *   <li>Wrong state ({@link IllegalStateException}): 409</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotReadyException.class)
    public ResponseEntity<ErrorResponse> handleNotReady(NotReadyException e, HttpServletRequest request) {
        log.info("[API] {} not ready: {}", e.getStage(), e.getBlockingSources());
        ErrorResponse body = build(ErrorKind.NOT_READY, e, HttpStatus.CONFLICT, request);
        body.addDetail("stage", e.getStage());
        body.addDetail("blockingSources", e.getBlockingSources());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e, HttpServletRequest request) {
        log.error("[API] Dependency store unavailable: {}", e.getMessage(), e);
        return respond(e, HttpStatus.SERVICE_UNAVAILABLE, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        log.warn("[API] Rejected request {}: {}", request.getRequestURI(), e.getMessage());
        return respond(e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e, HttpServletRequest request) {
        log.warn("[API] Conflict on {}: {}", request.getRequestURI(), e.getMessage());
        return respond(e, HttpStatus.CONFLICT, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e, HttpServletRequest request) {
        log.error("[API] Unhandled exception on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return respond(e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(Exception e, HttpStatus status, HttpServletRequest request) {
        return ResponseEntity.status(status).body(build(ErrorKind.categorize(e), e, status, request));
    }

    private ErrorResponse build(ErrorKind kind, Throwable exception, HttpStatus status, HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorKind(kind.name());
        response.setErrorKindLabel(kind.getLabel());
        response.setPath(request != null ? request.getRequestURI() : null);
        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable root = rootCause(exception);
        if (root != exception) {
            response.addDetail("rootCauseType", root.getClass().getName());
            response.addDetail("rootCauseMessage", root.getMessage());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
