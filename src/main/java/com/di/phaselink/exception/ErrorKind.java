package com.di.phaselink.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error kinds recorded on failed executions and dead-lettered messages.
 * <p>Usage: {@code ErrorKind kind = ErrorKind.categorize(exception);}
 * <p>To add a new kind: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorKind {

    NOT_READY("Inputs not ready", "A required source is missing, incomplete or stale"),
    STORE_UNAVAILABLE("Dependency store unavailable", "The dependency store could not be read or written"),
    MALFORMED_EVENT("Malformed event", "The change event failed schema validation"),
    DEADLINE_EXCEEDED("Deadline exceeded", "The stage invocation ran past its configured deadline"),
    DELIVERY_EXHAUSTED("Delivery exhausted", "The bus retry ceiling was reached"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    SERIALIZATION_ERROR("Serialization error", "Payload serialization or deserialization failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    PROCESSING_ERROR("Processing error", "The stage processor failed"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String label;
    private final String description;

    ErrorKind(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorKind> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorKind::isStoreError, STORE_UNAVAILABLE);
        MATCHERS.put(ErrorKind::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorKind::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorKind::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorKind::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorKind categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof PipelineException) {
            return ((PipelineException) exception).getErrorKind();
        }
        // unwrap executor / future wrappers once
        if ((exception instanceof java.util.concurrent.ExecutionException
                || exception instanceof java.util.concurrent.CompletionException)
                && exception.getCause() != null) {
            return categorize(exception.getCause());
        }
        for (Map.Entry<Predicate<Throwable>, ErrorKind> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return PROCESSING_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isStoreError(Throwable t) {
        return t instanceof org.springframework.dao.DataAccessException
                || t instanceof java.sql.SQLException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof java.io.UncheckedIOException && t.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    @Override
    public String toString() {
        return name();
    }
}
