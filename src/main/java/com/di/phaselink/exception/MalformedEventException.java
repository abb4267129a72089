package com.di.phaselink.exception;

/**
 * A change event failed schema validation. Routed straight to the dead-letter channel since a
 * retry cannot fix the content.
 */
public class MalformedEventException extends PipelineException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.MALFORMED_EVENT;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
