package com.di.phaselink.exception;

/**
 * Base type for failures raised while moving a change through the pipeline.
 * Every subtype carries the {@link ErrorKind} it is recorded under in the execution log and
 * the dead-letter store.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getErrorKind();

    /** Whether redelivering the same message can succeed. */
    public boolean isRetryable() {
        return true;
    }
}
