package com.di.phaselink.exception;

/** A stage processor failed with a checked exception. */
public class StageProcessingException extends PipelineException {

    public StageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.PROCESSING_ERROR;
    }
}
