package com.di.phaselink.exception;

/** The dependency store could not be read or written. Transient: the message is retried. */
public class StoreUnavailableException extends PipelineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.STORE_UNAVAILABLE;
    }
}
