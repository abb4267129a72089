package com.di.phaselink.exception;

/** The bus did not acknowledge a publish in time. Transient. */
public class BusPublishException extends PipelineException {

    public BusPublishException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.NETWORK_ERROR;
    }
}
