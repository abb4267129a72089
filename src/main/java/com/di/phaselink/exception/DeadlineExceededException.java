package com.di.phaselink.exception;

import java.time.Duration;

/**
 * A stage invocation ran past its deadline. The invocation is not interrupted; the message is
 * failed so the bus retries it, and the retried run re-converges because store writes record the
 * latest observation.
 */
public class DeadlineExceededException extends PipelineException {

    public DeadlineExceededException(String stage, Duration deadline) {
        super("Stage " + stage + " exceeded deadline of " + deadline.toMillis() + " ms");
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.DEADLINE_EXCEEDED;
    }
}
