package com.di.phaselink.exception;

import java.util.List;

/**
 * A required source is missing, below its completeness threshold or stale. Recovered by the next
 * completion event or the fallback timer, never surfaced as a hard failure.
 */
public class NotReadyException extends PipelineException {

    private final String stage;
    private final List<String> blockingSources;

    public NotReadyException(String stage, List<String> blockingSources) {
        super("Stage " + stage + " not ready; blocking sources=" + blockingSources);
        this.stage = stage;
        this.blockingSources = List.copyOf(blockingSources);
    }

    public String getStage() {
        return stage;
    }

    public List<String> getBlockingSources() {
        return blockingSources;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.NOT_READY;
    }
}
