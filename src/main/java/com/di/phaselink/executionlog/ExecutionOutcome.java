package com.di.phaselink.executionlog;

public enum ExecutionOutcome {
    SUCCESS,
    FAILURE,
    /** Inputs not ready; the message goes back to the bus for retry. */
    DEFERRED,
    /** Nothing to recompute for this stage (empty change set or duplicate). */
    SKIPPED
}
