package com.di.phaselink.executionlog;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One stage invocation. Append-only: entries are never updated.
 * {@code scopeRatio} is scopeSize / activePopulation (1.0 for a full-date run).
 */
@Value
@Builder(toBuilder = true)
public class ExecutionLogEntry {
    String invocationId;
    String stage;
    TriggerKind triggerKind;
    LocalDate scopeDate;
    /** date, entities or all. */
    String scopeKind;
    int scopeSize;
    long activePopulation;
    double scopeRatio;
    Instant startedAt;
    long durationMs;
    ExecutionOutcome outcome;
    /** ErrorKind name for FAILURE / DEFERRED, null otherwise. */
    String errorKind;
    String errorMessage;
    String messageId;
    String contentHash;

    public static double ratio(int scopeSize, long activePopulation, boolean fullScope) {
        if (fullScope || activePopulation <= 0) {
            return 1.0;
        }
        return Math.min(1.0, scopeSize / (double) activePopulation);
    }
}
