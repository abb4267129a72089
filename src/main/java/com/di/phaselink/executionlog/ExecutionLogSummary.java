package com.di.phaselink.executionlog;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate over a stage's recent invocations; input for tuning the fan-out ceiling and the
 * decision whether narrowed runs are worth it.
 */
@Value
@Builder
public class ExecutionLogSummary {
    String stage;
    int invocations;
    Map<ExecutionOutcome, Long> byOutcome;
    Map<TriggerKind, Long> byTrigger;
    /** Mean scope ratio of successful runs (1.0 = always full scope). */
    double meanScopeRatio;
    double meanDurationMs;
    Instant lastSuccessAt;
}
