package com.di.phaselink.executionlog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records stage invocations and derives per-stage summaries. Pure recorder: nothing here feeds back
 * into scheduling decisions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLogService {

    private final ExecutionLog executionLog;

    public void record(ExecutionLogEntry entry) {
        executionLog.append(entry);
        log.info("[EXECLOG] stage={} trigger={} outcome={} scope={}({}/{}) duration={}ms{}",
                entry.getStage(), entry.getTriggerKind(), entry.getOutcome(), entry.getScopeKind(),
                entry.getScopeSize(), entry.getActivePopulation(), entry.getDurationMs(),
                entry.getErrorKind() != null ? " error=" + entry.getErrorKind() : "");
    }

    public Optional<ExecutionLogEntry> get(String invocationId) {
        return executionLog.findByInvocationId(invocationId);
    }

    public List<ExecutionLogEntry> recent(String stage, int limit) {
        return executionLog.findRecent(stage, limit);
    }

    public Optional<Instant> lastSuccessfulStart(String stage) {
        return executionLog.lastSuccessfulStart(stage);
    }

    public ExecutionLogSummary summarize(String stage, int window) {
        List<ExecutionLogEntry> entries = executionLog.findRecent(stage, window);
        Map<ExecutionOutcome, Long> byOutcome = new EnumMap<>(ExecutionOutcome.class);
        Map<TriggerKind, Long> byTrigger = new EnumMap<>(TriggerKind.class);
        double ratioSum = 0;
        double durationSum = 0;
        int successes = 0;
        Instant lastSuccess = null;
        for (ExecutionLogEntry e : entries) {
            if (e.getOutcome() != null) {
                byOutcome.merge(e.getOutcome(), 1L, Long::sum);
            }
            if (e.getTriggerKind() != null) {
                byTrigger.merge(e.getTriggerKind(), 1L, Long::sum);
            }
            if (e.getOutcome() == ExecutionOutcome.SUCCESS) {
                successes++;
                ratioSum += e.getScopeRatio();
                durationSum += e.getDurationMs();
                if (lastSuccess == null || (e.getStartedAt() != null && e.getStartedAt().isAfter(lastSuccess))) {
                    lastSuccess = e.getStartedAt();
                }
            }
        }
        return ExecutionLogSummary.builder()
                .stage(stage)
                .invocations(entries.size())
                .byOutcome(byOutcome)
                .byTrigger(byTrigger)
                .meanScopeRatio(successes == 0 ? 0.0 : ratioSum / successes)
                .meanDurationMs(successes == 0 ? 0.0 : durationSum / successes)
                .lastSuccessAt(lastSuccess)
                .build();
    }
}
