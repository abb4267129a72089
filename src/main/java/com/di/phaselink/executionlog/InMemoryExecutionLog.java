package com.di.phaselink.executionlog;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ExecutionLog. Suitable for single-node and testing.
 * When phaselink.persistence-enabled=true, JdbcExecutionLog is used instead.
 */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryExecutionLog implements ExecutionLog {

    private final Map<String, ExecutionLogEntry> byInvocationId = new ConcurrentHashMap<>();
    private final List<ExecutionLogEntry> insertionOrder = new ArrayList<>();

    @Override
    public void append(ExecutionLogEntry entry) {
        if (entry == null || entry.getInvocationId() == null) return;
        if (byInvocationId.putIfAbsent(entry.getInvocationId(), entry) != null) {
            return;
        }
        synchronized (insertionOrder) {
            insertionOrder.add(entry);
        }
    }

    @Override
    public Optional<ExecutionLogEntry> findByInvocationId(String invocationId) {
        return Optional.ofNullable(invocationId == null ? null : byInvocationId.get(invocationId));
    }

    @Override
    public List<ExecutionLogEntry> findRecent(String stage, int limit) {
        List<ExecutionLogEntry> out = new ArrayList<>();
        synchronized (insertionOrder) {
            for (int i = insertionOrder.size() - 1; i >= 0 && out.size() < Math.max(1, limit); i--) {
                ExecutionLogEntry e = insertionOrder.get(i);
                if (stage == null || stage.equals(e.getStage())) {
                    out.add(e);
                }
            }
        }
        return out;
    }

    @Override
    public Optional<Instant> lastSuccessfulStart(String stage) {
        Instant latest = null;
        synchronized (insertionOrder) {
            for (ExecutionLogEntry e : insertionOrder) {
                if (e.getOutcome() == ExecutionOutcome.SUCCESS && stage.equals(e.getStage())
                        && (latest == null || e.getStartedAt().isAfter(latest))) {
                    latest = e.getStartedAt();
                }
            }
        }
        return Optional.ofNullable(latest);
    }
}
