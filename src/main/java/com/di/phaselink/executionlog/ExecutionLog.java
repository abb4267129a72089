package com.di.phaselink.executionlog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only record of stage invocations. Implementations can be in-memory or JDBC
 * (see V1__dependency_tracking.sql).
 */
public interface ExecutionLog {

    void append(ExecutionLogEntry entry);

    Optional<ExecutionLogEntry> findByInvocationId(String invocationId);

    /** Newest first; null stage = all stages. */
    List<ExecutionLogEntry> findRecent(String stage, int limit);

    /** Start time of the stage's last successful invocation, empty when it never succeeded. */
    Optional<Instant> lastSuccessfulStart(String stage);
}
