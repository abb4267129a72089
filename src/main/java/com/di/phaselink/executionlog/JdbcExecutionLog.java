package com.di.phaselink.executionlog;

import com.di.phaselink.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ExecutionLog on the execution_log table.
 * Enable with phaselink.persistence-enabled=true and a configured datasource.
 */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "true")
public class JdbcExecutionLog implements ExecutionLog {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcExecutionLog(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<ExecutionLogEntry> ROW_MAPPER = (rs, rowNum) -> {
        Date scopeDate = rs.getDate("scope_date");
        String trigger = rs.getString("trigger_kind");
        String outcome = rs.getString("outcome");
        return ExecutionLogEntry.builder()
                .invocationId(rs.getString("invocation_id"))
                .stage(rs.getString("stage"))
                .triggerKind(trigger != null ? TriggerKind.valueOf(trigger) : null)
                .scopeDate(scopeDate != null ? scopeDate.toLocalDate() : null)
                .scopeKind(rs.getString("scope_kind"))
                .scopeSize(rs.getInt("scope_size"))
                .activePopulation(rs.getLong("active_population"))
                .scopeRatio(rs.getDouble("scope_ratio"))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .durationMs(rs.getLong("duration_ms"))
                .outcome(outcome != null ? ExecutionOutcome.valueOf(outcome) : null)
                .errorKind(rs.getString("error_kind"))
                .errorMessage(rs.getString("error_message"))
                .messageId(rs.getString("message_id"))
                .contentHash(rs.getString("content_hash"))
                .build();
    };

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    @Override
    public void append(ExecutionLogEntry e) {
        if (e == null || e.getInvocationId() == null) return;
        jdbc.update(sql.getExecutionLog().getInsert(),
                e.getInvocationId(),
                e.getStage(),
                e.getTriggerKind() != null ? e.getTriggerKind().name() : null,
                e.getScopeDate() != null ? Date.valueOf(e.getScopeDate()) : null,
                e.getScopeKind(),
                e.getScopeSize(),
                e.getActivePopulation(),
                e.getScopeRatio(),
                e.getStartedAt() != null ? Timestamp.from(e.getStartedAt()) : null,
                e.getDurationMs(),
                e.getOutcome() != null ? e.getOutcome().name() : null,
                e.getErrorKind(),
                e.getErrorMessage(),
                e.getMessageId(),
                e.getContentHash());
    }

    @Override
    public Optional<ExecutionLogEntry> findByInvocationId(String invocationId) {
        if (invocationId == null) return Optional.empty();
        List<ExecutionLogEntry> list = jdbc.query(sql.getExecutionLog().getFindByInvocationId(), ROW_MAPPER, invocationId);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<ExecutionLogEntry> findRecent(String stage, int limit) {
        if (stage == null || stage.isBlank()) {
            return jdbc.query(sql.getExecutionLog().getFindRecent(), ROW_MAPPER, Math.max(1, limit));
        }
        return jdbc.query(sql.getExecutionLog().getFindRecentByStage(), ROW_MAPPER, stage, Math.max(1, limit));
    }

    @Override
    public Optional<Instant> lastSuccessfulStart(String stage) {
        List<Timestamp> list = jdbc.query(sql.getExecutionLog().getFindLastSuccess(),
                (rs, rowNum) -> rs.getTimestamp("started_at"), stage);
        return list.isEmpty() || list.get(0) == null ? Optional.empty() : Optional.of(list.get(0).toInstant());
    }
}
