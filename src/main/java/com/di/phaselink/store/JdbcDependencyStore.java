package com.di.phaselink.store;

import com.di.phaselink.exception.StoreUnavailableException;
import com.di.phaselink.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of DependencyStore. Latest-wins rows live in source_usage (unique on
 * stage, source, scope_key); every write is also appended to source_usage_history.
 * The upsert only replaces a row whose last_updated_at is strictly older, so the database
 * performs the per-key compare-and-swap. Enable with phaselink.persistence-enabled=true.
 */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "true")
public class JdbcDependencyStore implements DependencyStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcDependencyStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<SourceUsageRecord> ROW_MAPPER = (rs, rowNum) -> SourceUsageRecord.builder()
            .stage(rs.getString("stage"))
            .source(rs.getString("source"))
            .scopeKey(rs.getString("scope_key"))
            .lastUpdatedAt(toInstant(rs.getTimestamp("last_updated_at")))
            .rowsFound(rs.getLong("rows_found"))
            .completenessPct(rs.getDouble("completeness_pct"))
            .recordedAt(toInstant(rs.getTimestamp("recorded_at")))
            .build();

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    @Transactional
    public boolean upsert(SourceUsageRecord record) {
        if (record == null || record.getStage() == null || record.getSource() == null || record.getScopeKey() == null) {
            throw new IllegalArgumentException("stage, source and scopeKey are required");
        }
        Timestamp recordedAt = toTimestamp(record.getRecordedAt() != null ? record.getRecordedAt() : Instant.now());
        try {
            jdbc.update(sql.getUsage().getInsertHistory(),
                    record.getStage(), record.getSource(), record.getScopeKey(),
                    toTimestamp(record.getLastUpdatedAt()), record.getRowsFound(), record.getCompletenessPct(),
                    recordedAt);
            int rows = jdbc.update(sql.getUsage().getUpsertLatest(),
                    record.getStage(), record.getSource(), record.getScopeKey(),
                    toTimestamp(record.getLastUpdatedAt()), record.getRowsFound(), record.getCompletenessPct(),
                    recordedAt);
            return rows > 0;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("source_usage write failed for " + record.getStage()
                    + "/" + record.getSource() + "/" + record.getScopeKey(), e);
        }
    }

    @Override
    public Optional<SourceUsageRecord> find(String stage, String source, String scopeKey) {
        try {
            List<SourceUsageRecord> list = jdbc.query(sql.getUsage().getFindOne(), ROW_MAPPER, stage, source, scopeKey);
            return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("source_usage read failed for " + stage + "/" + source, e);
        }
    }

    @Override
    public List<SourceUsageRecord> findByStage(String stage) {
        try {
            return jdbc.query(sql.getUsage().getFindByStage(), ROW_MAPPER, stage);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("source_usage read failed for " + stage, e);
        }
    }

    @Override
    public List<SourceUsageRecord> history(String stage, String source, int limit) {
        try {
            return jdbc.query(sql.getUsage().getFindHistory(), ROW_MAPPER, stage, source, Math.max(1, limit));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("source_usage_history read failed for " + stage + "/" + source, e);
        }
    }
}
