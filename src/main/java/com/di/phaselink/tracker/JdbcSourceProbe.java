package com.di.phaselink.tracker;

import com.di.phaselink.config.SourceGranularity;
import com.di.phaselink.config.SourceRequirement;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Probes source tables for row count and latest update time per scope key:
 * {@code SELECT COUNT(*), MAX(updated_at) FROM table WHERE date_col = ?}, grouped by the entity
 * column for entity-keyed sources. Sources without probe metadata (table, dateColumn,
 * updatedAtColumn) are skipped. A key with no rows yields no observation.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "true")
public class JdbcSourceProbe implements SourceProbe {

    /** Table and column names come from configuration and are spliced into SQL. */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbc;

    public JdbcSourceProbe(JdbcTemplate jdbcTemplate) {
        this.jdbc = jdbcTemplate;
    }

    @Override
    public List<SourceObservation> observe(SourceRequirement source, EventScope scope) {
        if (!isProbeable(source) || scope == null || scope.date() == null) {
            return List.of();
        }
        try {
            if (source.getGranularity() == SourceGranularity.ENTITY && scope.isEntityScoped()
                    && source.getEntityColumn() != null) {
                return observeEntities(source, scope);
            }
            return observeDate(source, scope);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("probe of " + source.getName() + " (" + source.getTable() + ") failed", e);
        }
    }

    private List<SourceObservation> observeDate(SourceRequirement source, EventScope scope) {
        String query = String.format("SELECT COUNT(*) AS row_count, MAX(%s) AS last_updated FROM %s WHERE %s = ?",
                source.getUpdatedAtColumn(), source.getTable(), source.getDateColumn());
        List<SourceObservation> out = new ArrayList<>(1);
        jdbc.query(query, rs -> {
            long count = rs.getLong("row_count");
            Timestamp last = rs.getTimestamp("last_updated");
            if (count > 0 && last != null) {
                out.add(new SourceObservation(source.getName(), ScopeKeys.dateKey(scope.date()), last.toInstant(), count));
            }
        }, java.sql.Date.valueOf(scope.date()));
        log.debug("[PROBE] source={} date={} -> {}", source.getName(), scope.date(), out);
        return out;
    }

    private List<SourceObservation> observeEntities(SourceRequirement source, EventScope scope) {
        if (!IDENTIFIER.matcher(source.getEntityColumn()).matches()) {
            throw new IllegalArgumentException("Invalid entity column for source " + source.getName());
        }
        String query = String.format(
                "SELECT %1$s AS entity_id, COUNT(*) AS row_count, MAX(%2$s) AS last_updated FROM %3$s WHERE %4$s = ? GROUP BY %1$s",
                source.getEntityColumn(), source.getUpdatedAtColumn(), source.getTable(), source.getDateColumn());
        Set<String> wanted = new HashSet<>(scope.entityIds());
        List<SourceObservation> out = new ArrayList<>();
        jdbc.query(query, rs -> {
            String id = rs.getString("entity_id");
            Timestamp last = rs.getTimestamp("last_updated");
            if (id != null && wanted.contains(id) && last != null) {
                out.add(new SourceObservation(source.getName(), ScopeKeys.entityKey(scope.date(), id),
                        last.toInstant(), rs.getLong("row_count")));
            }
        }, java.sql.Date.valueOf(scope.date()));
        log.debug("[PROBE] source={} date={} entities={} observed={}", source.getName(), scope.date(), wanted.size(), out.size());
        return out;
    }

    static boolean isProbeable(SourceRequirement source) {
        return source.getTable() != null && source.getDateColumn() != null && source.getUpdatedAtColumn() != null
                && IDENTIFIER.matcher(source.getTable()).matches()
                && IDENTIFIER.matcher(source.getDateColumn()).matches()
                && IDENTIFIER.matcher(source.getUpdatedAtColumn()).matches();
    }
}
