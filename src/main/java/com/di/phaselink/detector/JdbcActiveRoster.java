package com.di.phaselink.detector;

import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.exception.StoreUnavailableException;
import com.di.phaselink.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Roster from the active_entities table (one row per entity and active date). Dates with no rows
 * fall back to the roster in the topology file.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "true")
public class JdbcActiveRoster implements ActiveRoster {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final Set<EntityKey> configured;

    public JdbcActiveRoster(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, PipelineTopology topology) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.configured = Collections.unmodifiableSet(new LinkedHashSet<>(topology.getRoster()));
    }

    @Override
    public Set<EntityKey> activeOn(LocalDate date) {
        if (date == null) {
            return configured;
        }
        try {
            List<EntityKey> rows = jdbc.query(sql.getRoster().getFindActiveOn(),
                    (rs, rowNum) -> new EntityKey(rs.getString("entity_type"), rs.getString("entity_id")),
                    Date.valueOf(date));
            if (rows.isEmpty()) {
                log.debug("[ROSTER] No active_entities rows for {}; using configured roster ({})", date, configured.size());
                return configured;
            }
            return new LinkedHashSet<>(rows);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("active_entities read failed for " + date, e);
        }
    }
}
