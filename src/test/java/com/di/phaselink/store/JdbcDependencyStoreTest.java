package com.di.phaselink.store;

import com.di.phaselink.exception.ErrorKind;
import com.di.phaselink.exception.StoreUnavailableException;
import com.di.phaselink.sql.SqlQueriesProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("JdbcDependencyStore Tests")
class JdbcDependencyStoreTest {

    private JdbcTemplate jdbc;
    private JdbcDependencyStore store;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        SqlQueriesProperties sql = new SqlQueriesProperties();
        sql.getUsage().setInsertHistory("INSERT_HISTORY");
        sql.getUsage().setUpsertLatest("UPSERT_LATEST");
        sql.getUsage().setFindOne("FIND_ONE");
        sql.getUsage().setFindByStage("FIND_BY_STAGE");
        sql.getUsage().setFindHistory("FIND_HISTORY");
        store = new JdbcDependencyStore(jdbc, sql);
    }

    private static SourceUsageRecord record() {
        return SourceUsageRecord.builder()
                .stage("team-game-stats")
                .source("derived.player_game_stats")
                .scopeKey("2024-11-20/2544")
                .lastUpdatedAt(Instant.parse("2024-11-20T23:00:00Z"))
                .rowsFound(1)
                .completenessPct(100.0)
                .build();
    }

    @Test
    @DisplayName("Should report a replaced row when the conditional upsert touched it")
    void testUpsert_Replaced() {
        when(jdbc.update(eq("UPSERT_LATEST"), any(Object[].class))).thenReturn(1);

        assertTrue(store.upsert(record()));
        verify(jdbc).update(eq("INSERT_HISTORY"), any(Object[].class));
    }

    @Test
    @DisplayName("Should report a no-op when the stored row is not older")
    void testUpsert_NotNewer() {
        when(jdbc.update(eq("UPSERT_LATEST"), any(Object[].class))).thenReturn(0);

        assertFalse(store.upsert(record()));
    }

    @Test
    @DisplayName("Should surface database failures as StoreUnavailableException")
    void testUpsert_DatabaseDown() {
        when(jdbc.update(anyString(), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> store.upsert(record()));
        assertEquals(ErrorKind.STORE_UNAVAILABLE, ex.getErrorKind());
        assertTrue(ex.isRetryable());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should surface read failures as StoreUnavailableException")
    void testFind_DatabaseDown() {
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(StoreUnavailableException.class,
                () -> store.find("team-game-stats", "derived.player_game_stats", "2024-11-20/2544"));
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should return empty when no row matches")
    void testFind_Missing() {
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of());

        assertTrue(store.find("team-game-stats", "derived.player_game_stats", "2024-11-20/2544").isEmpty());
    }
}
