package com.di.phaselink.deadletter;

import com.di.phaselink.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of DeadLetterStore on the dead_letter table. Attributes are stored as JSON
 * text, the payload as bytes. Enable with phaselink.persistence-enabled=true.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "true")
public class JdbcDeadLetterStore implements DeadLetterStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcDeadLetterStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private final RowMapper<DeadLetterRecord> rowMapper = (rs, rowNum) -> {
        Timestamp at = rs.getTimestamp("dead_lettered_at");
        return DeadLetterRecord.builder()
                .id(rs.getString("id"))
                .sourceTopic(rs.getString("source_topic"))
                .subscription(rs.getString("subscription"))
                .messageId(rs.getString("message_id"))
                .payload(rs.getBytes("payload"))
                .attributes(readAttributes(rs.getString("attributes")))
                .lastError(rs.getString("last_error"))
                .errorKind(rs.getString("error_kind"))
                .attempts(rs.getInt("attempts"))
                .deadLetteredAt(at != null ? at.toInstant() : null)
                .status(DeadLetterStatus.valueOf(rs.getString("status")))
                .build();
    };

    private static Map<String, String> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[DLQ] Unreadable attributes column: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static String writeAttributes(Map<String, String> attributes) {
        try {
            return MAPPER.writeValueAsString(attributes == null ? Map.of() : attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize dead-letter attributes", e);
        }
    }

    @Override
    public void save(DeadLetterRecord r) {
        if (r == null || r.getId() == null) return;
        jdbc.update(sql.getDeadLetter().getInsert(),
                r.getId(),
                r.getSourceTopic(),
                r.getSubscription(),
                r.getMessageId(),
                r.getPayload(),
                writeAttributes(r.getAttributes()),
                r.getLastError(),
                r.getErrorKind(),
                r.getAttempts(),
                r.getDeadLetteredAt() != null ? Timestamp.from(r.getDeadLetteredAt()) : null,
                r.getStatus().name());
    }

    @Override
    public Optional<DeadLetterRecord> findById(String id) {
        if (id == null) return Optional.empty();
        List<DeadLetterRecord> list = jdbc.query(sql.getDeadLetter().getFindById(), rowMapper, id);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<DeadLetterRecord> findByStatus(DeadLetterStatus status, int limit) {
        // the query treats a null status parameter as "any"
        String statusName = status != null ? status.name() : null;
        return jdbc.query(sql.getDeadLetter().getFindByStatus(), rowMapper, statusName, statusName, Math.max(1, limit));
    }

    @Override
    public long countByStatus(DeadLetterStatus status) {
        Long count = jdbc.queryForObject(sql.getDeadLetter().getCountByStatus(), Long.class, status.name());
        return count != null ? count : 0L;
    }

    @Override
    public Optional<DeadLetterRecord> findOldestPending() {
        List<DeadLetterRecord> list = jdbc.query(sql.getDeadLetter().getFindOldestPending(), rowMapper);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public boolean updateStatus(String id, DeadLetterStatus expected, DeadLetterStatus status) {
        return jdbc.update(sql.getDeadLetter().getUpdateStatus(), status.name(), status.name(), id, expected.name()) > 0;
    }
}
