package com.di.phaselink.deadletter;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory DeadLetterStore. Suitable for single-node and testing.
 * When phaselink.persistence-enabled=true, JdbcDeadLetterStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private final Map<String, DeadLetterRecord> byId = new ConcurrentHashMap<>();

    private static final Comparator<DeadLetterRecord> OLDEST_FIRST =
            Comparator.comparing(DeadLetterRecord::getDeadLetteredAt).thenComparing(DeadLetterRecord::getId);

    @Override
    public void save(DeadLetterRecord record) {
        if (record == null || record.getId() == null) return;
        byId.putIfAbsent(record.getId(), record);
    }

    @Override
    public Optional<DeadLetterRecord> findById(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    @Override
    public List<DeadLetterRecord> findByStatus(DeadLetterStatus status, int limit) {
        return byId.values().stream()
                .filter(r -> status == null || r.getStatus() == status)
                .sorted(OLDEST_FIRST)
                .limit(Math.max(1, limit))
                .collect(Collectors.toList());
    }

    @Override
    public long countByStatus(DeadLetterStatus status) {
        return byId.values().stream().filter(r -> r.getStatus() == status).count();
    }

    @Override
    public Optional<DeadLetterRecord> findOldestPending() {
        return byId.values().stream()
                .filter(r -> r.getStatus() == DeadLetterStatus.PENDING)
                .min(OLDEST_FIRST);
    }

    @Override
    public boolean updateStatus(String id, DeadLetterStatus expected, DeadLetterStatus status) {
        boolean[] updated = {false};
        byId.computeIfPresent(id, (k, current) -> {
            if (current.getStatus() != expected) {
                return current;
            }
            updated[0] = true;
            return current.toBuilder().status(status).build();
        });
        return updated[0];
    }
}
