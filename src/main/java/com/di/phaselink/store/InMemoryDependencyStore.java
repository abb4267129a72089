package com.di.phaselink.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory DependencyStore. Suitable for single-node and testing.
 * When phaselink.persistence-enabled=true, JdbcDependencyStore is used instead.
 *
 * <p>Same-key writers are serialized by {@link ConcurrentHashMap#compute}; disjoint keys do not contend.
 * Usage history keeps the most recent {@link #DEFAULT_MAX_HISTORY} observations; older ones are dropped.
 */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryDependencyStore implements DependencyStore {

    public static final int DEFAULT_MAX_HISTORY = 10_000;

    private final Map<Key, SourceUsageRecord> latest = new ConcurrentHashMap<>();
    private final Deque<SourceUsageRecord> history = new ConcurrentLinkedDeque<>();
    private final AtomicInteger historySize = new AtomicInteger();
    private final int maxHistory;

    public InMemoryDependencyStore() {
        this(DEFAULT_MAX_HISTORY);
    }

    public InMemoryDependencyStore(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive");
        }
        this.maxHistory = maxHistory;
    }

    private record Key(String stage, String source, String scopeKey) {
    }

    @Override
    public boolean upsert(SourceUsageRecord record) {
        if (record == null || record.getStage() == null || record.getSource() == null || record.getScopeKey() == null) {
            throw new IllegalArgumentException("stage, source and scopeKey are required");
        }
        history.addFirst(record);
        if (historySize.incrementAndGet() > maxHistory && history.pollLast() != null) {
            historySize.decrementAndGet();
        }
        boolean[] replaced = {false};
        latest.compute(new Key(record.getStage(), record.getSource(), record.getScopeKey()), (k, current) -> {
            if (current == null || isNewer(record, current)) {
                replaced[0] = true;
                return record;
            }
            return current;
        });
        return replaced[0];
    }

    private static boolean isNewer(SourceUsageRecord candidate, SourceUsageRecord current) {
        if (current.getLastUpdatedAt() == null) {
            return candidate.getLastUpdatedAt() != null;
        }
        return candidate.getLastUpdatedAt() != null && candidate.getLastUpdatedAt().isAfter(current.getLastUpdatedAt());
    }

    @Override
    public Optional<SourceUsageRecord> find(String stage, String source, String scopeKey) {
        return Optional.ofNullable(latest.get(new Key(stage, source, scopeKey)));
    }

    @Override
    public List<SourceUsageRecord> findByStage(String stage) {
        return latest.values().stream()
                .filter(r -> r.getStage().equals(stage))
                .sorted(Comparator.comparing(SourceUsageRecord::getSource).thenComparing(SourceUsageRecord::getScopeKey))
                .collect(Collectors.toList());
    }

    @Override
    public List<SourceUsageRecord> history(String stage, String source, int limit) {
        List<SourceUsageRecord> out = new ArrayList<>();
        for (SourceUsageRecord r : history) {
            if (out.size() >= Math.max(1, limit)) {
                break;
            }
            if (r.getStage().equals(stage) && r.getSource().equals(source)) {
                out.add(r);
            }
        }
        return out;
    }
}
