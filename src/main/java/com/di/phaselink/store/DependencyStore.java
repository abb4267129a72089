package com.di.phaselink.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-(stage, source, scope key) record of consumed source state.
 * Implementations: in-memory (default) or JDBC (phaselink.persistence-enabled=true).
 *
 * <p>Writes are idempotent and last-write-wins by {@code lastUpdatedAt}: a record only replaces the
 * stored one when it is strictly newer, so replays and out-of-order redeliveries are no-ops.
 * Every failure to reach the backing store surfaces as
 * {@link com.di.phaselink.exception.StoreUnavailableException}.
 */
public interface DependencyStore {

    /** @return true when the record became the latest for its key. */
    boolean upsert(SourceUsageRecord record);

    Optional<SourceUsageRecord> find(String stage, String source, String scopeKey);

    List<SourceUsageRecord> findByStage(String stage);

    /** Every write accepted or not, newest first. */
    List<SourceUsageRecord> history(String stage, String source, int limit);
}
