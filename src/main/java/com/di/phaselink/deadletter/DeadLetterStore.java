package com.di.phaselink.deadletter;

import java.util.List;
import java.util.Optional;

/** Persistence for dead-lettered messages: in-memory or JDBC (dead_letter table). */
public interface DeadLetterStore {

    void save(DeadLetterRecord record);

    Optional<DeadLetterRecord> findById(String id);

    /** Oldest first; null status = every status. */
    List<DeadLetterRecord> findByStatus(DeadLetterStatus status, int limit);

    long countByStatus(DeadLetterStatus status);

    Optional<DeadLetterRecord> findOldestPending();

    /** @return false when no record with that id and the expected status exists */
    boolean updateStatus(String id, DeadLetterStatus expected, DeadLetterStatus status);
}
