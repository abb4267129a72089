package com.di.phaselink.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Latest observation of one source for one consuming stage and scope key
 * ({@code 2024-11-20} or {@code 2024-11-20/1630162}).
 */
@Value
@Builder(toBuilder = true)
public class SourceUsageRecord {

    String stage;
    String source;
    String scopeKey;
    /** When the source data was last observed to change. Orders writes (last-write-wins). */
    Instant lastUpdatedAt;
    long rowsFound;
    /** 0-100. */
    double completenessPct;
    /** Wall-clock time of the write. */
    Instant recordedAt;

    /**
     * rowsFound * 100 / expectedRows, capped at 100. A source with no expectation
     * (expectedRows &lt;= 0) counts as complete.
     */
    public static double completeness(long rowsFound, long expectedRows) {
        if (expectedRows <= 0) {
            return 100.0;
        }
        double pct = rowsFound * 100.0 / expectedRows;
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
