package com.di.phaselink.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * A source a stage reads, with the thresholds that gate readiness.
 * Only {@link #critical} sources block a run; optional ones are reported.
 */
@Value
@Builder
@Jacksonized
public class SourceRequirement {

    String name;

    /** Minimum completeness (0-100). Exactly-at-threshold counts as ready. */
    @Builder.Default
    double minCompletenessPct = 100.0;

    /** Expected row count per scope key; completeness is measured against it. */
    @Builder.Default
    long expectedRows = 1;

    @Builder.Default
    boolean critical = true;

    @Builder.Default
    SourceGranularity granularity = SourceGranularity.DATE;

    /** Older than this: logged as stale. Null = no check. */
    Duration maxAgeWarn;

    /** Older than this: not ready. Null = no check. */
    Duration maxAgeFail;

    // ---- probe metadata (JdbcSourceProbe) ----
    String table;
    String dateColumn;
    String entityColumn;
    String updatedAtColumn;
}
