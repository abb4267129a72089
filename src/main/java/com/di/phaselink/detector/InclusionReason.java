package com.di.phaselink.detector;

public enum InclusionReason {
    /** Named by the triggering event (or active on the date for a date-scoped event). */
    DIRECT,
    /** Reached through one or more dependency edges. */
    TRANSITIVE
}
