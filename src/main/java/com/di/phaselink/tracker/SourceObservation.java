package com.di.phaselink.tracker;

import java.time.Instant;

/** Current state of a source for one scope key, as seen by a {@link SourceProbe}. */
public record SourceObservation(String source, String scopeKey, Instant observedAt, long rowsFound) {
}
