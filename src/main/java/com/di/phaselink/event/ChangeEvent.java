package com.di.phaselink.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Emitted when a stage completes. Immutable once published; {@code contentHash} fingerprints the
 * output so an unchanged re-run can be told apart from genuinely new data.
 */
public record ChangeEvent(
        @JsonProperty("producing_stage") String producingStage,
        @JsonProperty("scope") EventScope scope,
        @JsonProperty("produced_at") Instant producedAt,
        @JsonProperty("content_hash") String contentHash) {

    /** Copy of this event with the scope widened to "all" for the same date. */
    public ChangeEvent withWidenedScope() {
        return new ChangeEvent(producingStage, scope == null ? null : scope.widen(), producedAt, contentHash);
    }
}
