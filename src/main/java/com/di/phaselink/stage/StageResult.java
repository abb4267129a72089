package com.di.phaselink.stage;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StageResult {
    long rowsWritten;
    /** Fingerprint of the output; derived from stage and scope when null. */
    String contentHash;
    /** Entities whose output actually changed; null or empty = every entity of the invocation scope. */
    List<String> changedEntityIds;

    public static StageResult of(long rowsWritten) {
        return StageResult.builder().rowsWritten(rowsWritten).build();
    }
}
