package com.di.phaselink.tracker;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a readiness check. Entries are {@code source@scopeKey}. Only the critical-source
 * lists (missing, below threshold, stale beyond fail age) make a scope not ready.
 */
@Value
@Builder
public class ReadinessReport {

    String stage;
    String scope;
    List<String> missing;
    List<String> belowThreshold;
    List<String> staleFail;
    List<String> staleWarn;
    List<String> optionalMissing;

    public static ReadinessReport notReady(String stage, String scope, String reason) {
        return ReadinessReport.builder()
                .stage(stage).scope(scope)
                .missing(List.of(reason))
                .belowThreshold(List.of()).staleFail(List.of()).staleWarn(List.of()).optionalMissing(List.of())
                .build();
    }

    public boolean isReady() {
        return missing.isEmpty() && belowThreshold.isEmpty() && staleFail.isEmpty();
    }

    /** Distinct source names that block the run. */
    public List<String> blockingSources() {
        Set<String> names = new LinkedHashSet<>();
        for (List<String> list : List.of(missing, belowThreshold, staleFail)) {
            for (String entry : list) {
                int at = entry.indexOf('@');
                names.add(at >= 0 ? entry.substring(0, at) : entry);
            }
        }
        return List.copyOf(names);
    }
}
