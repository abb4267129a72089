package com.di.phaselink.tracker;

import com.di.phaselink.config.SourceRequirement;
import com.di.phaselink.event.EventScope;

import java.util.List;

/**
 * Observes the current state of a stage's sources before a run. Observations are written through
 * {@link DependencyTracker#recordUsage} so readiness is judged on fresh data.
 */
public interface SourceProbe {

    /** @return observations for the keys this probe can see; empty when the source is not probeable. */
    List<SourceObservation> observe(SourceRequirement source, EventScope scope);
}
