package com.di.phaselink.tracker;

import com.di.phaselink.config.SourceRequirement;
import com.di.phaselink.event.EventScope;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Used when persistence is disabled: sources are not probed, usage is reported by the stages
 * themselves (REST or {@link DependencyTracker#recordUsage}).
 */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSourceProbe implements SourceProbe {

    @Override
    public List<SourceObservation> observe(SourceRequirement source, EventScope scope) {
        return List.of();
    }
}
