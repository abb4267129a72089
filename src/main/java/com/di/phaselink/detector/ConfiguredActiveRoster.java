package com.di.phaselink.detector;

import com.di.phaselink.config.PipelineTopology;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Roster from the topology file; the same entities are active on every date. */
@Component
@ConditionalOnProperty(name = "phaselink.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class ConfiguredActiveRoster implements ActiveRoster {

    private final Set<EntityKey> roster;

    public ConfiguredActiveRoster(PipelineTopology topology) {
        this.roster = Collections.unmodifiableSet(new LinkedHashSet<>(topology.getRoster()));
    }

    @Override
    public Set<EntityKey> activeOn(LocalDate date) {
        return roster;
    }
}
