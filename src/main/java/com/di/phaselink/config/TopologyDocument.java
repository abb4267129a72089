package com.di.phaselink.config;

import com.di.phaselink.detector.DependencyEdge;
import com.di.phaselink.detector.EntityKey;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Raw shape of the topology YAML file. */
@Data
public class TopologyDocument {
    private List<StageDescriptor> stages = new ArrayList<>();
    private List<DependencyEdge> edges = new ArrayList<>();
    /** Entities active on every date; used when no roster table is configured. */
    private List<EntityKey> roster = new ArrayList<>();
}
