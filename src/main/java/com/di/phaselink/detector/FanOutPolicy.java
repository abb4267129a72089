package com.di.phaselink.detector;

import com.di.phaselink.config.PhaseLinkProperties;
import lombok.Builder;
import lombok.Value;

/** Bounds on change propagation. Exceeding any of them yields the "all" sentinel. */
@Value
@Builder(toBuilder = true)
public class FanOutPolicy {

    int maxEntities;
    double maxHopPopulationPct;
    int maxHops;

    public static FanOutPolicy from(PhaseLinkProperties.FanOut props) {
        return FanOutPolicy.builder()
                .maxEntities(props.getMaxEntities())
                .maxHopPopulationPct(props.getMaxHopPopulationPct())
                .maxHops(props.getMaxHops())
                .build();
    }
}
