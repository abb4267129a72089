package com.di.phaselink.stage;

import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.executionlog.TriggerKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/** What a processor is asked to do: a full date, or only the listed entities of that date. */
@Value
@Builder
public class StageInvocation {
    String invocationId;
    String stage;
    TriggerKind triggerKind;
    LocalDate date;
    /** Null for a full-date run. */
    List<String> entityIds;
    /** Required sources that changed since the stage last succeeded (empty when unknown). */
    Set<String> changedSources;
    ChangeEvent triggeringEvent;

    public boolean isFullScope() {
        return entityIds == null;
    }
}
