package com.di.phaselink.detector;

import java.time.LocalDate;
import java.util.Set;

/** Entities active on a date (players on a roster, teams with a game). */
public interface ActiveRoster {

    Set<EntityKey> activeOn(LocalDate date);

    default long populationOn(LocalDate date) {
        return activeOn(date).size();
    }
}
