package com.di.phaselink.config;

/** Finest scope a stage can be invoked with. */
public enum EntityGranularity {
    /** Always processes a whole date. */
    DATE_ONLY,
    /** Accepts a date plus an explicit entity list. */
    DATE_AND_ENTITIES
}
