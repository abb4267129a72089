package com.di.phaselink.config;

/** How usage records for a source are keyed. */
public enum SourceGranularity {
    /** One record per date ({@code 2024-11-20}). */
    DATE,
    /** One record per date and entity ({@code 2024-11-20/1630162}). */
    ENTITY
}
