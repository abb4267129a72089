package com.di.phaselink.tracker;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.time.Instant;

/** Body of POST /api/dependencies/usage: a stage reporting what it consumed. */
@Data
public class UsageRequest {
    @NotBlank
    private String stage;
    @NotBlank
    private String source;
    @NotBlank
    private String scopeKey;
    @NotNull
    private Instant observedAt;
    @PositiveOrZero
    private long rowsFound;
    private long expectedRows;
}
