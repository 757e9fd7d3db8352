package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dashboard counts by state. {@code stuck} overlaps {@code inProgress}.
 */
public record JobSummary(
    long total,
    long pending,
    @JsonProperty("in_progress") long inProgress,
    long completed,
    long failed,
    long interrupted,
    long cancelled,
    long stuck
) {
}
