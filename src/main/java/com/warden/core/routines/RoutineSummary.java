package com.warden.core.routines;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoutineSummary(
    long total,
    long enabled,
    long disabled,
    long failing,
    @JsonProperty("runs_today") long runsToday
) {
}
