package com.warden.core.model;

import java.time.Instant;

/**
 * One entry in a job's transition history.
 */
public record Transition(
    JobState from,
    JobState to,
    Instant timestamp,
    String reason
) {
}
