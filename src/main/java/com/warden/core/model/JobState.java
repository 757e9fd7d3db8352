package com.warden.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stored lifecycle state of a job.
 * <p>
 * "Stuck" is not a state: it is derived at query time from
 * {@link Job#isStuck(java.time.Instant, java.time.Duration)}.
 */
public enum JobState {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    INTERRUPTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == INTERRUPTED || this == CANCELLED;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * Legal edges out of this state. The {@code PENDING -> PENDING} creation record
     * is not an edge: it only ever appears as the first transition.
     */
    public Set<JobState> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, FAILED, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, INTERRUPTED, CANCELLED);
            default -> EnumSet.noneOf(JobState.class);
        };
    }

    public boolean canTransitionTo(JobState target) {
        return allowedTargets().contains(target);
    }
}
