package com.warden.core.routines;

import java.time.Instant;

/**
 * One fire attempt. Recorded as {@link RunStatus#PENDING} at fire time and completed when
 * the linked job reaches a terminal state.
 */
public record RoutineRun(
    String id,
    String routineId,
    TriggerType triggerType,
    Instant startedAt,
    Instant completedAt,
    RunStatus status,
    String summary,
    String jobId
) {

    public RoutineRun completed(RunStatus outcome, String resultSummary, Instant now) {
        return new RoutineRun(id, routineId, triggerType, startedAt, now, outcome, resultSummary, jobId);
    }
}
