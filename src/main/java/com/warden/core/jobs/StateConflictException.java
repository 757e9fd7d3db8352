package com.warden.core.jobs;

import com.warden.core.model.JobState;

/**
 * An operation is not legal from the job's current state. Surfaced as HTTP 409.
 */
public class StateConflictException extends RuntimeException {

    private final String jobId;
    private final JobState currentState;

    public StateConflictException(String jobId, JobState currentState, String message) {
        super(message);
        this.jobId = jobId;
        this.currentState = currentState;
    }

    public static StateConflictException illegalTransition(String jobId, JobState from, JobState to) {
        return new StateConflictException(jobId, from,
                "Cannot transition job " + jobId + " from " + from + " to " + to);
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getCurrentState() {
        return currentState;
    }
}
