package com.warden.core.model;

/**
 * Outcome attached to a job once it reaches a terminal state.
 *
 * @param success   whether the work succeeded
 * @param message   human-readable summary, always present on terminal jobs
 * @param sessionId coding-agent session reference, when the bridge reported one
 */
public record JobResult(
    boolean success,
    String message,
    String sessionId
) {

    public static JobResult success(String message) {
        return new JobResult(true, message, null);
    }

    public static JobResult failure(String message) {
        return new JobResult(false, message, null);
    }
}
