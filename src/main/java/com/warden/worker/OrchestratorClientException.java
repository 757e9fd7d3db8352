package com.warden.worker;

/**
 * A call to the orchestrator's internal API failed.
 */
public class OrchestratorClientException extends RuntimeException {

    private final int status;

    public OrchestratorClientException(int status, String message) {
        super(message);
        this.status = status;
    }

    public OrchestratorClientException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatus() {
        return status;
    }

    /** The orchestrator considers the job finished and refuses further events. */
    public boolean isConflict() {
        return status == 409;
    }
}
