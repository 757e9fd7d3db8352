package com.warden.core.events;

import java.util.List;

/**
 * Durable, unbounded event history. Sequence numbers are assigned by
 * {@link EventPipeline}, which serializes appends per job.
 */
public interface EventStore {

    void append(JobEvent event);

    /**
     * Events with {@code sequence > since}, ascending, at most {@code limit}.
     */
    List<JobEvent> read(String jobId, long since, int limit);

    /** Highest stored sequence for the job, 0 when there is none. */
    long lastSequence(String jobId);
}
