package com.warden.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * One ordered observation emitted during a job's life. Never mutated once stored.
 *
 * @param sequence 1-based, gap-free and strictly increasing per job
 */
public record JobEvent(
    String jobId,
    long sequence,
    JobEventType eventType,
    Map<String, Object> payload,
    Instant timestamp
) {

    public JobEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
