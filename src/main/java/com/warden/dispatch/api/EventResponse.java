package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.events.JobEvent;

import java.time.Instant;
import java.util.Map;

public record EventResponse(
    @JsonProperty("job_id") String jobId,
    long sequence,
    @JsonProperty("event_type") String eventType,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static EventResponse from(JobEvent event) {
        return new EventResponse(event.jobId(), event.sequence(), event.eventType().wireName(),
                event.payload(), event.timestamp());
    }
}
