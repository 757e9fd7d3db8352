package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of a worker event: {@code {"event_type": "...", "payload": {...}}}.
 */
public record EventRequest(
    @JsonProperty("event_type") String eventType,
    Map<String, Object> payload
) {
}
