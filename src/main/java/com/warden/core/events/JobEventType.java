package com.warden.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.warden.core.jobs.ValidationException;

import java.util.Locale;

/**
 * The event vocabulary shared by both worker entrypoints.
 */
public enum JobEventType {
    MESSAGE("message"),
    TOOL_USE("tool_use"),
    TOOL_RESULT("tool_result"),
    STATUS("status"),
    /** Always the last event of a job, emitted exactly once. */
    RESULT("result");

    private final String wireName;

    JobEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static JobEventType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("event_type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobEventType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown event_type: " + value);
    }
}
