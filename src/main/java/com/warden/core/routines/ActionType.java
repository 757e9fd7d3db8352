package com.warden.core.routines;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.warden.core.jobs.ValidationException;

import java.util.Locale;

public enum ActionType {
    /** A short generic-worker job built from a single prompt. */
    LIGHTWEIGHT("lightweight"),
    /** A full job spec. */
    FULL_JOB("full_job");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ActionType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return LIGHTWEIGHT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ActionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown action_type: " + value + " (expected lightweight or full_job)");
    }
}
