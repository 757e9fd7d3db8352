package com.warden.core.routines;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.warden.core.jobs.ValidationException;

import java.util.Locale;

public enum TriggerType {
    CRON("cron"),
    EVENT("event"),
    WEBHOOK("webhook"),
    MANUAL("manual");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TriggerType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("trigger_type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TriggerType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown trigger_type: " + value + " (expected cron, event, webhook or manual)");
    }
}
