package com.warden.core.routines;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived from {@link Routine#enabled()} and {@link Routine#consecutiveFailures()}; never stored.
 */
public enum RoutineStatus {
    ACTIVE("active"),
    FAILING("failing"),
    DISABLED("disabled");

    private final String wireName;

    RoutineStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
