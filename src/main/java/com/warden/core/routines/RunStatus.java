package com.warden.core.routines;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    PENDING("pending"),
    OK("ok"),
    FAILED("failed");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
