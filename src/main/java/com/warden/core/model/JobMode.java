package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which worker entrypoint runs inside the sandbox.
 */
public enum JobMode {
    /** Generic tool-calling agent loop ({@code warden worker}). */
    WORKER("worker"),
    /** Bridge driving the coding-agent CLI ({@code warden claude-bridge}). */
    CLAUDE_CODE("claude_code");

    private final String wireName;

    JobMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a mode from its wire name or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    @JsonCreator
    public static JobMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("mode is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (JobMode mode : values()) {
            if (mode.wireName.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return mode;
            }
        }
        if ("generic".equals(normalized) || "generic_worker".equals(normalized)) {
            return WORKER;
        }
        if ("bridge".equals(normalized) || "coding_bridge".equals(normalized)) {
            return CLAUDE_CODE;
        }
        throw new IllegalArgumentException("Unknown job mode: " + value);
    }
}
