package com.warden.core.model;

/**
 * Listing filter. {@code state} accepts any {@link JobState} name or the derived label "stuck".
 */
public record JobFilter(
    String state,
    JobMode mode,
    String routineId,
    Integer limit
) {

    public static JobFilter all() {
        return new JobFilter(null, null, null, null);
    }
}
