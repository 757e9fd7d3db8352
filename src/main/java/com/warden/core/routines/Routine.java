package com.warden.core.routines;

import java.time.Instant;

/**
 * A standing trigger-to-job template.
 * <p>
 * {@code lastRunAt}, {@code runCount}, {@code consecutiveFailures} and {@code nextFireAt}
 * are only changed by {@link RoutineScheduler}.
 */
public record Routine(
    String id,
    String name,
    String description,
    boolean enabled,
    RoutineTrigger trigger,
    RoutineAction action,
    long cooldownSecs,
    int maxConcurrent,
    long runCount,
    int consecutiveFailures,
    Instant lastRunAt,
    Instant nextFireAt,
    Instant createdAt
) {

    public RoutineStatus status() {
        if (!enabled) {
            return RoutineStatus.DISABLED;
        }
        return consecutiveFailures > 0 ? RoutineStatus.FAILING : RoutineStatus.ACTIVE;
    }

    /** True while {@code now} is before {@code lastRunAt + cooldownSecs}. */
    public boolean coolingDownAt(Instant now) {
        return lastRunAt != null && now.isBefore(lastRunAt.plusSeconds(cooldownSecs));
    }

    public Routine withEnabled(boolean value, Instant next) {
        return new Routine(id, name, description, value, trigger, action, cooldownSecs, maxConcurrent,
                runCount, consecutiveFailures, lastRunAt, next, createdAt);
    }

    public Routine withNextFireAt(Instant next) {
        return new Routine(id, name, description, enabled, trigger, action, cooldownSecs, maxConcurrent,
                runCount, consecutiveFailures, lastRunAt, next, createdAt);
    }

    public Routine fired(Instant now, Instant next) {
        return new Routine(id, name, description, enabled, trigger, action, cooldownSecs, maxConcurrent,
                runCount + 1, consecutiveFailures, now, next, createdAt);
    }

    public Routine withOutcome(boolean success) {
        int failures = success ? 0 : consecutiveFailures + 1;
        return new Routine(id, name, description, enabled, trigger, action, cooldownSecs, maxConcurrent,
                runCount, failures, lastRunAt, nextFireAt, createdAt);
    }
}
