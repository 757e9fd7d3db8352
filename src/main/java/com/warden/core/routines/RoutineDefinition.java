package com.warden.core.routines;

/**
 * Operator input for a new routine. Null numeric fields take their defaults.
 */
public record RoutineDefinition(
    String name,
    String description,
    Boolean enabled,
    RoutineTrigger trigger,
    RoutineAction action,
    Long cooldownSecs,
    Integer maxConcurrent
) {
}
