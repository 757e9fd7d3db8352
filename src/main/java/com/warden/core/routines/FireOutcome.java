package com.warden.core.routines;

/**
 * What a trigger did: started a run, or was skipped and why.
 *
 * @param skipReason {@code disabled}, {@code cooldown} or {@code max_concurrent}; null when fired
 */
public record FireOutcome(boolean fired, String routineId, RoutineRun run, String skipReason) {

    public static FireOutcome fired(String routineId, RoutineRun run) {
        return new FireOutcome(true, routineId, run, null);
    }

    public static FireOutcome skipped(String routineId, String reason) {
        return new FireOutcome(false, routineId, null, reason);
    }
}
