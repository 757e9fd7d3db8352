package com.warden.core.routines;

import com.warden.core.model.JobMode;
import com.warden.core.model.JobSpec;

import java.util.List;
import java.util.Map;

/**
 * The job a routine launches when it fires.
 */
public record RoutineAction(
    ActionType type,
    String prompt,
    String title,
    JobMode mode,
    Integer maxIterations,
    List<String> allowedDomains,
    Map<String, String> credentialGrants
) {

    public RoutineAction {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
        credentialGrants = credentialGrants == null ? Map.of() : Map.copyOf(credentialGrants);
    }

    public static RoutineAction lightweight(String prompt) {
        return new RoutineAction(ActionType.LIGHTWEIGHT, prompt, null, JobMode.WORKER, null, List.of(), Map.of());
    }

    /**
     * Builds the job spec for one fire. Lightweight actions always run the generic worker
     * with a small iteration bound.
     */
    JobSpec toJobSpec(Routine routine, RoutineProperties properties) {
        if (type == ActionType.LIGHTWEIGHT) {
            return new JobSpec(routine.name(), prompt, JobMode.WORKER, allowedDomains, credentialGrants,
                    properties.getLightweightMaxIterations(), null, null, null, routine.id());
        }
        String jobTitle = title != null && !title.isBlank() ? title : routine.name();
        JobMode jobMode = mode != null ? mode : JobMode.WORKER;
        Integer iterations = maxIterations != null ? maxIterations : properties.getFullJobMaxIterations();
        return new JobSpec(jobTitle, prompt, jobMode, allowedDomains, credentialGrants,
                iterations, null, null, null, routine.id());
    }
}
