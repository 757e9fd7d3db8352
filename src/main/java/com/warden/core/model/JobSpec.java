package com.warden.core.model;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to (re)create a job. Restart clones this verbatim.
 *
 * @param title            short label shown in listings
 * @param description      the task handed to the worker
 * @param mode             which worker entrypoint to run
 * @param allowedDomains   operator-declared egress domains
 * @param credentialGrants domain to credential reference; the proxy resolves the reference
 * @param maxIterations    iteration bound for the generic worker
 * @param maxTurns         turn bound for the coding bridge
 * @param model            model name passed to the coding bridge
 * @param projectDir       project directory name under the projects root
 * @param routineId        originating routine, null for direct requests
 */
public record JobSpec(
    String title,
    String description,
    JobMode mode,
    List<String> allowedDomains,
    Map<String, String> credentialGrants,
    Integer maxIterations,
    Integer maxTurns,
    String model,
    String projectDir,
    String routineId
) {

    public JobSpec {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
        credentialGrants = credentialGrants == null ? Map.of() : Map.copyOf(credentialGrants);
    }

    public static JobSpec of(String title, String description, JobMode mode) {
        return new JobSpec(title, description, mode, List.of(), Map.of(), null, null, null, null, null);
    }

    public JobSpec withAllowedDomains(List<String> domains) {
        return new JobSpec(title, description, mode, domains, credentialGrants,
                maxIterations, maxTurns, model, projectDir, routineId);
    }

    public JobSpec withCredentialGrants(Map<String, String> grants) {
        return new JobSpec(title, description, mode, allowedDomains, grants,
                maxIterations, maxTurns, model, projectDir, routineId);
    }

    public JobSpec withMaxIterations(Integer value) {
        return new JobSpec(title, description, mode, allowedDomains, credentialGrants,
                value, maxTurns, model, projectDir, routineId);
    }

    public JobSpec withRoutineId(String value) {
        return new JobSpec(title, description, mode, allowedDomains, credentialGrants,
                maxIterations, maxTurns, model, projectDir, value);
    }
}
