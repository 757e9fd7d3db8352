package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.jobs.ValidationException;
import com.warden.core.model.JobMode;
import com.warden.core.model.JobSpec;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/jobs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRequest(
    String title,
    String description,
    String mode,
    @JsonProperty("allowed_domains") List<String> allowedDomains,
    @JsonProperty("credential_grants") Map<String, String> credentialGrants,
    @JsonProperty("max_iterations") Integer maxIterations,
    @JsonProperty("max_turns") Integer maxTurns,
    String model,
    @JsonProperty("project_dir") String projectDir
) {

    public JobSpec toSpec() {
        JobMode parsed;
        try {
            parsed = mode == null || mode.isBlank() ? null : JobMode.fromValue(mode);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        return new JobSpec(title, description, parsed, allowedDomains, credentialGrants,
                maxIterations, maxTurns, model, projectDir, null);
    }
}
