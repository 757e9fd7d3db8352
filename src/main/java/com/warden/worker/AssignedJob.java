package com.warden.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The job as a worker sees it, fetched from {@code GET /internal/jobs/{id}/spec}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssignedJob(
    @JsonProperty("job_id") String jobId,
    String title,
    String description,
    String mode,
    @JsonProperty("max_iterations") Integer maxIterations,
    @JsonProperty("max_turns") Integer maxTurns,
    String model,
    @JsonProperty("allowed_domains") List<String> allowedDomains
) {
}
