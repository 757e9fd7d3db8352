package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.model.Job;
import com.warden.core.model.JobResult;
import com.warden.core.model.Transition;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Job detail returned by the control API. Credential grants are references, never values.
 */
public record JobResponse(
    @JsonProperty("job_id") String jobId,
    String title,
    String description,
    String mode,
    String state,
    boolean stuck,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("last_activity_at") Instant lastActivityAt,
    @JsonProperty("elapsed_secs") long elapsedSecs,
    @JsonProperty("allowed_domains") List<String> allowedDomains,
    @JsonProperty("credential_grants") Map<String, String> credentialGrants,
    @JsonProperty("max_iterations") Integer maxIterations,
    @JsonProperty("max_turns") Integer maxTurns,
    String model,
    @JsonProperty("project_dir") String projectDir,
    @JsonProperty("routine_id") String routineId,
    @JsonProperty("restarted_from") String restartedFrom,
    @JsonProperty("browse_url") String browseUrl,
    JobResult result,
    List<Transition> transitions
) {

    public static JobResponse from(Job job, Instant now, boolean stuck) {
        var spec = job.spec();
        return new JobResponse(
                job.id(),
                spec.title(),
                spec.description(),
                spec.mode().wireName(),
                job.state().name(),
                stuck,
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.lastActivityAt(),
                job.elapsedSeconds(now),
                spec.allowedDomains(),
                spec.credentialGrants(),
                spec.maxIterations(),
                spec.maxTurns(),
                spec.model(),
                spec.projectDir(),
                spec.routineId(),
                job.restartedFrom(),
                job.browseUrl(),
                job.result(),
                job.transitions()
        );
    }
}
