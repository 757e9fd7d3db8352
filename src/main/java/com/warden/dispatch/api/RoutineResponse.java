package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.routines.Routine;
import com.warden.core.routines.RoutineAction;
import com.warden.core.routines.RoutineRun;
import com.warden.core.routines.RoutineTrigger;

import java.time.Instant;
import java.util.List;

/**
 * Routine as shown by the routine API. The webhook secret is never echoed back.
 */
public record RoutineResponse(
    String id,
    String name,
    String description,
    boolean enabled,
    String status,
    TriggerView trigger,
    ActionView action,
    @JsonProperty("cooldown_secs") long cooldownSecs,
    @JsonProperty("max_concurrent") int maxConcurrent,
    @JsonProperty("run_count") long runCount,
    @JsonProperty("consecutive_failures") int consecutiveFailures,
    @JsonProperty("last_run_at") Instant lastRunAt,
    @JsonProperty("next_fire_at") Instant nextFireAt,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("recent_runs") List<RunView> recentRuns
) {

    public record TriggerView(
        String type,
        String summary,
        String schedule,
        String pattern,
        String channel,
        @JsonProperty("webhook_path") String webhookPath,
        @JsonProperty("has_secret") boolean hasSecret
    ) {
        static TriggerView from(RoutineTrigger trigger) {
            boolean secret = trigger.webhookSecret() != null && !trigger.webhookSecret().isEmpty();
            return new TriggerView(trigger.type().wireName(), trigger.summary(), trigger.schedule(),
                    trigger.pattern(), trigger.channel(), trigger.webhookPath(), secret);
        }
    }

    public record ActionView(
        String type,
        String prompt,
        String title,
        String mode,
        @JsonProperty("max_iterations") Integer maxIterations,
        @JsonProperty("allowed_domains") List<String> allowedDomains
    ) {
        static ActionView from(RoutineAction action) {
            return new ActionView(action.type().wireName(), action.prompt(), action.title(),
                    action.mode() != null ? action.mode().wireName() : null,
                    action.maxIterations(), action.allowedDomains());
        }
    }

    public record RunView(
        String id,
        @JsonProperty("routine_id") String routineId,
        @JsonProperty("trigger_type") String triggerType,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        String status,
        String summary,
        @JsonProperty("job_id") String jobId
    ) {
        public static RunView from(RoutineRun run) {
            return new RunView(run.id(), run.routineId(), run.triggerType().wireName(), run.startedAt(),
                    run.completedAt(), run.status().wireName(), run.summary(), run.jobId());
        }
    }

    public static RoutineResponse from(Routine routine, List<RoutineRun> recentRuns) {
        return new RoutineResponse(
                routine.id(),
                routine.name(),
                routine.description(),
                routine.enabled(),
                routine.status().wireName(),
                TriggerView.from(routine.trigger()),
                ActionView.from(routine.action()),
                routine.cooldownSecs(),
                routine.maxConcurrent(),
                routine.runCount(),
                routine.consecutiveFailures(),
                routine.lastRunAt(),
                routine.nextFireAt(),
                routine.createdAt(),
                recentRuns == null ? null : recentRuns.stream().map(RunView::from).toList()
        );
    }
}
