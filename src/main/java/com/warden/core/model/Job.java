package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one unit of sandboxed work.
 * <p>
 * Only {@link com.warden.core.jobs.JobRegistry} produces new snapshots; every state
 * change goes through {@link #transitioned(JobState, String, JobResult, Instant)} so
 * the state always equals the {@code to} of the last transition.
 */
public record Job(
    String id,
    JobSpec spec,
    JobState state,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    List<Transition> transitions,
    JobResult result,
    String browseUrl,
    String restartedFrom,
    Instant lastActivityAt
) {

    public static final String CREATED_REASON = "created";

    public Job {
        transitions = List.copyOf(transitions);
    }

    /**
     * New job in {@link JobState#PENDING} whose first transition records the creation.
     */
    public static Job create(String id, JobSpec spec, String restartedFrom, Instant now) {
        var created = new Transition(JobState.PENDING, JobState.PENDING, now, CREATED_REASON);
        return new Job(id, spec, JobState.PENDING, now, null, null, List.of(created),
                null, null, restartedFrom, now);
    }

    /**
     * Returns a copy moved to {@code to}. Terminal targets always carry a result; when
     * none is given one is derived from the reason.
     */
    public Job transitioned(JobState to, String reason, JobResult outcome, Instant now) {
        var history = new ArrayList<>(transitions);
        history.add(new Transition(state, to, now, reason));

        Instant started = startedAt;
        if (to == JobState.IN_PROGRESS && started == null) {
            started = now;
        }
        Instant completed = to.isTerminal() ? now : null;
        JobResult finalResult = result;
        if (to.isTerminal()) {
            finalResult = outcome != null ? outcome : new JobResult(to == JobState.COMPLETED, reason, null);
            if (finalResult.message() == null || finalResult.message().isBlank()) {
                finalResult = new JobResult(finalResult.success(), reason, finalResult.sessionId());
            }
        }
        return new Job(id, spec, to, createdAt, started, completed, history,
                finalResult, browseUrl, restartedFrom, now);
    }

    public Job touched(Instant now) {
        return new Job(id, spec, state, createdAt, startedAt, completedAt, transitions,
                result, browseUrl, restartedFrom, now);
    }

    public Job withBrowseUrl(String url) {
        return new Job(id, spec, state, createdAt, startedAt, completedAt, transitions,
                result, url, restartedFrom, lastActivityAt);
    }

    public String title() {
        return spec.title();
    }

    public JobMode mode() {
        return spec.mode();
    }

    public String routineId() {
        return spec.routineId();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * In progress with no activity for longer than {@code window}.
     */
    public boolean isStuck(Instant now, Duration window) {
        return state == JobState.IN_PROGRESS
                && lastActivityAt != null
                && lastActivityAt.plus(window).isBefore(now);
    }

    public long elapsedSeconds(Instant now) {
        Instant start = startedAt != null ? startedAt : createdAt;
        Instant end = completedAt != null ? completedAt : now;
        return Math.max(0, Duration.between(start, end).getSeconds());
    }

    public Transition lastTransition() {
        return transitions.get(transitions.size() - 1);
    }
}
