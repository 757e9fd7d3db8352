package com.warden.core.jobs;

import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.Job;
import com.warden.core.model.JobFilter;
import com.warden.core.model.JobResult;
import com.warden.core.model.JobSpec;
import com.warden.core.model.JobState;
import com.warden.core.model.JobSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Single writer of job state.
 * <p>
 * Every mutation is serialized on a per-job lock and checked against the legal edge
 * table in {@link JobState#allowedTargets()}. Of two racing transitions on the same job
 * exactly one wins; the loser gets a {@link StateConflictException} and the stored job is
 * left untouched. Stored transitions are announced as {@link JobTransitionedEvent}s
 * once the lock is released.
 */
@Service
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final JobStore store;
    private final ApplicationEventPublisher publisher;
    private final JobProperties properties;
    private final Clock clock;
    private final WardenMetrics metrics;

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public JobRegistry(JobStore store,
                       ApplicationEventPublisher publisher,
                       JobProperties properties,
                       Clock clock,
                       @Autowired(required = false) WardenMetrics metrics) {
        this.store = store;
        this.publisher = publisher;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Inserts a new job in {@link JobState#PENDING}.
     *
     * @param restartedFrom id of the job this one supersedes, or null
     */
    public Job register(JobSpec spec, String restartedFrom) {
        String id = UUID.randomUUID().toString();
        Job job = Job.create(id, spec, restartedFrom, clock.instant())
                .withBrowseUrl("/api/v1/jobs/" + id + "/files");
        store.insert(job);
        if (metrics != null) {
            metrics.recordJobCreated(spec.mode().wireName());
        }
        log.info("Registered job {} '{}' (mode {}{})", id, spec.title(), spec.mode().wireName(),
                restartedFrom != null ? ", restart of " + restartedFrom : "");
        return job;
    }

    public Job transition(String jobId, JobState to, String reason) {
        return transition(jobId, to, reason, null);
    }

    /**
     * Appends a transition iff {@code to} is a legal edge from the current state.
     *
     * @param result outcome to record when {@code to} is terminal; derived from the reason when null
     * @throws StateConflictException if the edge is illegal
     * @throws JobNotFoundException   if the job does not exist
     */
    public Job transition(String jobId, JobState to, String reason, JobResult result) {
        Job updated;
        synchronized (lockFor(jobId)) {
            Job current = get(jobId);
            if (!current.state().canTransitionTo(to)) {
                throw StateConflictException.illegalTransition(jobId, current.state(), to);
            }
            updated = current.transitioned(to, reason, result, clock.instant());
            store.update(updated);
        }
        if (to.isTerminal()) {
            locks.remove(jobId);
        }

        log.info("Job {} {} -> {} ({})", jobId, updated.lastTransition().from(), to, reason);
        if (metrics != null) {
            metrics.recordTransition(to.name());
        }
        publisher.publishEvent(new JobTransitionedEvent(updated, updated.lastTransition()));
        return updated;
    }

    /**
     * Records worker activity. Does not change state; terminal jobs are returned as they are.
     */
    public Job touch(String jobId) {
        synchronized (lockFor(jobId)) {
            Job current = get(jobId);
            if (current.isTerminal()) {
                return current;
            }
            Job updated = current.touched(clock.instant());
            store.update(updated);
            return updated;
        }
    }

    public Job get(String jobId) {
        return store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Optional<Job> find(String jobId) {
        return store.find(jobId);
    }

    /** Jobs that still own (or are about to own) a sandbox. */
    public List<Job> active() {
        return store.findByStates(EnumSet.of(JobState.PENDING, JobState.IN_PROGRESS));
    }

    /**
     * Lists jobs, most recent first.
     *
     * @throws ValidationException if the state filter names neither a state nor "stuck"
     */
    public List<Job> list(JobFilter filter) {
        Instant now = clock.instant();
        Stream<Job> jobs = store.findAll().stream();

        if (filter.state() != null && !filter.state().isBlank()) {
            String state = filter.state().trim().toUpperCase(Locale.ROOT).replace('-', '_');
            if ("STUCK".equals(state)) {
                jobs = jobs.filter(job -> job.isStuck(now, stuckWindow()));
            } else {
                JobState wanted = parseState(filter.state(), state);
                jobs = jobs.filter(job -> job.state() == wanted);
            }
        }
        if (filter.mode() != null) {
            jobs = jobs.filter(job -> job.mode() == filter.mode());
        }
        if (filter.routineId() != null && !filter.routineId().isBlank()) {
            jobs = jobs.filter(job -> filter.routineId().equals(job.routineId()));
        }
        if (filter.limit() != null && filter.limit() > 0) {
            jobs = jobs.limit(filter.limit());
        }
        return jobs.toList();
    }

    public JobSummary summary() {
        Instant now = clock.instant();
        long pending = 0, inProgress = 0, completed = 0, failed = 0, interrupted = 0, cancelled = 0, stuck = 0;
        List<Job> all = store.findAll();
        for (Job job : all) {
            switch (job.state()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case INTERRUPTED -> interrupted++;
                case CANCELLED -> cancelled++;
            }
            if (job.isStuck(now, stuckWindow())) {
                stuck++;
            }
        }
        return new JobSummary(all.size(), pending, inProgress, completed, failed, interrupted, cancelled, stuck);
    }

    public boolean isStuck(Job job) {
        return job.isStuck(clock.instant(), stuckWindow());
    }

    private Duration stuckWindow() {
        return Duration.ofSeconds(properties.getStuckAfterSeconds());
    }

    private Object lockFor(String jobId) {
        return locks.computeIfAbsent(jobId, k -> new Object());
    }

    private static JobState parseState(String raw, String normalized) {
        try {
            return JobState.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown job state filter: " + raw);
        }
    }
}
