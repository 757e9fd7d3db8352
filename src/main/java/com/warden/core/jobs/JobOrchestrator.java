package com.warden.core.jobs;

import com.warden.core.events.EventPipeline;
import com.warden.core.events.EventSubscription;
import com.warden.core.events.JobEvent;
import com.warden.core.events.JobEventListener;
import com.warden.core.events.JobEventType;
import com.warden.core.logging.MdcContext;
import com.warden.core.model.Job;
import com.warden.core.model.JobFilter;
import com.warden.core.model.JobResult;
import com.warden.core.model.JobSpec;
import com.warden.core.model.JobState;
import com.warden.core.model.JobSummary;
import com.warden.sandbox.SandboxSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for everything that happens to a job: operator requests from the control
 * API, worker callbacks from the internal API, and launches from routines.
 * <p>
 * State changes are delegated to the {@link JobRegistry}; the orchestrator decides which
 * change a request means. Worker events for one job are ingested one at a time, so the
 * {@code result} event is checked and applied atomically with respect to other events.
 */
@Service
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    static final int DEFAULT_EVENT_LIMIT = 100;
    static final int MAX_EVENT_LIMIT = 1000;

    private final JobRegistry registry;
    private final JobSpecValidator validator;
    private final SandboxSupervisor supervisor;
    private final EventPipeline pipeline;
    private final PromptQueue prompts;
    private final Clock clock;

    private final ConcurrentHashMap<String, Object> ingestLocks = new ConcurrentHashMap<>();

    public JobOrchestrator(JobRegistry registry,
                           JobSpecValidator validator,
                           SandboxSupervisor supervisor,
                           EventPipeline pipeline,
                           PromptQueue prompts,
                           Clock clock) {
        this.registry = registry;
        this.validator = validator;
        this.supervisor = supervisor;
        this.pipeline = pipeline;
        this.prompts = prompts;
        this.clock = clock;
    }

    /**
     * Validates and registers a job, then queues provisioning. Returns the PENDING job
     * without waiting for the sandbox.
     */
    public Job create(JobSpec spec) {
        return launch(validator.validate(spec), null);
    }

    /**
     * Cancels a PENDING or IN_PROGRESS job. Cancelling a terminal job changes nothing and
     * returns it as it is.
     */
    public Job cancel(String jobId) {
        Job job = registry.get(jobId);
        if (job.isTerminal()) {
            return job;
        }
        supervisor.requestTeardown(jobId);
        try {
            return registry.transition(jobId, JobState.CANCELLED, "cancelled by operator");
        } catch (StateConflictException e) {
            Job current = registry.get(jobId);
            if (current.isTerminal()) {
                return current;
            }
            throw e;
        }
    }

    /**
     * Starts a new job from the spec of a FAILED or INTERRUPTED one.
     *
     * @throws StateConflictException for any other state
     */
    public Job restart(String jobId) {
        Job original = registry.get(jobId);
        if (original.state() != JobState.FAILED && original.state() != JobState.INTERRUPTED) {
            throw new StateConflictException(jobId, original.state(),
                    "Cannot restart job in state " + original.state());
        }
        Job restarted = launch(validator.validate(original.spec()), jobId);
        log.info("Job {} restarted as {}", jobId, restarted.id());
        return restarted;
    }

    private Job launch(JobSpec spec, String restartedFrom) {
        Job job = registry.register(spec, restartedFrom);
        supervisor.provisionAsync(job);
        return job;
    }

    /**
     * Accepts one worker event. The first event of a PENDING job promotes it to
     * IN_PROGRESS; a {@code result} event ends the job.
     *
     * @throws StateConflictException if the job is already terminal
     * @throws ValidationException    if the event type is unknown
     */
    public JobEvent recordEvent(String jobId, String eventType, Map<String, Object> payload) {
        JobEventType type = JobEventType.fromWire(eventType);
        Map<String, Object> body = payload != null ? payload : Map.of();

        synchronized (ingestLockFor(jobId)) {
            Job job = registry.get(jobId);
            if (job.isTerminal()) {
                throw new StateConflictException(jobId, job.state(),
                        "Job " + jobId + " is " + job.state() + " and accepts no further events");
            }
            if (job.state() == JobState.PENDING) {
                try {
                    registry.transition(jobId, JobState.IN_PROGRESS, "worker reported its first event");
                } catch (StateConflictException e) {
                    log.debug("Job {} promoted concurrently: {}", jobId, e.getMessage());
                }
            }

            JobEvent event = pipeline.ingest(jobId, type, body);
            registry.touch(jobId);

            if (type == JobEventType.RESULT) {
                JobResult result = resultFrom(body);
                JobState target = result.success() ? JobState.COMPLETED : JobState.FAILED;
                try {
                    registry.transition(jobId, target, result.message(), result);
                } catch (StateConflictException e) {
                    log.warn("Result for job {} arrived after it became {}", jobId, e.getCurrentState());
                }
                ingestLocks.remove(jobId);
            }
            return event;
        }
    }

    /** Records worker liveness and returns the job's current state. */
    public JobState heartbeat(String jobId) {
        return registry.touch(jobId).state();
    }

    public FollowUpPrompt queuePrompt(String jobId, String content, boolean done) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("prompt content is required");
        }
        Job job = registry.get(jobId);
        if (job.isTerminal()) {
            throw new StateConflictException(jobId, job.state(),
                    "Job " + jobId + " is " + job.state() + " and accepts no prompts");
        }
        FollowUpPrompt prompt = new FollowUpPrompt(content, done, clock.instant());
        prompts.offer(jobId, prompt);
        // A terminal transition stored after the check above may already have cleared the queue.
        Job current = registry.get(jobId);
        if (current.isTerminal()) {
            prompts.discard(jobId);
            throw new StateConflictException(jobId, current.state(),
                    "Job " + jobId + " is " + current.state() + " and accepts no prompts");
        }
        MdcContext.setJob(jobId);
        try {
            log.info("Queued follow-up prompt ({} pending{})", prompts.size(jobId), done ? ", final" : "");
        } finally {
            MdcContext.clear();
        }
        return prompt;
    }

    public Optional<FollowUpPrompt> pollPrompt(String jobId) {
        registry.get(jobId);
        return prompts.poll(jobId);
    }

    /**
     * Durable event read. {@code limit} is clamped to 1..1000 and defaults to 100.
     */
    public List<JobEvent> events(String jobId, long since, Integer limit) {
        registry.get(jobId);
        if (since < 0) {
            throw new ValidationException("since must not be negative");
        }
        int effective = limit == null ? DEFAULT_EVENT_LIMIT : Math.max(1, Math.min(MAX_EVENT_LIMIT, limit));
        return pipeline.read(jobId, since, effective);
    }

    /**
     * Backfill followed by live events. Completes immediately after backfill when the job
     * has already ended.
     */
    public EventSubscription subscribe(String jobId, JobEventListener listener) {
        registry.get(jobId);
        EventSubscription subscription = pipeline.subscribe(jobId, listener);
        if (registry.get(jobId).isTerminal()) {
            pipeline.finish(jobId);
        }
        return subscription;
    }

    public Job get(String jobId) {
        return registry.get(jobId);
    }

    public List<Job> list(JobFilter filter) {
        return registry.list(filter);
    }

    public JobSummary summary() {
        return registry.summary();
    }

    public boolean isStuck(Job job) {
        return registry.isStuck(job);
    }

    static JobResult resultFrom(Map<String, Object> payload) {
        boolean success = Boolean.TRUE.equals(payload.get("success"))
                || "true".equalsIgnoreCase(String.valueOf(payload.get("success")));
        String message = firstText(payload, "message", "summary", "result", "error");
        if (message == null) {
            message = success ? "completed" : "worker reported failure";
        }
        Object session = payload.get("session_id");
        return new JobResult(success, message, session != null ? session.toString() : null);
    }

    private static String firstText(Map<String, Object> payload, String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        return null;
    }

    private Object ingestLockFor(String jobId) {
        return ingestLocks.computeIfAbsent(jobId, k -> new Object());
    }
}
