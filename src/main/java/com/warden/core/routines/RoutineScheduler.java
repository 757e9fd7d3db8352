package com.warden.core.routines;

import com.warden.core.jobs.JobOrchestrator;
import com.warden.core.jobs.JobTransitionedEvent;
import com.warden.core.jobs.ValidationException;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.Job;
import com.warden.core.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Turns triggers into jobs.
 * <p>
 * Every fire of a routine runs under that routine's lock: the cooldown and concurrency
 * checks, the job creation, the pending run record and the routine update happen as one
 * step. Runs are completed from the linked job's terminal transition, which also drives
 * the routine's failure streak.
 */
@Service
public class RoutineScheduler {

    private static final Logger log = LoggerFactory.getLogger(RoutineScheduler.class);

    static final int MAX_SUMMARY_LENGTH = 500;

    private final RoutineStore store;
    private final RoutineService routines;
    private final JobOrchestrator orchestrator;
    private final RoutineProperties properties;
    private final Clock clock;
    private final WardenMetrics metrics;

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public RoutineScheduler(RoutineStore store,
                            RoutineService routines,
                            JobOrchestrator orchestrator,
                            RoutineProperties properties,
                            Clock clock,
                            @Autowired(required = false) WardenMetrics metrics) {
        this.store = store;
        this.routines = routines;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    /** Fires cron routines whose next fire time has passed. */
    @Scheduled(fixedDelayString = "${warden.routines.tick-interval-ms:15000}")
    public void tick() {
        Instant now = clock.instant();
        for (Routine routine : store.findAll()) {
            if (!routine.enabled() || routine.trigger().type() != TriggerType.CRON) {
                continue;
            }
            if (routine.nextFireAt() == null || routine.nextFireAt().isAfter(now)) {
                continue;
            }
            try {
                FireOutcome outcome = fire(routine.id(), TriggerType.CRON, false);
                if (!outcome.fired()) {
                    // Skipped fires are not made up later
                    advance(routine.id(), now);
                }
            } catch (RuntimeException e) {
                log.error("Cron fire of routine {} failed", routine.id(), e);
            }
        }
    }

    /**
     * Fires every enabled event routine whose pattern is found in {@code text} and whose
     * channel scope, when set, equals {@code channel}.
     */
    public List<FireOutcome> onIncomingEvent(String channel, String text) {
        if (text == null) {
            throw new ValidationException("text is required");
        }
        List<FireOutcome> outcomes = new ArrayList<>();
        for (Routine routine : store.findAll()) {
            RoutineTrigger trigger = routine.trigger();
            if (!routine.enabled() || trigger.type() != TriggerType.EVENT) {
                continue;
            }
            if (trigger.channel() != null && !trigger.channel().isBlank() && !trigger.channel().equals(channel)) {
                continue;
            }
            if (!Pattern.compile(trigger.pattern()).matcher(text).find()) {
                continue;
            }
            outcomes.add(fire(routine.id(), TriggerType.EVENT, false));
        }
        return outcomes;
    }

    /**
     * @throws RoutineNotFoundException        if no routine owns {@code path}
     * @throws WebhookAuthenticationException if the routine has a secret and {@code secret} differs
     */
    public FireOutcome fireWebhook(String path, String secret) {
        Routine routine = store.findByWebhookPath(path)
                .orElseThrow(() -> new RoutineNotFoundException("No webhook routine at " + path));
        String expected = routine.trigger().webhookSecret();
        if (expected != null && !expected.isEmpty() && !secretMatches(expected, secret)) {
            log.warn("Rejected webhook call for routine {}: bad secret", routine.id());
            throw new WebhookAuthenticationException(path);
        }
        return fire(routine.id(), TriggerType.WEBHOOK, false);
    }

    /**
     * Operator-initiated fire. Runs disabled routines too and ignores the cooldown; the
     * concurrency cap still applies.
     */
    public FireOutcome fireManual(String routineId) {
        routines.get(routineId);
        return fire(routineId, TriggerType.MANUAL, true);
    }

    FireOutcome fire(String routineId, TriggerType via, boolean manual) {
        synchronized (lockFor(routineId)) {
            Routine routine = routines.get(routineId);
            Instant now = clock.instant();
            MdcContext.setRoutine(routineId);
            try {
                if (!manual && !routine.enabled()) {
                    return skip(routine, "disabled");
                }
                if (!manual && routine.coolingDownAt(now)) {
                    return skip(routine, "cooldown");
                }
                if (store.countRunning(routineId) >= routine.maxConcurrent()) {
                    return skip(routine, "max_concurrent");
                }

                Instant next = routine.enabled() ? routines.nextFireAt(routine.trigger(), now) : routine.nextFireAt();
                Job job;
                try {
                    job = orchestrator.create(routine.action().toJobSpec(routine, properties));
                } catch (ValidationException e) {
                    RoutineRun failed = new RoutineRun(UUID.randomUUID().toString(), routineId, via, now, now,
                            RunStatus.FAILED, truncate("could not create job: " + e.getMessage()), null);
                    store.saveRun(failed);
                    store.save(routine.fired(now, next).withOutcome(false));
                    log.warn("Routine {} fired via {} but its job was rejected: {}", routineId, via.wireName(), e.getMessage());
                    recordFire(via);
                    return FireOutcome.fired(routineId, failed);
                }

                RoutineRun run = new RoutineRun(UUID.randomUUID().toString(), routineId, via, now, null,
                        RunStatus.PENDING, null, job.id());
                store.saveRun(run);
                store.save(routine.fired(now, next));
                recordFire(via);
                log.info("Routine {} fired via {} -> job {}", routineId, via.wireName(), job.id());

                // The job may already have ended before the run was recorded
                Job current = orchestrator.get(job.id());
                if (current.isTerminal()) {
                    completeRun(current);
                }
                return FireOutcome.fired(routineId, store.findRunByJobId(job.id()).orElse(run));
            } finally {
                MdcContext.clear();
            }
        }
    }

    @EventListener
    public void onJobTransitioned(JobTransitionedEvent event) {
        if (event.isTerminal() && event.job().routineId() != null) {
            completeRun(event.job());
        }
    }

    void completeRun(Job job) {
        synchronized (lockFor(job.routineId())) {
            RoutineRun run = store.findRunByJobId(job.id()).orElse(null);
            if (run == null || run.status() != RunStatus.PENDING) {
                return;
            }
            boolean ok = job.state() == JobState.COMPLETED;
            String summary = job.result() != null ? job.result().message() : job.state().name();
            store.saveRun(run.completed(ok ? RunStatus.OK : RunStatus.FAILED, truncate(summary), clock.instant()));
            store.find(job.routineId()).ifPresent(routine -> store.save(routine.withOutcome(ok)));
            log.info("Routine {} run {} finished {} (job {})", job.routineId(), run.id(),
                    ok ? "ok" : "failed", job.id());
        }
    }

    private void advance(String routineId, Instant now) {
        synchronized (lockFor(routineId)) {
            store.find(routineId).ifPresent(current -> {
                if (current.nextFireAt() != null && !current.nextFireAt().isAfter(now)) {
                    store.save(current.withNextFireAt(routines.nextFireAt(current.trigger(), now)));
                }
            });
        }
    }

    private FireOutcome skip(Routine routine, String reason) {
        log.info("Routine {} skipped: {}", routine.id(), reason);
        if (metrics != null) {
            metrics.recordRoutineSkip(reason);
        }
        return FireOutcome.skipped(routine.id(), reason);
    }

    private void recordFire(TriggerType via) {
        if (metrics != null) {
            metrics.recordRoutineFire(via.wireName());
        }
    }

    private static boolean secretMatches(String expected, String given) {
        if (given == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), given.getBytes(StandardCharsets.UTF_8));
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_SUMMARY_LENGTH ? text : text.substring(0, MAX_SUMMARY_LENGTH - 3) + "...";
    }

    private Object lockFor(String routineId) {
        return locks.computeIfAbsent(routineId, k -> new Object());
    }
}
