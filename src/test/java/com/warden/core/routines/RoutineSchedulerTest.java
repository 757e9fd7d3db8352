package com.warden.core.routines;

import com.warden.core.jobs.JobOrchestrator;
import com.warden.core.jobs.JobProperties;
import com.warden.core.jobs.JobSpecValidator;
import com.warden.core.jobs.JobTransitionedEvent;
import com.warden.core.jobs.ValidationException;
import com.warden.core.model.Job;
import com.warden.core.model.JobResult;
import com.warden.core.model.JobSpec;
import com.warden.core.model.JobState;
import com.warden.egress.CredentialVault;
import com.warden.egress.EgressProperties;
import com.warden.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RoutineSchedulerTest {

    private MutableClock clock;
    private InMemoryRoutineStore store;
    private RoutineService service;
    private JobOrchestrator orchestrator;
    private RoutineScheduler scheduler;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new InMemoryRoutineStore();
        var properties = new RoutineProperties();
        var validator = new JobSpecValidator(new JobProperties(), new CredentialVault(new EgressProperties()));
        service = new RoutineService(store, validator, properties, clock);

        orchestrator = mock(JobOrchestrator.class);
        when(orchestrator.create(any())).thenAnswer(inv -> {
            JobSpec spec = inv.getArgument(0);
            Job job = Job.create(UUID.randomUUID().toString(), spec, null, clock.instant());
            jobs.put(job.id(), job);
            return job;
        });
        when(orchestrator.get(anyString())).thenAnswer(inv -> jobs.get(inv.<String>getArgument(0)));

        scheduler = new RoutineScheduler(store, service, orchestrator, properties, clock, null);
    }

    private Routine eventRoutine(long cooldownSecs) {
        return service.create(new RoutineDefinition("deploy watcher", null, true,
                RoutineTrigger.event("deploy", null), RoutineAction.lightweight("Check the deploy"),
                cooldownSecs, 1));
    }

    private void finish(String jobId, boolean success) {
        Job running = jobs.get(jobId).transitioned(JobState.IN_PROGRESS, "started", null, clock.instant());
        JobState target = success ? JobState.COMPLETED : JobState.FAILED;
        Job done = running.transitioned(target, success ? "done" : "broke",
                new JobResult(success, success ? "done" : "broke", null), clock.instant());
        jobs.put(jobId, done);
        scheduler.onJobTransitioned(new JobTransitionedEvent(done, done.lastTransition()));
    }

    @Nested
    @DisplayName("cooldown")
    class Cooldown {

        @Test
        @DisplayName("matches at t=0, 10, 100 and 310 with a 300s cooldown start exactly two jobs")
        void cooldownLaw() {
            Routine routine = eventRoutine(300);
            int started = 0;

            started += firedCount(scheduler.onIncomingEvent("ops", "deploy started"));
            String firstJob = store.listRuns(routine.id(), 10).get(0).jobId();
            finish(firstJob, true);

            clock.advanceSeconds(10);
            started += firedCount(scheduler.onIncomingEvent("ops", "deploy again"));
            clock.advanceSeconds(90);
            started += firedCount(scheduler.onIncomingEvent("ops", "deploy once more"));
            clock.advanceSeconds(210);
            started += firedCount(scheduler.onIncomingEvent("ops", "deploy finally"));

            assertEquals(2, started);
            verify(orchestrator, times(2)).create(any());
            assertEquals(2, service.get(routine.id()).runCount());
            assertEquals(clock.instant(), service.get(routine.id()).lastRunAt());
        }

        @Test
        @DisplayName("skip reports the reason")
        void skipReason() {
            Routine routine = eventRoutine(300);
            scheduler.onIncomingEvent(null, "deploy");
            clock.advanceSeconds(5);

            FireOutcome outcome = scheduler.onIncomingEvent(null, "deploy").get(0);

            assertFalse(outcome.fired());
            assertEquals("cooldown", outcome.skipReason());
            assertEquals(routine.id(), outcome.routineId());
        }

        private int firedCount(List<FireOutcome> outcomes) {
            return (int) outcomes.stream().filter(FireOutcome::fired).count();
        }
    }

    @Nested
    @DisplayName("guardrails")
    class Guardrails {

        @Test
        @DisplayName("max concurrent caps runs whose jobs are still going")
        void maxConcurrent() {
            Routine routine = eventRoutine(0);
            assertTrue(scheduler.onIncomingEvent(null, "deploy").get(0).fired());

            FireOutcome second = scheduler.fireManual(routine.id());

            assertFalse(second.fired());
            assertEquals("max_concurrent", second.skipReason());
        }

        @Test
        @DisplayName("disabled routines ignore events but can be fired manually")
        void disabled() {
            Routine routine = eventRoutine(300);
            service.toggle(routine.id());

            assertFalse(scheduler.onIncomingEvent(null, "deploy").stream().anyMatch(FireOutcome::fired));
            assertTrue(scheduler.fireManual(routine.id()).fired());
        }

        @Test
        @DisplayName("channel scope and pattern must both match")
        void channelScope() {
            service.create(new RoutineDefinition("scoped", null, true,
                    RoutineTrigger.event("^release v\\d+", "releases"), RoutineAction.lightweight("Announce"),
                    0L, 1));

            assertTrue(scheduler.onIncomingEvent("general", "release v2").isEmpty());
            assertTrue(scheduler.onIncomingEvent("releases", "prerelease v2").isEmpty());
            assertEquals(1, scheduler.onIncomingEvent("releases", "release v2").size());
        }
    }

    @Nested
    @DisplayName("run outcomes")
    class Outcomes {

        @Test
        @DisplayName("failed jobs count as consecutive failures until a success")
        void failureStreak() {
            Routine routine = eventRoutine(0);

            scheduler.fireManual(routine.id());
            finish(store.listRuns(routine.id(), 10).get(0).jobId(), false);
            assertEquals(RoutineStatus.FAILING, service.get(routine.id()).status());
            assertEquals(1, service.get(routine.id()).consecutiveFailures());

            clock.advanceSeconds(1);
            scheduler.fireManual(routine.id());
            finish(store.listRuns(routine.id(), 10).get(0).jobId(), true);

            Routine after = service.get(routine.id());
            assertEquals(0, after.consecutiveFailures());
            assertEquals(RoutineStatus.ACTIVE, after.status());
            List<RoutineRun> runs = service.runs(routine.id(), null);
            assertEquals(2, runs.size());
            assertTrue(runs.stream().noneMatch(run -> run.status() == RunStatus.PENDING));
        }

        @Test
        @DisplayName("rejected job is recorded as a failed run")
        void rejectedJob() {
            Routine routine = eventRoutine(0);
            doThrow(new ValidationException("sandbox quota exceeded")).when(orchestrator).create(any());

            FireOutcome outcome = scheduler.fireManual(routine.id());

            assertTrue(outcome.fired());
            assertEquals(RunStatus.FAILED, outcome.run().status());
            assertTrue(outcome.run().summary().contains("sandbox quota exceeded"));
            assertEquals(1, service.get(routine.id()).consecutiveFailures());
        }
    }

    @Nested
    @DisplayName("webhook")
    class Webhook {

        @Test
        @DisplayName("secret must match when configured")
        void secretChecked() {
            service.create(new RoutineDefinition("ci hook", null, true,
                    RoutineTrigger.webhook("ci-done", "s3cret"), RoutineAction.lightweight("Triage CI"), 0L, 1));

            assertThrows(WebhookAuthenticationException.class, () -> scheduler.fireWebhook("ci-done", "wrong"));
            assertThrows(WebhookAuthenticationException.class, () -> scheduler.fireWebhook("ci-done", null));
            assertTrue(scheduler.fireWebhook("ci-done", "s3cret").fired());
        }

        @Test
        @DisplayName("unknown path is not found")
        void unknownPath() {
            assertThrows(RoutineNotFoundException.class, () -> scheduler.fireWebhook("nope", null));
        }
    }

    @Nested
    @DisplayName("cron tick")
    class CronTick {

        @Test
        @DisplayName("fires due routines and schedules the next fire")
        void firesDue() {
            Routine routine = service.create(new RoutineDefinition("hourly", null, true,
                    RoutineTrigger.cron("0 * * * *"), RoutineAction.lightweight("Hourly report"), 0L, 1));
            assertEquals(Instant.parse("2026-03-01T11:00:00Z"), routine.nextFireAt());

            scheduler.tick();
            verify(orchestrator, never()).create(any());

            clock.set(Instant.parse("2026-03-01T11:00:05Z"));
            scheduler.tick();

            verify(orchestrator).create(any());
            assertEquals(Instant.parse("2026-03-01T12:00:00Z"), service.get(routine.id()).nextFireAt());
        }

        @Test
        @DisplayName("a skipped fire is not made up later")
        void skippedFireAdvances() {
            Routine routine = service.create(new RoutineDefinition("hourly", null, true,
                    RoutineTrigger.cron("0 * * * *"), RoutineAction.lightweight("Hourly report"), 7200L, 1));
            clock.set(Instant.parse("2026-03-01T11:00:05Z"));
            scheduler.tick();
            finish(store.listRuns(routine.id(), 10).get(0).jobId(), true);

            clock.set(Instant.parse("2026-03-01T12:00:05Z"));
            scheduler.tick();

            verify(orchestrator, times(1)).create(any());
            assertEquals(Instant.parse("2026-03-01T13:00:00Z"), service.get(routine.id()).nextFireAt());
        }
    }
}
