package com.warden.core.jobs;

import com.warden.core.model.Job;
import com.warden.core.model.JobFilter;
import com.warden.core.model.JobMode;
import com.warden.core.model.JobResult;
import com.warden.core.model.JobSpec;
import com.warden.core.model.JobState;
import com.warden.core.model.JobSummary;
import com.warden.support.MutableClock;
import com.warden.support.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private MutableClock clock;
    private RecordingPublisher publisher;
    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        publisher = new RecordingPublisher();
        registry = new JobRegistry(new InMemoryJobStore(), publisher, new JobProperties(), clock, null);
    }

    private Job register() {
        return registry.register(JobSpec.of("Fix tests", "Make the build green", JobMode.WORKER), null);
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("new job is PENDING with the creation record as first transition")
        void newJobIsPending() {
            Job job = register();

            assertEquals(JobState.PENDING, job.state());
            assertEquals(1, job.transitions().size());
            assertEquals(Job.CREATED_REASON, job.transitions().get(0).reason());
            assertEquals("/api/v1/jobs/" + job.id() + "/files", job.browseUrl());
            assertNull(job.completedAt());
        }

        @Test
        @DisplayName("ids are unique")
        void idsAreUnique() {
            assertNotEquals(register().id(), register().id());
        }
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("legal edges are appended and announced")
        void legalEdges() {
            Job job = register();
            registry.transition(job.id(), JobState.IN_PROGRESS, "sandbox started");
            clock.advanceSeconds(30);
            Job done = registry.transition(job.id(), JobState.COMPLETED, "all good", JobResult.success("all good"));

            assertEquals(JobState.COMPLETED, done.state());
            assertEquals(clock.instant(), done.completedAt());
            assertTrue(done.result().success());
            assertEquals(List.of(JobState.PENDING, JobState.IN_PROGRESS, JobState.COMPLETED),
                    done.transitions().stream().map(t -> t.to()).toList());

            var events = publisher.eventsOfType(JobTransitionedEvent.class);
            assertEquals(2, events.size());
            assertTrue(events.get(1).isTerminal());
        }

        @Test
        @DisplayName("illegal edge is rejected and the job is left untouched")
        void illegalEdge() {
            Job job = register();

            var ex = assertThrows(StateConflictException.class,
                    () -> registry.transition(job.id(), JobState.COMPLETED, "too early"));
            assertEquals(JobState.PENDING, ex.getCurrentState());
            assertEquals(job, registry.get(job.id()));
            assertTrue(publisher.eventsOfType(JobTransitionedEvent.class).isEmpty());
        }

        @Test
        @DisplayName("terminal state accepts no further transitions")
        void terminalIsFinal() {
            Job job = register();
            registry.transition(job.id(), JobState.CANCELLED, "cancelled by operator");

            assertThrows(StateConflictException.class,
                    () -> registry.transition(job.id(), JobState.IN_PROGRESS, "late start"));
            assertThrows(StateConflictException.class,
                    () -> registry.transition(job.id(), JobState.FAILED, "late failure"));
        }

        @Test
        @DisplayName("unknown job raises JobNotFoundException")
        void unknownJob() {
            assertThrows(JobNotFoundException.class,
                    () -> registry.transition("nope", JobState.IN_PROGRESS, "x"));
        }

        @Test
        @DisplayName("of two racing terminal transitions exactly one wins")
        void racingTransitions() throws Exception {
            Job job = register();
            registry.transition(job.id(), JobState.IN_PROGRESS, "started");

            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch go = new CountDownLatch(1);
            try {
                Future<Boolean> cancel = pool.submit(() -> attempt(go, job.id(), JobState.CANCELLED));
                Future<Boolean> complete = pool.submit(() -> attempt(go, job.id(), JobState.COMPLETED));
                go.countDown();

                boolean cancelWon = cancel.get(5, TimeUnit.SECONDS);
                boolean completeWon = complete.get(5, TimeUnit.SECONDS);
                assertTrue(cancelWon ^ completeWon);
            } finally {
                pool.shutdownNow();
            }
            assertEquals(3, registry.get(job.id()).transitions().size());
        }

        private boolean attempt(CountDownLatch go, String jobId, JobState target) throws InterruptedException {
            go.await();
            try {
                registry.transition(jobId, target, "race");
                return true;
            } catch (StateConflictException e) {
                return false;
            }
        }
    }

    @Nested
    @DisplayName("touch")
    class Touch {

        @Test
        @DisplayName("updates last activity without changing state")
        void updatesActivity() {
            Job job = register();
            registry.transition(job.id(), JobState.IN_PROGRESS, "started");
            clock.advanceSeconds(40);

            Job touched = registry.touch(job.id());

            assertEquals(JobState.IN_PROGRESS, touched.state());
            assertEquals(clock.instant(), touched.lastActivityAt());
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("list filters by state, derived stuck label and mode")
        void listFilters() {
            Job a = register();
            Job b = registry.register(JobSpec.of("Bridge", "Refactor", JobMode.CLAUDE_CODE), null);
            registry.transition(a.id(), JobState.IN_PROGRESS, "started");
            clock.advanceSeconds(300);

            assertEquals(List.of(a.id()), ids(registry.list(new JobFilter("in_progress", null, null, null))));
            assertEquals(List.of(a.id()), ids(registry.list(new JobFilter("stuck", null, null, null))));
            assertEquals(List.of(b.id()), ids(registry.list(new JobFilter(null, JobMode.CLAUDE_CODE, null, null))));
            assertThrows(ValidationException.class,
                    () -> registry.list(new JobFilter("sleeping", null, null, null)));
        }

        @Test
        @DisplayName("summary counts by state and stuck overlaps in progress")
        void summary() {
            Job a = register();
            Job b = register();
            register();
            registry.transition(a.id(), JobState.IN_PROGRESS, "started");
            registry.transition(b.id(), JobState.FAILED, "provisioning failed: no image");
            clock.advanceSeconds(500);

            JobSummary summary = registry.summary();
            assertEquals(3, summary.total());
            assertEquals(1, summary.pending());
            assertEquals(1, summary.inProgress());
            assertEquals(1, summary.failed());
            assertEquals(1, summary.stuck());
        }

        @Test
        @DisplayName("active returns PENDING and IN_PROGRESS jobs")
        void active() {
            Job a = register();
            Job b = register();
            Job c = register();
            registry.transition(a.id(), JobState.IN_PROGRESS, "started");
            registry.transition(c.id(), JobState.CANCELLED, "cancelled");

            assertEquals(2, registry.active().size());
            assertTrue(ids(registry.active()).containsAll(List.of(a.id(), b.id())));
        }

        private List<String> ids(List<Job> jobs) {
            return jobs.stream().map(Job::id).toList();
        }
    }
}
