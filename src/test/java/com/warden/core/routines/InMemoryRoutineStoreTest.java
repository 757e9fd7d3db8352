package com.warden.core.routines;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRoutineStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static RoutineRun run(String id, String routineId, int minute, RunStatus status) {
        Instant started = T0.plusSeconds(minute * 60L);
        return new RoutineRun(id, routineId, TriggerType.CRON, started,
                status == RunStatus.PENDING ? null : started.plusSeconds(30), status, null, "job-" + id);
    }

    @Test
    @DisplayName("finished runs beyond the history limit are dropped oldest first")
    void prunesOldestFinishedRuns() {
        var store = new InMemoryRoutineStore(3);

        for (int i = 1; i <= 5; i++) {
            store.saveRun(run("r" + i, "nightly", i, RunStatus.OK));
        }

        List<String> kept = store.listRuns("nightly", 10).stream().map(RoutineRun::id).toList();
        assertEquals(List.of("r5", "r4", "r3"), kept);
        assertTrue(store.findRunByJobId("job-r1").isEmpty());
        assertEquals(3, store.countRunsSince(T0));
    }

    @Test
    @DisplayName("pending runs are never dropped, even when they are the oldest")
    void keepsPendingRuns() {
        var store = new InMemoryRoutineStore(2);

        store.saveRun(run("p1", "nightly", 1, RunStatus.PENDING));
        store.saveRun(run("r2", "nightly", 2, RunStatus.FAILED));
        store.saveRun(run("r3", "nightly", 3, RunStatus.OK));
        store.saveRun(run("r4", "nightly", 4, RunStatus.OK));

        List<String> kept = store.listRuns("nightly", 10).stream().map(RoutineRun::id).toList();
        assertEquals(List.of("r4", "p1"), kept);
        assertEquals(1, store.countRunning("nightly"));
        assertTrue(store.findRunByJobId("job-p1").isPresent());
    }

    @Test
    @DisplayName("the limit applies per routine")
    void limitPerRoutine() {
        var store = new InMemoryRoutineStore(2);

        store.saveRun(run("a1", "alpha", 1, RunStatus.OK));
        store.saveRun(run("a2", "alpha", 2, RunStatus.OK));
        store.saveRun(run("b1", "beta", 3, RunStatus.OK));
        store.saveRun(run("b2", "beta", 4, RunStatus.OK));

        assertEquals(2, store.listRuns("alpha", 10).size());
        assertEquals(2, store.listRuns("beta", 10).size());
    }

    @Test
    @DisplayName("completing a pending run replaces it rather than adding a new entry")
    void completionUpdatesInPlace() {
        var store = new InMemoryRoutineStore(2);
        RoutineRun pending = run("p1", "nightly", 1, RunStatus.PENDING);
        store.saveRun(pending);
        store.saveRun(run("r2", "nightly", 2, RunStatus.OK));

        store.saveRun(pending.completed(RunStatus.OK, "done", T0.plusSeconds(600)));

        assertEquals(2, store.listRuns("nightly", 10).size());
        assertEquals(0, store.countRunning("nightly"));
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryRoutineStore(0));
    }
}
