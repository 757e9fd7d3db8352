package com.warden.core.routines;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps at most {@code runHistoryLimit} runs per routine; the oldest finished runs are
 * dropped first and PENDING runs are never dropped.
 */
public class InMemoryRoutineStore implements RoutineStore {

    private final ConcurrentHashMap<String, Routine> routines = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RoutineRun> runs = new ConcurrentHashMap<>();
    private final int runHistoryLimit;

    public InMemoryRoutineStore() {
        this(RoutineProperties.DEFAULT_RUN_HISTORY_LIMIT);
    }

    public InMemoryRoutineStore(int runHistoryLimit) {
        if (runHistoryLimit < 1) {
            throw new IllegalArgumentException("runHistoryLimit must be positive");
        }
        this.runHistoryLimit = runHistoryLimit;
    }

    @Override
    public void save(Routine routine) {
        routines.put(routine.id(), routine);
    }

    @Override
    public Optional<Routine> find(String id) {
        return Optional.ofNullable(routines.get(id));
    }

    @Override
    public List<Routine> findAll() {
        return routines.values().stream()
                .sorted(Comparator.comparing(Routine::createdAt))
                .toList();
    }

    @Override
    public Optional<Routine> findByWebhookPath(String path) {
        return routines.values().stream()
                .filter(r -> r.trigger().type() == TriggerType.WEBHOOK)
                .filter(r -> path.equals(r.trigger().webhookPath()))
                .findFirst();
    }

    @Override
    public boolean delete(String id) {
        boolean removed = routines.remove(id) != null;
        if (removed) {
            runs.values().removeIf(run -> id.equals(run.routineId()));
        }
        return removed;
    }

    @Override
    public synchronized void saveRun(RoutineRun run) {
        runs.put(run.id(), run);
        prune(run.routineId());
    }

    private void prune(String routineId) {
        List<RoutineRun> ofRoutine = new ArrayList<>(runs.values().stream()
                .filter(r -> routineId.equals(r.routineId()))
                .toList());
        int excess = ofRoutine.size() - runHistoryLimit;
        if (excess <= 0) {
            return;
        }
        ofRoutine.stream()
                .filter(r -> r.status() != RunStatus.PENDING)
                .sorted(Comparator.comparing(RoutineRun::startedAt))
                .limit(excess)
                .forEach(r -> runs.remove(r.id()));
    }

    @Override
    public Optional<RoutineRun> findRunByJobId(String jobId) {
        return runs.values().stream()
                .filter(run -> jobId.equals(run.jobId()))
                .findFirst();
    }

    @Override
    public List<RoutineRun> listRuns(String routineId, int limit) {
        return runs.values().stream()
                .filter(run -> routineId.equals(run.routineId()))
                .sorted(Comparator.comparing(RoutineRun::startedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int countRunning(String routineId) {
        return (int) runs.values().stream()
                .filter(run -> routineId.equals(run.routineId()))
                .filter(run -> run.status() == RunStatus.PENDING)
                .count();
    }

    @Override
    public long countRunsSince(Instant since) {
        return runs.values().stream()
                .filter(run -> !run.startedAt().isBefore(since))
                .count();
    }
}
