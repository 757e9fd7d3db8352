package com.warden.core.routines;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RoutineStore {

    /** Inserts or replaces by id. */
    void save(Routine routine);

    Optional<Routine> find(String id);

    List<Routine> findAll();

    Optional<Routine> findByWebhookPath(String path);

    boolean delete(String id);

    /** Inserts or replaces by run id. */
    void saveRun(RoutineRun run);

    Optional<RoutineRun> findRunByJobId(String jobId);

    /** Most recent first. */
    List<RoutineRun> listRuns(String routineId, int limit);

    int countRunning(String routineId);

    long countRunsSince(Instant since);
}
