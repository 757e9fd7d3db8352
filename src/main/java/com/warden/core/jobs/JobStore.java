package com.warden.core.jobs;

import com.warden.core.model.Job;
import com.warden.core.model.JobState;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Key-indexed persistence for job snapshots. Jobs are never deleted.
 * <p>
 * Implementations need no locking of their own beyond thread-safe reads:
 * {@link JobRegistry} serializes writes per job.
 */
public interface JobStore {

    void insert(Job job);

    void update(Job job);

    Optional<Job> find(String jobId);

    /** All jobs, most recently created first. */
    List<Job> findAll();

    List<Job> findByStates(Collection<JobState> states);
}
