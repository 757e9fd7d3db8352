package com.warden.core.jobs;

import com.warden.core.model.Job;
import com.warden.core.model.JobState;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable job store used when no database is configured.
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(Job job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
    }

    @Override
    public void update(Job job) {
        if (jobs.replace(job.id(), job) == null) {
            throw new JobNotFoundException(job.id());
        }
    }

    @Override
    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .toList();
    }

    @Override
    public List<Job> findByStates(Collection<JobState> states) {
        return findAll().stream()
                .filter(job -> states.contains(job.state()))
                .toList();
    }
}
