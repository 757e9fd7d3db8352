package com.warden.core.events;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<String, List<JobEvent>> events = new ConcurrentHashMap<>();

    @Override
    public void append(JobEvent event) {
        List<JobEvent> history = events.computeIfAbsent(event.jobId(), k -> new ArrayList<>());
        synchronized (history) {
            history.add(event);
        }
    }

    @Override
    public List<JobEvent> read(String jobId, long since, int limit) {
        List<JobEvent> history = events.get(jobId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return history.stream()
                    .filter(e -> e.sequence() > since)
                    .limit(limit)
                    .toList();
        }
    }

    @Override
    public long lastSequence(String jobId) {
        List<JobEvent> history = events.get(jobId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.isEmpty() ? 0 : history.get(history.size() - 1).sequence();
        }
    }
}
