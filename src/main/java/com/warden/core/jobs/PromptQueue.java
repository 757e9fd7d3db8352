package com.warden.core.jobs;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Per-job FIFO of follow-up prompts, drained by the worker over the internal API.
 */
@Component
public class PromptQueue {

    private final ConcurrentHashMap<String, Queue<FollowUpPrompt>> queues = new ConcurrentHashMap<>();

    public void offer(String jobId, FollowUpPrompt prompt) {
        queues.computeIfAbsent(jobId, k -> new ConcurrentLinkedQueue<>()).add(prompt);
    }

    public Optional<FollowUpPrompt> poll(String jobId) {
        Queue<FollowUpPrompt> queue = queues.get(jobId);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.poll());
    }

    public int size(String jobId) {
        Queue<FollowUpPrompt> queue = queues.get(jobId);
        return queue == null ? 0 : queue.size();
    }

    /** Drops the job's queue and any prompts still in it. */
    public void discard(String jobId) {
        queues.remove(jobId);
    }

    @EventListener
    public void onJobTransitioned(JobTransitionedEvent event) {
        if (event.isTerminal()) {
            discard(event.job().id());
        }
    }
}
