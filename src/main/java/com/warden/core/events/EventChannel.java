package com.warden.core.events;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Bounded multi-consumer channel for one job: a FIFO ring of the most recent events
 * plus the subscriptions reading from it. Each subscription keeps its own cursor, so a
 * slow reader never grows memory; once it falls behind the ring it skips what was
 * overwritten and durable storage remains the source of truth.
 */
final class EventChannel {

    private final String jobId;
    private final int capacity;
    private final ArrayDeque<JobEvent> ring;
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Object appendLock = new Object();

    /** -1 until loaded from the durable store. Guarded by appendLock. */
    private long lastSequence = -1;
    private volatile boolean finished;

    EventChannel(String jobId, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.jobId = jobId;
        this.capacity = capacity;
        this.ring = new ArrayDeque<>(capacity);
    }

    String jobId() {
        return jobId;
    }

    Object appendLock() {
        return appendLock;
    }

    /** Must be called while holding {@link #appendLock()}. */
    long nextSequence(LongSupplier durableLastSequence) {
        if (lastSequence < 0) {
            lastSequence = durableLastSequence.getAsLong();
        }
        return lastSequence + 1;
    }

    /** Must be called while holding {@link #appendLock()}. */
    void append(JobEvent event) {
        synchronized (ring) {
            if (ring.size() == capacity) {
                ring.pollFirst();
            }
            ring.addLast(event);
        }
        lastSequence = event.sequence();
    }

    /** Buffered events with {@code sequence > cursor}, oldest first. */
    List<JobEvent> after(long cursor) {
        synchronized (ring) {
            var result = new ArrayList<JobEvent>();
            for (JobEvent event : ring) {
                if (event.sequence() > cursor) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    boolean hasAfter(long cursor) {
        synchronized (ring) {
            JobEvent newest = ring.peekLast();
            return newest != null && newest.sequence() > cursor;
        }
    }

    int buffered() {
        synchronized (ring) {
            return ring.size();
        }
    }

    void attach(EventSubscription subscription) {
        subscriptions.add(subscription);
    }

    void detach(EventSubscription subscription) {
        subscriptions.remove(subscription);
    }

    List<EventSubscription> subscriptions() {
        return subscriptions;
    }

    boolean hasSubscriptions() {
        return !subscriptions.isEmpty();
    }

    void finish() {
        finished = true;
    }

    boolean isFinished() {
        return finished;
    }
}
