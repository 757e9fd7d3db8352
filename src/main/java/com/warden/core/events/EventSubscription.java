package com.warden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * One observer's view of a job's event stream.
 * <p>
 * The subscription starts in backfill: it is attached to the channel before the durable
 * history is read, so nothing published meanwhile is lost, and live draining is held
 * back until backfill ends. The cursor is the highest sequence delivered; anything at or
 * below it is discarded, which removes the overlap between backfill and live events.
 * At most one drain runs at a time, so listener calls never overlap.
 */
public final class EventSubscription {

    private static final Logger log = LoggerFactory.getLogger(EventSubscription.class);

    private final EventChannel channel;
    private final JobEventListener listener;
    private final Executor executor;
    private final LongConsumer lagReporter;
    private final Consumer<EventSubscription> onClose;

    /** Starts held: the backfilling thread owns delivery until {@link #goLive()}. */
    private final AtomicBoolean draining = new AtomicBoolean(true);
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile long cursor;
    private volatile boolean completed;

    EventSubscription(EventChannel channel, JobEventListener listener, Executor executor,
                      LongConsumer lagReporter, Consumer<EventSubscription> onClose) {
        this.channel = channel;
        this.listener = listener;
        this.executor = executor;
        this.lagReporter = lagReporter;
        this.onClose = onClose;
    }

    public String jobId() {
        return channel.jobId();
    }

    /** Highest sequence delivered so far. */
    public long cursor() {
        return cursor;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void unsubscribe() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
        }
    }

    void backfill(List<JobEvent> history) {
        for (JobEvent event : history) {
            if (closed.get()) {
                return;
            }
            deliver(event);
        }
    }

    void goLive() {
        draining.set(false);
        schedule();
    }

    void schedule() {
        if (closed.get()) {
            return;
        }
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            while (!closed.get()) {
                List<JobEvent> batch = channel.after(cursor);
                if (batch.isEmpty()) {
                    if (channel.isFinished()) {
                        complete();
                    }
                    break;
                }
                long skipped = batch.get(0).sequence() - cursor - 1;
                if (skipped > 0) {
                    log.debug("Subscriber on job {} fell behind the live buffer, skipping {} events",
                            channel.jobId(), skipped);
                    lagReporter.accept(skipped);
                }
                for (JobEvent event : batch) {
                    if (closed.get()) {
                        break;
                    }
                    deliver(event);
                }
            }
        } finally {
            draining.set(false);
        }
        // An append may have raced with the final empty read above.
        if (!closed.get() && (channel.hasAfter(cursor) || (channel.isFinished() && !completed))) {
            schedule();
        }
    }

    private void deliver(JobEvent event) {
        if (event.sequence() <= cursor) {
            return;
        }
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {} #{} of job {}: {}",
                    event.eventType().wireName(), event.sequence(), event.jobId(), e.getMessage(), e);
        }
        cursor = event.sequence();
    }

    private void complete() {
        if (completed) {
            return;
        }
        completed = true;
        try {
            listener.onComplete();
        } catch (Exception e) {
            log.warn("Subscriber threw exception on completion of job {}: {}", channel.jobId(), e.getMessage(), e);
        }
        unsubscribe();
    }
}
