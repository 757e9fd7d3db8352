package com.warden.core.events;

import com.warden.core.jobs.JobProperties;
import com.warden.core.jobs.JobTransitionedEvent;
import com.warden.core.metrics.WardenMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Ingests worker events, persists them, and fans them out per job.
 * <p>
 * The pipeline owns every per-job {@link EventChannel}; nothing else touches the ring
 * buffers. Sequences are assigned under the channel's append lock, so they are gap-free
 * and strictly increasing per job even with concurrent producers.
 */
@Service
public class EventPipeline {

    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    static final int BACKFILL_PAGE_SIZE = 500;

    private final EventStore store;
    private final Executor executor;
    private final Clock clock;
    private final WardenMetrics metrics;
    private final int bufferCapacity;

    private final ConcurrentHashMap<String, EventChannel> channels = new ConcurrentHashMap<>();

    public EventPipeline(EventStore store,
                         JobProperties properties,
                         @Qualifier("eventExecutor") Executor executor,
                         Clock clock,
                         @Autowired(required = false) WardenMetrics metrics) {
        this.store = store;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
        this.bufferCapacity = properties.getEventBufferCapacity();
    }

    /**
     * Assigns the next sequence, persists the event, buffers it and wakes live subscribers.
     * Callers are responsible for rejecting events on terminal jobs.
     */
    public JobEvent ingest(String jobId, JobEventType type, Map<String, Object> payload) {
        EventChannel channel = channelFor(jobId);
        JobEvent event;
        synchronized (channel.appendLock()) {
            long sequence = channel.nextSequence(() -> store.lastSequence(jobId));
            event = new JobEvent(jobId, sequence, type, payload, clock.instant());
            store.append(event);
            channel.append(event);
        }
        log.debug("Ingested {} #{} for job {}", type.wireName(), event.sequence(), jobId);
        if (metrics != null) {
            metrics.recordEventIngested(type.wireName());
        }
        for (EventSubscription subscription : channel.subscriptions()) {
            subscription.schedule();
        }
        return event;
    }

    /**
     * Durable read, independent of what the live buffer still holds.
     */
    public List<JobEvent> read(String jobId, long since, int limit) {
        return store.read(jobId, since, limit);
    }

    /**
     * Backfills {@code listener} from durable storage on the calling thread, then switches
     * it to live delivery without duplicates or gaps.
     */
    public EventSubscription subscribe(String jobId, JobEventListener listener) {
        EventChannel channel = channelFor(jobId);
        EventSubscription subscription = new EventSubscription(channel, listener, executor,
                this::reportLag, closed -> detach(channel, closed));
        channel.attach(subscription);

        try {
            long since = 0;
            while (!subscription.isClosed()) {
                List<JobEvent> page = store.read(jobId, since, BACKFILL_PAGE_SIZE);
                subscription.backfill(page);
                if (page.size() < BACKFILL_PAGE_SIZE) {
                    break;
                }
                since = page.get(page.size() - 1).sequence();
            }
        } catch (RuntimeException e) {
            subscription.unsubscribe();
            throw e;
        }

        subscription.goLive();
        log.debug("Subscribed to job {} (backfilled through #{})", jobId, subscription.cursor());
        return subscription;
    }

    /**
     * Marks the job's stream as ended. Subscribers complete once they have drained the buffer.
     * Idempotent.
     */
    public void finish(String jobId) {
        EventChannel channel = channels.get(jobId);
        if (channel == null) {
            return;
        }
        channel.finish();
        List<EventSubscription> current = new ArrayList<>(channel.subscriptions());
        for (EventSubscription subscription : current) {
            subscription.schedule();
        }
        if (!channel.hasSubscriptions()) {
            channels.remove(jobId, channel);
        }
    }

    @EventListener
    public void onJobTransitioned(JobTransitionedEvent event) {
        if (event.isTerminal()) {
            finish(event.job().id());
        }
    }

    /** Number of events currently held in the job's live buffer. */
    public int bufferedCount(String jobId) {
        EventChannel channel = channels.get(jobId);
        return channel == null ? 0 : channel.buffered();
    }

    public int subscriberCount(String jobId) {
        EventChannel channel = channels.get(jobId);
        return channel == null ? 0 : channel.subscriptions().size();
    }

    private EventChannel channelFor(String jobId) {
        return channels.computeIfAbsent(jobId, id -> new EventChannel(id, bufferCapacity));
    }

    private void detach(EventChannel channel, EventSubscription subscription) {
        channel.detach(subscription);
        if (channel.isFinished() && !channel.hasSubscriptions()) {
            channels.remove(channel.jobId(), channel);
        }
    }

    private void reportLag(long skipped) {
        if (metrics != null) {
            metrics.recordSubscriberLag(skipped);
        }
    }
}
