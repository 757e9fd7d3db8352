package com.warden.dispatch.api;

import com.warden.core.events.EventSubscription;
import com.warden.core.events.JobEvent;
import com.warden.core.events.JobEventListener;
import com.warden.core.jobs.JobOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bridges job event subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each frame carries the event type as the SSE event name and the sequence as the SSE id,
 * so a client that reconnects can resume through {@code GET /events?since=}. The emitter
 * is completed once the job has ended and every event was delivered.
 * <p>
 * Heartbeats are SSE comments, ignored by EventSource clients but enough to keep idle
 * connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 2 hours, longer than the default job timeout. */
    private static final long DEFAULT_TIMEOUT_MS = 2 * 60 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final JobOrchestrator orchestrator;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(JobOrchestrator orchestrator) {
        this(orchestrator, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(JobOrchestrator orchestrator, long timeoutMs) {
        this.orchestrator = orchestrator;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (EmitterRegistration registration : activeRegistrations) {
            registration.emitter().complete();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for job {} (connection likely closed): {}",
                        registration.jobId(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for job {} (emitter not active)", registration.jobId());
            }
        }
    }

    /**
     * Creates an emitter that replays the job's stored events and then follows it live.
     *
     * @throws com.warden.core.jobs.JobNotFoundException if the job does not exist
     */
    public SseEmitter createEmitter(String jobId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicReference<EmitterRegistration> ref = new AtomicReference<>();

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for job {}", jobId);
            cleanup(ref.get());
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for job {}", jobId);
            cleanup(ref.get());
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for job {}: {}", jobId, ex.getMessage());
            cleanup(ref.get());
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for job {}: {}", jobId, e.getMessage());
        }

        EventSubscription subscription = orchestrator.subscribe(jobId, new JobEventListener() {
            @Override
            public void onEvent(JobEvent event) {
                sendEvent(emitter, event);
            }

            @Override
            public void onComplete() {
                log.debug("Job {} stream finished, completing SSE emitter", jobId);
                emitter.complete();
            }
        });

        var registration = new EmitterRegistration(jobId, emitter, subscription);
        ref.set(registration);
        if (!subscription.isClosed()) {
            activeRegistrations.add(registration);
        }

        log.info("SSE emitter created for job {} (timeout={}ms)", jobId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, JobEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .id(Long.toString(event.sequence()))
                    .name(event.eventType().wireName())
                    .data(EventResponse.from(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event #{} for job {}: {}",
                    event.sequence(), event.jobId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (registration == null) {
            return;
        }
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for job {}", registration.jobId());
    }

    private record EmitterRegistration(
            String jobId,
            SseEmitter emitter,
            EventSubscription subscription
    ) {}
}
