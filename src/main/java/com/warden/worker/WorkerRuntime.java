package com.warden.worker;

import com.warden.core.events.JobEventType;
import com.warden.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a generic job inside the sandbox and reports it to the orchestrator.
 * <p>
 * Exactly one {@code result} event is sent per run, whatever the loop does: a result the
 * loop emits itself is taken as its outcome instead of being forwarded, and a failure or
 * exception becomes a failed result. The only exception is a job the orchestrator has
 * already ended, which accepts no result at all.
 */
@Component
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    static final String NO_AGENT_LOOP = "no agent loop is configured in this worker image";
    static final Set<String> TERMINAL_STATES = Set.of("COMPLETED", "FAILED", "INTERRUPTED", "CANCELLED");

    private final ObjectProvider<AgentLoop> agentLoop;
    private final WorkerProperties properties;

    public WorkerRuntime(ObjectProvider<AgentLoop> agentLoop, WorkerProperties properties) {
        this.agentLoop = agentLoop;
        this.properties = properties;
    }

    /**
     * @param maxIterations overrides the job's iteration bound when not null
     * @return process exit code: 0 on success
     */
    public int runGeneric(OrchestratorClient client, Integer maxIterations) {
        MdcContext.setJob(client.jobId(), "worker");
        ScheduledExecutorService heartbeat = startHeartbeat(client);
        AtomicBoolean loopResultSeen = new AtomicBoolean();
        Map<String, Object> loopResult = new LinkedHashMap<>();
        try {
            AssignedJob job = client.fetchSpec();
            int iterations = maxIterations != null ? maxIterations
                    : job.maxIterations() != null ? job.maxIterations() : 1;
            client.postEvent(JobEventType.STATUS, Map.of("status", "started", "max_iterations", iterations));

            AgentLoop loop = agentLoop.getIfAvailable();
            AgentOutcome outcome;
            if (loop == null) {
                log.error("Job {} cannot run: {}", client.jobId(), NO_AGENT_LOOP);
                outcome = AgentOutcome.failure(NO_AGENT_LOOP);
            } else {
                EventSink sink = (type, payload) -> {
                    if (type == JobEventType.RESULT) {
                        if (loopResultSeen.compareAndSet(false, true)) {
                            loopResult.putAll(payload);
                        }
                        return;
                    }
                    client.postEvent(type, payload);
                };
                outcome = runLoop(loop, job, iterations, sink);
                if (loopResultSeen.get()) {
                    outcome = new AgentOutcome(Boolean.TRUE.equals(loopResult.get("success")),
                            String.valueOf(loopResult.getOrDefault("message", outcome.summary())));
                }
            }
            return reportResult(client, outcome);
        } catch (OrchestratorClientException e) {
            if (e.isConflict()) {
                log.info("Job {} was ended by the orchestrator: {}", client.jobId(), e.getMessage());
                return 1;
            }
            log.error("Lost contact with orchestrator: {}", e.getMessage(), e);
            return reportResult(client, AgentOutcome.failure("worker error: " + e.getMessage()));
        } finally {
            heartbeat.shutdownNow();
            MdcContext.clear();
        }
    }

    private AgentOutcome runLoop(AgentLoop loop, AssignedJob job, int iterations, EventSink sink) {
        try {
            AgentOutcome outcome = loop.run(job, iterations, sink);
            return outcome != null ? outcome : AgentOutcome.failure("agent loop returned no outcome");
        } catch (OrchestratorClientException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AgentOutcome.failure("agent loop interrupted");
        } catch (Exception e) {
            log.error("Agent loop failed", e);
            return AgentOutcome.failure("agent loop failed: " + e.getMessage());
        }
    }

    /** Sends the single result event. */
    int reportResult(OrchestratorClient client, AgentOutcome outcome) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", outcome.success());
        payload.put("message", outcome.summary() != null ? outcome.summary() : "");
        try {
            client.postEvent(JobEventType.RESULT, payload);
        } catch (OrchestratorClientException e) {
            log.error("Could not report result for job {}: {}", client.jobId(), e.getMessage());
            return 1;
        }
        return outcome.success() ? 0 : 1;
    }

    ScheduledExecutorService startHeartbeat(OrchestratorClient client) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "worker-heartbeat");
            t.setDaemon(true);
            return t;
        });
        int interval = Math.max(1, properties.getHeartbeatIntervalSeconds());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                String state = client.heartbeat();
                if (TERMINAL_STATES.contains(state)) {
                    log.info("Orchestrator reports job {} as {}", client.jobId(), state);
                }
            } catch (OrchestratorClientException e) {
                log.warn("Heartbeat failed: {}", e.getMessage());
            }
        }, interval, interval, TimeUnit.SECONDS);
        return scheduler;
    }
}
