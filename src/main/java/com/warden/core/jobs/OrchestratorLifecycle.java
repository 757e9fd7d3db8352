package com.warden.core.jobs;

import com.warden.core.model.Job;
import com.warden.core.model.JobState;
import com.warden.sandbox.SandboxSupervisor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Process-level bookends for the server: recovers jobs a previous process left active,
 * and ends the active ones when this process stops.
 */
@Component
@ConditionalOnWebApplication
public class OrchestratorLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLifecycle.class);

    static final String RESTART_REASON = "orchestrator restarted";
    static final String SHUTDOWN_REASON = "orchestrator shutdown";

    private final JobRegistry registry;
    private final SandboxSupervisor supervisor;

    public OrchestratorLifecycle(JobRegistry registry, SandboxSupervisor supervisor) {
        this.registry = registry;
        this.supervisor = supervisor;
    }

    /**
     * No sandbox survives a restart under supervision, so jobs still marked active belong
     * to the previous process.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        int recovered = 0;
        for (Job job : registry.active()) {
            if (supervisor.hasSandbox(job.id())) {
                continue;
            }
            JobState target = job.state() == JobState.PENDING ? JobState.FAILED : JobState.INTERRUPTED;
            try {
                registry.transition(job.id(), target, RESTART_REASON);
                recovered++;
            } catch (StateConflictException e) {
                log.debug("Job {} changed state during recovery: {}", job.id(), e.getMessage());
            }
        }
        if (recovered > 0) {
            log.info("Marked {} job(s) from a previous run as ended", recovered);
        }
        try {
            supervisor.removeOrphans();
        } catch (RuntimeException e) {
            log.warn("Could not remove orphaned sandboxes: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping active jobs");
        supervisor.shutdown(SHUTDOWN_REASON);
    }
}
