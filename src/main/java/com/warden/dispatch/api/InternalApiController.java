package com.warden.dispatch.api;

import com.warden.core.events.JobEvent;
import com.warden.core.jobs.JobOrchestrator;
import com.warden.core.logging.MdcContext;
import com.warden.core.model.Job;
import com.warden.core.model.JobSpec;
import com.warden.core.model.JobState;
import com.warden.worker.AssignedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Internal API called by workers from inside their sandbox.
 * <p>
 * Every path is guarded by {@link com.warden.core.security.WorkerTokenInterceptor}: the bearer
 * token must have been minted for the job in the path.
 */
@RestController
@RequestMapping("/internal/jobs/{id}")
public class InternalApiController {

    private static final Logger log = LoggerFactory.getLogger(InternalApiController.class);

    private final JobOrchestrator orchestrator;

    public InternalApiController(JobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> postEvent(@PathVariable String id,
                                                         @RequestBody EventRequest request) {
        MdcContext.setJob(id);
        try {
            JobEvent event = orchestrator.recordEvent(id, request.eventType(), request.payload());
            log.debug("Ingested {} #{}", event.eventType().wireName(), event.sequence());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("sequence", event.sequence()));
        } finally {
            MdcContext.clear();
        }
    }

    @PostMapping("/heartbeat")
    public Map<String, Object> heartbeat(@PathVariable String id) {
        JobState state = orchestrator.heartbeat(id);
        return Map.of("state", state.name());
    }

    /**
     * GET /internal/jobs/{id}/spec: What the worker should do. Credential grants are
     * left out: credentials are applied by the egress proxy.
     */
    @GetMapping("/spec")
    public AssignedJob spec(@PathVariable String id) {
        Job job = orchestrator.get(id);
        JobSpec spec = job.spec();
        log.info("Serving spec of job {} to its worker", id);
        return new AssignedJob(job.id(), spec.title(), spec.description(), spec.mode().wireName(),
                spec.maxIterations(), spec.maxTurns(), spec.model(), spec.allowedDomains());
    }

    /**
     * GET /internal/jobs/{id}/prompt: Next follow-up prompt, 204 when none is queued.
     */
    @GetMapping("/prompt")
    public ResponseEntity<Map<String, Object>> prompt(@PathVariable String id) {
        return orchestrator.pollPrompt(id)
                .<ResponseEntity<Map<String, Object>>>map(prompt ->
                        ResponseEntity.ok(Map.of("content", prompt.content(), "done", prompt.done())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
