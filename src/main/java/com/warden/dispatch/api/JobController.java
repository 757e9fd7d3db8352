package com.warden.dispatch.api;

import com.warden.core.events.JobEvent;
import com.warden.core.jobs.FollowUpPrompt;
import com.warden.core.jobs.JobOrchestrator;
import com.warden.core.jobs.ValidationException;
import com.warden.core.model.Job;
import com.warden.core.model.JobFilter;
import com.warden.core.model.JobMode;
import com.warden.core.model.JobSummary;
import com.warden.sandbox.ProjectEntry;
import com.warden.sandbox.ProjectWorkspaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control API for jobs.
 * <p>
 * Creation and restart answer 202: the sandbox is provisioned in the background and the
 * returned job is still PENDING. Domain exceptions are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;
    private final ProjectWorkspaces workspaces;
    private final Clock clock;

    public JobController(JobOrchestrator orchestrator,
                         SseStreamingService sseStreamingService,
                         ProjectWorkspaces workspaces,
                         Clock clock) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
        this.workspaces = workspaces;
        this.clock = clock;
    }

    /**
     * POST /api/v1/jobs: Validate and queue a job.
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@RequestBody JobRequest request) {
        Job job = orchestrator.create(request.toSpec());
        log.info("Job {} accepted ({})", job.id(), job.mode().wireName());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(job));
    }

    /**
     * GET /api/v1/jobs: List jobs, newest first. {@code state} also accepts "stuck".
     */
    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String state,
                                  @RequestParam(required = false) String mode,
                                  @RequestParam(name = "routine_id", required = false) String routineId,
                                  @RequestParam(required = false) Integer limit) {
        JobMode parsedMode = null;
        if (mode != null && !mode.isBlank()) {
            try {
                parsedMode = JobMode.fromValue(mode);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
        }
        Instant now = clock.instant();
        return orchestrator.list(new JobFilter(state, parsedMode, routineId, limit)).stream()
                .map(job -> JobResponse.from(job, now, orchestrator.isStuck(job)))
                .toList();
    }

    @GetMapping("/summary")
    public JobSummary summary() {
        return orchestrator.summary();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable String id) {
        return toResponse(orchestrator.get(id));
    }

    /**
     * POST /api/v1/jobs/{id}/cancel: Idempotent; a terminal job is returned unchanged.
     */
    @PostMapping("/{id}/cancel")
    public JobResponse cancel(@PathVariable String id) {
        return toResponse(orchestrator.cancel(id));
    }

    /**
     * POST /api/v1/jobs/{id}/restart: New job from a FAILED or INTERRUPTED job's spec.
     */
    @PostMapping("/{id}/restart")
    public ResponseEntity<Map<String, Object>> restart(@PathVariable String id) {
        Job restarted = orchestrator.restart(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", restarted.id());
        body.put("restarted_from", id);
        body.put("state", restarted.state().name());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    /**
     * POST /api/v1/jobs/{id}/prompt: Queue a follow-up prompt for the running worker.
     */
    @PostMapping("/{id}/prompt")
    public ResponseEntity<Map<String, Object>> prompt(@PathVariable String id,
                                                      @RequestBody PromptRequest request) {
        FollowUpPrompt queued = orchestrator.queuePrompt(id, request.content(), request.isDone());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", id);
        body.put("queued", true);
        body.put("done", queued.done());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    /**
     * GET /api/v1/jobs/{id}/events: Stored events after {@code since}. {@code next_since}
     * is the cursor for the following page.
     */
    @GetMapping("/{id}/events")
    public Map<String, Object> events(@PathVariable String id,
                                      @RequestParam(defaultValue = "0") long since,
                                      @RequestParam(required = false) Integer limit) {
        List<JobEvent> events = orchestrator.events(id, since, limit);
        long next = events.isEmpty() ? since : events.get(events.size() - 1).sequence();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("events", events.stream().map(EventResponse::from).toList());
        body.put("next_since", next);
        return body;
    }

    /**
     * GET /api/v1/jobs/{id}/stream: stored events first, then live ones, as SSE.
     */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    @GetMapping("/{id}/files")
    public Map<String, Object> files(@PathVariable String id,
                                     @RequestParam(required = false, defaultValue = "") String path) {
        List<ProjectEntry> entries = workspaces.list(orchestrator.get(id), path);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("entries", entries);
        return body;
    }

    @GetMapping("/{id}/files/content")
    public Map<String, Object> fileContent(@PathVariable String id, @RequestParam String path) {
        String content = workspaces.read(orchestrator.get(id), path);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("content", content);
        return body;
    }

    private JobResponse toResponse(Job job) {
        return JobResponse.from(job, clock.instant(), orchestrator.isStuck(job));
    }
}
