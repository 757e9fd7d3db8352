package com.warden.dispatch.api;

import com.warden.core.routines.FireOutcome;
import com.warden.core.routines.Routine;
import com.warden.core.routines.RoutineScheduler;
import com.warden.core.routines.RoutineService;
import com.warden.core.routines.RoutineSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routine API: definitions, manual and webhook fires, incoming channel messages.
 */
@RestController
@RequestMapping("/api/v1/routines")
public class RoutineController {

    private static final Logger log = LoggerFactory.getLogger(RoutineController.class);

    static final String WEBHOOK_SECRET_HEADER = "X-Webhook-Secret";

    private final RoutineService routineService;
    private final RoutineScheduler scheduler;

    public RoutineController(RoutineService routineService, RoutineScheduler scheduler) {
        this.routineService = routineService;
        this.scheduler = scheduler;
    }

    @PostMapping
    public ResponseEntity<RoutineResponse> create(@RequestBody RoutineRequest request) {
        Routine routine = routineService.create(request.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(RoutineResponse.from(routine, null));
    }

    @GetMapping
    public List<RoutineResponse> list() {
        return routineService.list().stream()
                .map(routine -> RoutineResponse.from(routine, null))
                .toList();
    }

    @GetMapping("/summary")
    public RoutineSummary summary() {
        return routineService.summary();
    }

    @GetMapping("/{id}")
    public RoutineResponse get(@PathVariable String id) {
        return RoutineResponse.from(routineService.get(id), routineService.recentRuns(id));
    }

    @PostMapping("/{id}/toggle")
    public RoutineResponse toggle(@PathVariable String id) {
        return RoutineResponse.from(routineService.toggle(id), null);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        routineService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/routines/{id}/trigger: Fire now, regardless of cooldown or the enabled flag.
     */
    @PostMapping("/{id}/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String id) {
        return outcomeResponse(scheduler.fireManual(id));
    }

    @GetMapping("/{id}/runs")
    public List<RoutineResponse.RunView> runs(@PathVariable String id,
                                              @RequestParam(required = false) Integer limit) {
        return routineService.runs(id, limit).stream().map(RoutineResponse.RunView::from).toList();
    }

    /**
     * POST /api/v1/routines/events: An incoming channel message, matched against event routines.
     */
    @PostMapping("/events")
    public Map<String, Object> incomingEvent(@RequestBody IncomingEventRequest request) {
        List<FireOutcome> outcomes = scheduler.onIncomingEvent(request.channel(), request.text());
        log.debug("Incoming event on channel {} matched {} routines", request.channel(), outcomes.size());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("matched", outcomes.size());
        body.put("outcomes", outcomes.stream().map(RoutineController::outcomeBody).toList());
        return body;
    }

    @PostMapping("/webhook/{path}")
    public ResponseEntity<Map<String, Object>> webhook(
            @PathVariable String path,
            @RequestHeader(name = WEBHOOK_SECRET_HEADER, required = false) String secret) {
        return outcomeResponse(scheduler.fireWebhook(path, secret));
    }

    private static ResponseEntity<Map<String, Object>> outcomeResponse(FireOutcome outcome) {
        HttpStatus status = outcome.fired() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(outcomeBody(outcome));
    }

    private static Map<String, Object> outcomeBody(FireOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("routine_id", outcome.routineId());
        body.put("fired", outcome.fired());
        if (outcome.run() != null) {
            body.put("run_id", outcome.run().id());
            body.put("run_status", outcome.run().status().wireName());
            if (outcome.run().jobId() != null) {
                body.put("job_id", outcome.run().jobId());
            }
        }
        if (outcome.skipReason() != null) {
            body.put("skip_reason", outcome.skipReason());
        }
        return body;
    }
}
