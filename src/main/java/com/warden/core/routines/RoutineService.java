package com.warden.core.routines;

import com.warden.core.jobs.JobSpecValidator;
import com.warden.core.jobs.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Routine definitions: create, toggle, delete, and the read side (detail, runs, summary).
 * Firing lives in {@link RoutineScheduler}.
 */
@Service
public class RoutineService {

    private static final Logger log = LoggerFactory.getLogger(RoutineService.class);

    private static final Pattern WEBHOOK_PATH = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final RoutineStore store;
    private final JobSpecValidator jobSpecValidator;
    private final RoutineProperties properties;
    private final Clock clock;

    public RoutineService(RoutineStore store,
                          JobSpecValidator jobSpecValidator,
                          RoutineProperties properties,
                          Clock clock) {
        this.store = store;
        this.jobSpecValidator = jobSpecValidator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws ValidationException if the name, trigger or action is invalid, or a webhook
     *                             path is already taken
     */
    public Routine create(RoutineDefinition definition) {
        if (definition == null || definition.name() == null || definition.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        RoutineTrigger trigger = definition.trigger();
        validateTrigger(trigger);
        if (definition.action() == null) {
            throw new ValidationException("action is required");
        }
        if (definition.action().prompt() == null || definition.action().prompt().isBlank()) {
            throw new ValidationException("action prompt is required");
        }
        long cooldown = definition.cooldownSecs() != null ? definition.cooldownSecs() : properties.getDefaultCooldownSecs();
        if (cooldown < 0) {
            throw new ValidationException("cooldown_secs must not be negative");
        }
        int maxConcurrent = definition.maxConcurrent() != null ? definition.maxConcurrent() : 1;
        if (maxConcurrent < 1) {
            throw new ValidationException("max_concurrent must be at least 1");
        }

        Instant now = clock.instant();
        boolean enabled = definition.enabled() == null || definition.enabled();
        Routine routine = new Routine(UUID.randomUUID().toString(), definition.name().trim(),
                definition.description(), enabled, trigger, definition.action(), cooldown, maxConcurrent,
                0, 0, null, enabled ? nextFireAt(trigger, now) : null, now);

        // The job this routine will launch must itself be valid
        jobSpecValidator.validate(routine.action().toJobSpec(routine, properties));

        store.save(routine);
        log.info("Created routine {} '{}' ({})", routine.id(), routine.name(), trigger.summary());
        return routine;
    }

    public Routine get(String id) {
        return store.find(id).orElseThrow(() -> new RoutineNotFoundException("Routine not found: " + id));
    }

    /** Most recently created first. */
    public List<Routine> list() {
        return store.findAll().stream()
                .sorted(Comparator.comparing(Routine::createdAt).reversed())
                .toList();
    }

    /**
     * Flips {@code enabled}. Enabling a cron routine schedules its next fire from now;
     * disabling clears it.
     */
    public Routine toggle(String id) {
        Routine routine = get(id);
        boolean enabled = !routine.enabled();
        Instant next = enabled ? nextFireAt(routine.trigger(), clock.instant()) : null;
        Routine updated = routine.withEnabled(enabled, next);
        store.save(updated);
        log.info("Routine {} {}", id, enabled ? "enabled" : "disabled");
        return updated;
    }

    public void delete(String id) {
        if (!store.delete(id)) {
            throw new RoutineNotFoundException("Routine not found: " + id);
        }
        log.info("Deleted routine {}", id);
    }

    public List<RoutineRun> runs(String id, Integer limit) {
        get(id);
        int effective = limit == null || limit < 1 ? properties.getRecentRunsLimit() : Math.min(limit, properties.getRunHistoryLimit());
        return store.listRuns(id, effective);
    }

    public List<RoutineRun> recentRuns(String id) {
        return store.listRuns(id, properties.getRecentRunsLimit());
    }

    public RoutineSummary summary() {
        List<Routine> all = store.findAll();
        long enabled = all.stream().filter(Routine::enabled).count();
        long failing = all.stream().filter(r -> r.status() == RoutineStatus.FAILING).count();
        Instant midnight = LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay().toInstant(ZoneOffset.UTC);
        return new RoutineSummary(all.size(), enabled, all.size() - enabled, failing, store.countRunsSince(midnight));
    }

    /** Next cron fire strictly after {@code after}; null for other trigger types. */
    public Instant nextFireAt(RoutineTrigger trigger, Instant after) {
        if (trigger.type() != TriggerType.CRON) {
            return null;
        }
        return CronSchedule.parse(trigger.schedule()).nextAfter(after, zone());
    }

    ZoneId zone() {
        return ZoneId.of(properties.getZone());
    }

    private void validateTrigger(RoutineTrigger trigger) {
        if (trigger == null || trigger.type() == null) {
            throw new ValidationException("trigger is required");
        }
        switch (trigger.type()) {
            case CRON -> CronSchedule.parse(trigger.schedule());
            case EVENT -> {
                if (trigger.pattern() == null || trigger.pattern().isEmpty()) {
                    throw new ValidationException("pattern is required for event triggers");
                }
                try {
                    Pattern.compile(trigger.pattern());
                } catch (PatternSyntaxException e) {
                    throw new ValidationException("Invalid pattern: " + e.getDescription(), e);
                }
            }
            case WEBHOOK -> {
                String path = trigger.webhookPath();
                if (path == null || !WEBHOOK_PATH.matcher(path).matches()) {
                    throw new ValidationException("webhook path must match [A-Za-z0-9_-]{1,64}");
                }
                if (store.findByWebhookPath(path).isPresent()) {
                    throw new ValidationException("webhook path already in use: " + path);
                }
            }
            case MANUAL -> {
                // nothing to check
            }
        }
    }
}
