package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.jobs.ValidationException;
import com.warden.core.model.JobMode;
import com.warden.core.routines.ActionType;
import com.warden.core.routines.RoutineAction;
import com.warden.core.routines.RoutineDefinition;
import com.warden.core.routines.RoutineTrigger;
import com.warden.core.routines.TriggerType;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/routines.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutineRequest(
    String name,
    String description,
    Boolean enabled,
    Trigger trigger,
    Action action,
    @JsonProperty("cooldown_secs") Long cooldownSecs,
    @JsonProperty("max_concurrent") Integer maxConcurrent
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Trigger(
        String type,
        String schedule,
        String pattern,
        String channel,
        @JsonProperty("webhook_path") String webhookPath,
        @JsonProperty("webhook_secret") String webhookSecret
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Action(
        String type,
        String prompt,
        String title,
        String mode,
        @JsonProperty("max_iterations") Integer maxIterations,
        @JsonProperty("allowed_domains") List<String> allowedDomains,
        @JsonProperty("credential_grants") Map<String, String> credentialGrants
    ) {}

    public RoutineDefinition toDefinition() {
        if (trigger == null) {
            throw new ValidationException("trigger is required");
        }
        if (action == null) {
            throw new ValidationException("action is required");
        }
        TriggerType triggerType = TriggerType.fromWire(trigger.type());
        var routineTrigger = new RoutineTrigger(triggerType, trigger.schedule(), trigger.pattern(),
                trigger.channel(), trigger.webhookPath(), trigger.webhookSecret());

        JobMode mode;
        try {
            mode = action.mode() == null || action.mode().isBlank() ? null : JobMode.fromValue(action.mode());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        var routineAction = new RoutineAction(ActionType.fromWire(action.type()), action.prompt(), action.title(),
                mode, action.maxIterations(), action.allowedDomains(), action.credentialGrants());

        return new RoutineDefinition(name, description, enabled, routineTrigger, routineAction,
                cooldownSecs, maxConcurrent);
    }
}
