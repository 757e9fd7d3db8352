package com.warden.core.jobs;

import java.time.Instant;

/**
 * Operator message queued for a running job.
 *
 * @param done true when the operator ends the session after this prompt
 */
public record FollowUpPrompt(String content, boolean done, Instant queuedAt) {
}
