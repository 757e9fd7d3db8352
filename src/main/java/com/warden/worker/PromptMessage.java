package com.warden.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A follow-up prompt delivered to a running bridge session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptMessage(String content, boolean done) {
}
