package com.warden.core.routines;

/**
 * A webhook call did not present the routine's configured secret. Surfaced as HTTP 401.
 */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String path) {
        super("Invalid or missing webhook secret for " + path);
    }
}
