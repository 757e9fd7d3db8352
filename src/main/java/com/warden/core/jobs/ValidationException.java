package com.warden.core.jobs;

/**
 * A request (job spec, routine definition, route parameter) is malformed. Surfaced as HTTP 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
