package com.warden.sandbox;

/**
 * Sandbox could not be provisioned. Surfaces as a FAILED transition, never to API callers.
 */
public class ProvisionException extends RuntimeException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
