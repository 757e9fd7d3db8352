package com.warden.sandbox;

/**
 * A running sandbox: its container and its private network.
 */
public record SandboxHandle(String jobId, String sandboxId, String networkId) {
}
