package com.warden.sandbox;

/**
 * @param exitCode container exit code; only meaningful when {@code running} is false
 */
public record SandboxStatus(boolean exists, boolean running, long exitCode) {

    public static SandboxStatus gone() {
        return new SandboxStatus(false, false, -1);
    }

    public boolean exited() {
        return !running;
    }
}
