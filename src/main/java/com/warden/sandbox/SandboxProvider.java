package com.warden.sandbox;

import java.util.Set;

/**
 * Abstraction for container orchestration.
 * Implementation: DockerSandboxProvider.
 */
public interface SandboxProvider {

    /**
     * Creates the job's network and container and starts it.
     *
     * @throws ProvisionException if any step fails; partial resources are cleaned up
     */
    SandboxHandle openSandbox(SandboxRequest request);

    SandboxStatus inspect(SandboxHandle handle);

    /**
     * Stops (with the configured grace period), force-removes the container and removes
     * the network. Never throws; missing resources are treated as already removed.
     */
    void teardownSandbox(SandboxHandle handle, int stopGraceSeconds);

    /**
     * Removes labelled sandboxes and networks whose job id is not in {@code keepJobIds}.
     *
     * @return number of containers removed
     */
    int removeOrphans(Set<String> keepJobIds);

    /** True when the container runtime answers. */
    boolean ping();
}
