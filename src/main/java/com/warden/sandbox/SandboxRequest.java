package com.warden.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything a provider needs to start one job's worker.
 *
 * @param projectPath host path bind-mounted as the worker's workspace
 * @param env         the complete worker environment; nothing else is passed in
 * @param command     arguments for the worker image entrypoint
 */
public record SandboxRequest(
    String jobId,
    String image,
    Path projectPath,
    Map<String, String> env,
    List<String> command,
    int memoryLimitMb,
    int cpuCount,
    boolean networkInternal
) {

    public SandboxRequest {
        env = Map.copyOf(env);
        command = List.copyOf(command);
    }
}
