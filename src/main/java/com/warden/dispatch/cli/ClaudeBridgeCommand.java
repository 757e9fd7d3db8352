package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.worker.ClaudeBridgeRunner;
import com.warden.worker.OrchestratorClient;
import com.warden.worker.WorkerProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: warden claude-bridge. Drives the coding-agent CLI inside a sandbox and
 * relays its output as job events.
 */
@Command(name = "claude-bridge", mixinStandardHelpOptions = true,
        description = "Run the coding-agent bridge for one job (inside a sandbox)")
@Component
public class ClaudeBridgeCommand implements Callable<Integer> {

    @Option(names = "--job-id", required = true, description = "Job to run")
    private String jobId;

    @Option(names = "--orchestrator-url", defaultValue = "${env:WARDEN_ORCHESTRATOR_URL}",
            description = "Orchestrator base URL (default: $WARDEN_ORCHESTRATOR_URL)")
    private String orchestratorUrl;

    @Option(names = "--max-turns", description = "Override the job's turn bound")
    private Integer maxTurns;

    @Option(names = "--model", description = "Override the job's model")
    private String model;

    @Option(names = "--token", hidden = true, defaultValue = "${env:WARDEN_JOB_TOKEN}")
    private String token;

    private final ClaudeBridgeRunner runner;
    private final ObjectMapper objectMapper;
    private final WorkerProperties properties;

    public ClaudeBridgeCommand(ClaudeBridgeRunner runner, ObjectMapper objectMapper, WorkerProperties properties) {
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        if (orchestratorUrl == null || orchestratorUrl.isBlank() || token == null || token.isBlank()) {
            ConsoleOutput.error("WARDEN_ORCHESTRATOR_URL and WARDEN_JOB_TOKEN must be set");
            return 2;
        }
        var client = new OrchestratorClient(orchestratorUrl, jobId, token, objectMapper, properties);
        return runner.run(client, maxTurns, model);
    }
}
