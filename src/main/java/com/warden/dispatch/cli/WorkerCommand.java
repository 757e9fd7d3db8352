package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.worker.OrchestratorClient;
import com.warden.worker.WorkerProperties;
import com.warden.worker.WorkerRuntime;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: warden worker, the generic worker entrypoint inside a sandbox.
 */
@Command(name = "worker", mixinStandardHelpOptions = true,
        description = "Run the generic agent worker for one job (inside a sandbox)")
@Component
public class WorkerCommand implements Callable<Integer> {

    @Option(names = "--job-id", required = true, description = "Job to run")
    private String jobId;

    @Option(names = "--orchestrator-url", defaultValue = "${env:WARDEN_ORCHESTRATOR_URL}",
            description = "Orchestrator base URL (default: $WARDEN_ORCHESTRATOR_URL)")
    private String orchestratorUrl;

    @Option(names = "--max-iterations", description = "Override the job's iteration bound")
    private Integer maxIterations;

    @Option(names = "--token", hidden = true, defaultValue = "${env:WARDEN_JOB_TOKEN}")
    private String token;

    private final WorkerRuntime runtime;
    private final ObjectMapper objectMapper;
    private final WorkerProperties properties;

    public WorkerCommand(WorkerRuntime runtime, ObjectMapper objectMapper, WorkerProperties properties) {
        this.runtime = runtime;
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
        return runtime.runGeneric(client, maxIterations);
    }
}
