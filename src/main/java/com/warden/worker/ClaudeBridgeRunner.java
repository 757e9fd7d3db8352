package com.warden.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.JobEventType;
import com.warden.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Coding-bridge entrypoint: runs the coding agent CLI in the workspace, one process per
 * turn, and relays its stream as job events.
 *
 * <p>Flow: fetch spec -> run first turn with the job description -> while follow-up
 * prompts arrive, resume the same session with them -> send the single result.
 */
@Component
public class ClaudeBridgeRunner {

    private static final Logger log = LoggerFactory.getLogger(ClaudeBridgeRunner.class);

    private static final Duration PROMPT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final WorkerProperties properties;
    private final WorkerRuntime runtime;
    private final StreamJsonTranslator translator;

    public ClaudeBridgeRunner(WorkerProperties properties, WorkerRuntime runtime, ObjectMapper objectMapper) {
        this.properties = properties;
        this.runtime = runtime;
        this.translator = new StreamJsonTranslator(objectMapper);
    }

    /**
     * @return process exit code: 0 when the last turn succeeded
     */
    public int run(OrchestratorClient client, Integer maxTurns, String model) {
        MdcContext.setJob(client.jobId(), "claude_code");
        ScheduledExecutorService heartbeat = runtime.startHeartbeat(client);
        try {
            AssignedJob job = client.fetchSpec();
            int turns = maxTurns != null ? maxTurns : job.maxTurns() != null ? job.maxTurns() : 30;
            String effectiveModel = model != null ? model : job.model();

            StreamJsonTranslator.TurnResult last = runTurn(client, job.description(), null, turns, effectiveModel);
            String sessionId = last.sessionId();
            while (last.success()) {
                Optional<PromptMessage> next = awaitFollowUp(client);
                if (next.isEmpty() || next.get().content() == null || next.get().content().isBlank()) {
                    break;
                }
                client.postEvent(JobEventType.STATUS, Map.of("status", "follow_up_received"));
                last = runTurn(client, next.get().content(), sessionId, turns, effectiveModel);
                if (last.sessionId() != null) {
                    sessionId = last.sessionId();
                }
                if (next.get().done()) {
                    break;
                }
            }
            return sendResult(client, last, sessionId);
        } catch (OrchestratorClientException e) {
            if (e.isConflict()) {
                log.info("Job {} was ended by the orchestrator: {}", client.jobId(), e.getMessage());
                return 1;
            }
            log.error("Lost contact with orchestrator: {}", e.getMessage(), e);
            return runtime.reportResult(client, AgentOutcome.failure("bridge error: " + e.getMessage()));
        } finally {
            heartbeat.shutdownNow();
            MdcContext.clear();
        }
    }

    StreamJsonTranslator.TurnResult runTurn(OrchestratorClient client, String prompt, String resumeSession,
                                            int maxTurns, String model) {
        List<String> command = buildCommand(prompt, resumeSession, maxTurns, model);
        log.info("Starting coding agent turn{}", resumeSession != null ? " (resuming " + resumeSession + ")" : "");

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(Path.of(properties.getWorkspace()).toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(Path.of("/dev/null").toFile()))
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            return new StreamJsonTranslator.TurnResult(false,
                    "could not start " + properties.getClaudeBinary() + ": " + e.getMessage(), resumeSession, null, null);
        }
        Thread stderr = drainStderr(process);

        StreamJsonTranslator.TurnResult result = null;
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                StreamJsonTranslator.Translation translation = translator.translate(line);
                for (StreamJsonTranslator.BridgeEvent event : translation.events()) {
                    client.postEvent(event.type(), event.payload());
                }
                if (translation.result() != null) {
                    result = translation.result();
                }
            }
            int exitCode = process.waitFor();
            stderr.join(1000);
            if (result == null) {
                result = new StreamJsonTranslator.TurnResult(false,
                        "coding agent exited with code " + exitCode + " without a result", resumeSession, null, null);
            }
        } catch (IOException e) {
            process.destroyForcibly();
            result = new StreamJsonTranslator.TurnResult(false,
                    "lost coding agent output: " + e.getMessage(), resumeSession, null, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            result = new StreamJsonTranslator.TurnResult(false, "bridge interrupted", resumeSession, null, null);
        } catch (OrchestratorClientException e) {
            process.destroyForcibly();
            throw e;
        }
        return result;
    }

    List<String> buildCommand(String prompt, String resumeSession, int maxTurns, String model) {
        List<String> command = new ArrayList<>();
        command.add(properties.getClaudeBinary());
        command.add("-p");
        command.add(prompt);
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--max-turns");
        command.add(String.valueOf(maxTurns));
        if (model != null && !model.isBlank()) {
            command.add("--model");
            command.add(model);
        }
        if (resumeSession != null) {
            command.add("--resume");
            command.add(resumeSession);
        }
        // The sandbox is the permission boundary
        command.add("--dangerously-skip-permissions");
        return command;
    }

    Optional<PromptMessage> awaitFollowUp(OrchestratorClient client) {
        Instant deadline = Instant.now().plusSeconds(properties.getFollowUpWaitSeconds());
        do {
            Optional<PromptMessage> prompt = client.pollPrompt();
            if (prompt.isPresent()) {
                return prompt;
            }
            if (!Instant.now().isBefore(deadline)) {
                return Optional.empty();
            }
            try {
                Thread.sleep(PROMPT_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        } while (true);
    }

    private int sendResult(OrchestratorClient client, StreamJsonTranslator.TurnResult last, String sessionId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", last.success());
        payload.put("message", last.text() != null && !last.text().isBlank()
                ? last.text()
                : last.success() ? "completed" : "coding agent failed");
        if (sessionId != null) {
            payload.put("session_id", sessionId);
        }
        if (last.numTurns() != null) {
            payload.put("num_turns", last.numTurns());
        }
        if (last.costUsd() != null) {
            payload.put("cost_usd", last.costUsd());
        }
        client.postEvent(JobEventType.RESULT, payload);
        return last.success() ? 0 : 1;
    }

    private static Thread drainStderr(Process process) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("coding agent: {}", line);
                }
            } catch (IOException e) {
                log.debug("stderr closed: {}", e.getMessage());
            }
        }, "bridge-stderr");
        t.setDaemon(true);
        t.start();
        return t;
    }
}
