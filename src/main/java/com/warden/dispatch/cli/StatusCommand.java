package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI command: warden status &lt;job-id&gt; [--watch]
 * <p>
 * Reads a job from a running orchestrator and prints its state and result. With
 * {@code --watch} it follows the job's SSE stream until the job ends.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show a job's status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Job ID")
    private String jobId;

    @Option(names = {"--watch", "-w"}, description = "Follow live events via SSE")
    private boolean watch;

    @Option(names = {"--url"}, description = "Orchestrator base URL (default: ${DEFAULT-VALUE})",
            defaultValue = "http://localhost:8080")
    private String url;

    private final ObjectMapper objectMapper;
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            if (watch) {
                return runWatchMode();
            }
            return printStatus();
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Warden server at " + url);
            ConsoleOutput.info("Start the server first: warden serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 130;
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
            return 1;
        }
    }

    private int printStatus() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(base() + "/api/v1/jobs/" + jobId))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == 404) {
            ConsoleOutput.error("Job not found: " + jobId);
            return 1;
        }
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Server returned HTTP " + response.statusCode());
            return 1;
        }

        JsonNode job = objectMapper.readTree(response.body());
        System.out.println();
        System.out.println("JOB " + job.path("job_id").asText());
        System.out.println("Title: " + job.path("title").asText("-"));
        System.out.println("Mode: " + job.path("mode").asText("-"));
        ConsoleOutput.state(job.path("state").asText());
        if (job.path("stuck").asBoolean(false)) {
            ConsoleOutput.error("No activity for a while: the job looks stuck");
        }
        System.out.println("Elapsed: " + ConsoleOutput.formatDuration(job.path("elapsed_secs").asLong()));
        if (job.hasNonNull("restarted_from")) {
            System.out.println("Restarted from: " + job.path("restarted_from").asText());
        }

        JsonNode transitions = job.path("transitions");
        if (transitions.isArray() && !transitions.isEmpty()) {
            System.out.println();
            System.out.printf("  %-12s %-12s %-26s %s%n", "FROM", "TO", "AT", "REASON");
            System.out.println("  " + "-".repeat(72));
            for (JsonNode t : transitions) {
                System.out.printf("  %-12s %-12s %-26s %s%n",
                        t.path("from").asText(), t.path("to").asText(),
                        t.path("timestamp").asText(), truncate(t.path("reason").asText(), 40));
            }
        }

        JsonNode result = job.path("result");
        if (!result.isMissingNode() && !result.isNull()) {
            System.out.println();
            if (result.path("success").asBoolean()) {
                ConsoleOutput.success(result.path("message").asText());
            } else {
                ConsoleOutput.error(result.path("message").asText());
            }
        }
        return 0;
    }

    private int runWatchMode() throws Exception {
        ConsoleOutput.info("Watching job " + jobId + " at " + base() + "...");
        System.out.println();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(base() + "/api/v1/jobs/" + jobId + "/stream"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();

        HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() == 404) {
            ConsoleOutput.error("Job not found: " + jobId);
            return 1;
        }
        if (response.statusCode() != 200) {
            ConsoleOutput.error("Server returned HTTP " + response.statusCode());
            return 1;
        }

        final String[] currentEventType = {""};
        try (Stream<String> lines = response.body()) {
            lines.forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });
        }

        System.out.println();
        ConsoleOutput.info("Stream ended.");
        return 0;
    }

    private String base() {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
