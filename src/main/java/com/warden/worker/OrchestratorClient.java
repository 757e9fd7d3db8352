package com.warden.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.JobEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the orchestrator's internal API, used from inside the sandbox.
 *
 * <p>Every call carries the job token as a bearer token. The orchestrator is reached
 * directly, never through the egress proxy.
 */
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final String baseUrl;
    private final String jobId;
    private final String token;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final int postAttempts;

    public OrchestratorClient(String orchestratorUrl, String jobId, String token, ObjectMapper objectMapper,
                              WorkerProperties properties) {
        this(orchestratorUrl, jobId, token, objectMapper,
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .proxy(HttpClient.Builder.NO_PROXY)
                        .build(),
                Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
                properties.getEventPostAttempts());
    }

    OrchestratorClient(String orchestratorUrl, String jobId, String token, ObjectMapper objectMapper,
                       HttpClient httpClient, Duration requestTimeout, int postAttempts) {
        this.baseUrl = stripTrailingSlash(orchestratorUrl) + "/internal/jobs/" + jobId;
        this.jobId = jobId;
        this.token = token;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.postAttempts = Math.max(1, postAttempts);
    }

    public String jobId() {
        return jobId;
    }

    public AssignedJob fetchSpec() {
        HttpResponse<String> response = send(request("/spec").GET().build());
        expectSuccess("GET spec", response);
        try {
            return objectMapper.readValue(response.body(), AssignedJob.class);
        } catch (JsonProcessingException e) {
            throw new OrchestratorClientException("Malformed job spec from orchestrator", e);
        }
    }

    /**
     * Posts one event, retrying transport failures and 5xx responses. A 4xx is final.
     *
     * @return the sequence the orchestrator assigned
     */
    public long postEvent(JobEventType type, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event_type", type.wireName());
        body.put("payload", payload);
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable", e);
        }

        OrchestratorClientException last = null;
        for (int attempt = 1; attempt <= postAttempts; attempt++) {
            try {
                HttpResponse<String> response = send(request("/events")
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json))
                        .build());
                if (response.statusCode() >= 500) {
                    last = new OrchestratorClientException(response.statusCode(),
                            "POST events failed (HTTP %d): %s".formatted(response.statusCode(), response.body()));
                } else {
                    expectSuccess("POST events", response);
                    JsonNode node = objectMapper.readTree(response.body());
                    return node.path("sequence").asLong(-1);
                }
            } catch (OrchestratorClientException e) {
                if (e.getStatus() >= 400 && e.getStatus() < 500) {
                    throw e;
                }
                last = e;
            } catch (JsonProcessingException e) {
                throw new OrchestratorClientException("Malformed event acknowledgement", e);
            }
            if (attempt < postAttempts) {
                log.warn("Posting {} event failed (attempt {}/{}): {}", type.wireName(), attempt, postAttempts,
                        last.getMessage());
                sleep(Duration.ofMillis(500L * attempt));
            }
        }
        throw last;
    }

    /**
     * @return the job state the orchestrator reports
     */
    public String heartbeat() {
        HttpResponse<String> response = send(request("/heartbeat")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());
        expectSuccess("POST heartbeat", response);
        try {
            return objectMapper.readTree(response.body()).path("state").asText("");
        } catch (JsonProcessingException e) {
            throw new OrchestratorClientException("Malformed heartbeat response", e);
        }
    }

    public Optional<PromptMessage> pollPrompt() {
        HttpResponse<String> response = send(request("/prompt").GET().build());
        if (response.statusCode() == 204) {
            return Optional.empty();
        }
        expectSuccess("GET prompt", response);
        try {
            return Optional.of(objectMapper.readValue(response.body(), PromptMessage.class));
        } catch (JsonProcessingException e) {
            throw new OrchestratorClientException("Malformed prompt from orchestrator", e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OrchestratorClientException("Orchestrator request failed: " + request.method() + " "
                    + request.uri().getPath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestratorClientException("Interrupted calling orchestrator", e);
        }
    }

    private static void expectSuccess(String what, HttpResponse<String> response) {
        if (response.statusCode() >= 400) {
            throw new OrchestratorClientException(response.statusCode(),
                    "%s failed (HTTP %d): %s".formatted(what, response.statusCode(), response.body()));
        }
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestratorClientException("Interrupted while retrying", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
