package com.warden.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.JobEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the coding agent's {@code --output-format stream-json} lines onto the job event
 * vocabulary. The agent's own {@code result} line is returned as a {@link TurnResult}
 * rather than an event: the bridge decides when the job's single result is sent.
 */
public class StreamJsonTranslator {

    private static final Logger log = LoggerFactory.getLogger(StreamJsonTranslator.class);

    static final int MAX_TOOL_OUTPUT_CHARS = 16_000;

    private final ObjectMapper objectMapper;

    public StreamJsonTranslator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record BridgeEvent(JobEventType type, Map<String, Object> payload) {}

    /**
     * @param text      final assistant text of the turn
     * @param sessionId session to resume for a follow-up turn
     */
    public record TurnResult(boolean success, String text, String sessionId, Integer numTurns, Double costUsd) {}

    public record Translation(List<BridgeEvent> events, TurnResult result) {

        static Translation empty() {
            return new Translation(List.of(), null);
        }
    }

    public Translation translate(String line) {
        if (line == null || line.isBlank()) {
            return Translation.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Skipping non-JSON output line: {}", line);
            return Translation.empty();
        }

        return switch (node.path("type").asText()) {
            case "system" -> system(node);
            case "assistant" -> assistant(node);
            case "user" -> user(node);
            case "result" -> new Translation(List.of(), turnResult(node));
            default -> Translation.empty();
        };
    }

    private Translation system(JsonNode node) {
        if (!"init".equals(node.path("subtype").asText())) {
            return Translation.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "session_started");
        putText(payload, "session_id", node.path("session_id"));
        putText(payload, "model", node.path("model"));
        return new Translation(List.of(new BridgeEvent(JobEventType.STATUS, payload)), null);
    }

    private Translation assistant(JsonNode node) {
        List<BridgeEvent> events = new ArrayList<>();
        for (JsonNode block : node.path("message").path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> {
                    String text = block.path("text").asText("");
                    if (!text.isBlank()) {
                        events.add(new BridgeEvent(JobEventType.MESSAGE,
                                Map.of("role", "assistant", "content", text)));
                    }
                }
                case "tool_use" -> {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    putText(payload, "tool_use_id", block.path("id"));
                    putText(payload, "name", block.path("name"));
                    payload.put("input", objectMapper.convertValue(block.path("input"), Object.class));
                    events.add(new BridgeEvent(JobEventType.TOOL_USE, payload));
                }
                default -> log.trace("Ignoring assistant block {}", block.path("type").asText());
            }
        }
        return new Translation(events, null);
    }

    private Translation user(JsonNode node) {
        List<BridgeEvent> events = new ArrayList<>();
        for (JsonNode block : node.path("message").path("content")) {
            if (!"tool_result".equals(block.path("type").asText())) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            putText(payload, "tool_use_id", block.path("tool_use_id"));
            payload.put("output", truncate(toolOutput(block.path("content"))));
            payload.put("is_error", block.path("is_error").asBoolean(false));
            events.add(new BridgeEvent(JobEventType.TOOL_RESULT, payload));
        }
        return new Translation(events, null);
    }

    private static TurnResult turnResult(JsonNode node) {
        boolean error = node.path("is_error").asBoolean(false)
                || !"success".equals(node.path("subtype").asText("success"));
        String text = node.path("result").asText("");
        if (text.isBlank() && error) {
            text = "coding agent ended with " + node.path("subtype").asText("an error");
        }
        String sessionId = node.hasNonNull("session_id") ? node.get("session_id").asText() : null;
        Integer turns = node.hasNonNull("num_turns") ? node.get("num_turns").asInt() : null;
        Double cost = node.hasNonNull("total_cost_usd") ? node.get("total_cost_usd").asDouble() : null;
        return new TurnResult(!error, text, sessionId, turns, cost);
    }

    /** Tool output is either a string or a list of content blocks. */
    private static String toolOutput(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : content) {
            if (block.has("text")) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(block.get("text").asText());
            }
        }
        return sb.toString();
    }

    private static void putText(Map<String, Object> payload, String key, JsonNode value) {
        if (!value.isMissingNode() && !value.isNull()) {
            payload.put(key, value.asText());
        }
    }

    private static String truncate(String text) {
        return text.length() <= MAX_TOOL_OUTPUT_CHARS
                ? text
                : text.substring(0, MAX_TOOL_OUTPUT_CHARS) + "\n... [truncated]";
    }
}
