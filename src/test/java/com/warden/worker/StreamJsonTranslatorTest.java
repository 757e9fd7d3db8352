package com.warden.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.JobEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StreamJsonTranslatorTest {

    private final StreamJsonTranslator translator = new StreamJsonTranslator(new ObjectMapper());

    @Test
    @DisplayName("init line becomes a session_started status")
    void init() {
        var translation = translator.translate(
                "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-1\",\"model\":\"sonnet\"}");

        assertEquals(1, translation.events().size());
        var event = translation.events().get(0);
        assertEquals(JobEventType.STATUS, event.type());
        assertEquals("session_started", event.payload().get("status"));
        assertEquals("s-1", event.payload().get("session_id"));
        assertNull(translation.result());
    }

    @Test
    @DisplayName("assistant text and tool calls become message and tool_use events in order")
    void assistant() {
        var translation = translator.translate("""
                {"type":"assistant","message":{"content":[
                  {"type":"text","text":"Reading the file"},
                  {"type":"tool_use","id":"tu-1","name":"Read","input":{"file_path":"/workspace/a.py"}},
                  {"type":"text","text":"  "}
                ]}}""");

        assertEquals(2, translation.events().size());
        assertEquals(JobEventType.MESSAGE, translation.events().get(0).type());
        assertEquals("Reading the file", translation.events().get(0).payload().get("content"));
        var toolUse = translation.events().get(1);
        assertEquals(JobEventType.TOOL_USE, toolUse.type());
        assertEquals("Read", toolUse.payload().get("name"));
        assertEquals(Map.of("file_path", "/workspace/a.py"), toolUse.payload().get("input"));
    }

    @Test
    @DisplayName("tool results join text blocks and are truncated when huge")
    void toolResults() {
        var blocks = translator.translate("""
                {"type":"user","message":{"content":[{"type":"tool_result","tool_use_id":"tu-1",
                  "content":[{"type":"text","text":"line 1"},{"type":"text","text":"line 2"}],"is_error":true}]}}""");
        var payload = blocks.events().get(0).payload();
        assertEquals(JobEventType.TOOL_RESULT, blocks.events().get(0).type());
        assertEquals("line 1\nline 2", payload.get("output"));
        assertEquals(true, payload.get("is_error"));

        String huge = "x".repeat(StreamJsonTranslator.MAX_TOOL_OUTPUT_CHARS + 10);
        var truncated = translator.translate("{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\","
                + "\"tool_use_id\":\"tu-2\",\"content\":\"" + huge + "\"}]}}");
        assertTrue(((String) truncated.events().get(0).payload().get("output")).endsWith("[truncated]"));
    }

    @Test
    @DisplayName("result line is returned as the turn result, not as an event")
    void result() {
        var translation = translator.translate("""
                {"type":"result","subtype":"success","is_error":false,"result":"Done","session_id":"s-1",
                 "num_turns":4,"total_cost_usd":0.12}""");

        assertTrue(translation.events().isEmpty());
        var result = translation.result();
        assertTrue(result.success());
        assertEquals("Done", result.text());
        assertEquals("s-1", result.sessionId());
        assertEquals(4, result.numTurns());
        assertEquals(0.12, result.costUsd());
    }

    @Test
    @DisplayName("error results without text describe the subtype")
    void errorResult() {
        var result = translator.translate("{\"type\":\"result\",\"subtype\":\"error_max_turns\",\"is_error\":true}").result();

        assertFalse(result.success());
        assertEquals("coding agent ended with error_max_turns", result.text());
    }

    @Test
    @DisplayName("blank, non-JSON and unknown lines are ignored")
    void ignored() {
        assertTrue(translator.translate("").events().isEmpty());
        assertTrue(translator.translate("npm WARN deprecated").events().isEmpty());
        assertTrue(translator.translate("{\"type\":\"rate_limit\"}").events().isEmpty());
        assertNull(translator.translate("{\"type\":\"system\",\"subtype\":\"compact\"}").result());
    }
}
