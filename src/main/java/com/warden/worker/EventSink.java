package com.warden.worker;

import com.warden.core.events.JobEventType;

import java.util.Map;

/**
 * Where an agent loop reports progress. Events reach the orchestrator in call order.
 */
@FunctionalInterface
public interface EventSink {

    void emit(JobEventType type, Map<String, Object> payload);
}
