package com.warden.worker;

/**
 * The reasoning and tool-call loop of a generic job. Implementations are supplied by the
 * deployment as a Spring bean; the worker runtime only drives them.
 * <p>
 * Implementations emit {@code message}, {@code tool_use}, {@code tool_result} and
 * {@code status} events through the sink. The closing {@code result} event is the
 * runtime's: it is derived from the returned outcome, or from the thrown exception.
 */
public interface AgentLoop {

    AgentOutcome run(AssignedJob job, int maxIterations, EventSink events) throws Exception;
}
