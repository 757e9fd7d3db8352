package com.warden.worker;

public record AgentOutcome(boolean success, String summary) {

    public static AgentOutcome success(String summary) {
        return new AgentOutcome(true, summary);
    }

    public static AgentOutcome failure(String summary) {
        return new AgentOutcome(false, summary);
    }
}
