package com.warden.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warden.worker")
public class WorkerProperties {

    private int heartbeatIntervalSeconds = 30;
    private String claudeBinary = "claude";
    private String workspace = "/workspace";
    /** How long the bridge waits for a follow-up prompt after a turn; 0 ends the session at once. */
    private int followUpWaitSeconds = 0;
    private int requestTimeoutSeconds = 30;
    private int eventPostAttempts = 3;

    public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
    public void setHeartbeatIntervalSeconds(int heartbeatIntervalSeconds) { this.heartbeatIntervalSeconds = heartbeatIntervalSeconds; }
    public String getClaudeBinary() { return claudeBinary; }
    public void setClaudeBinary(String claudeBinary) { this.claudeBinary = claudeBinary; }
    public String getWorkspace() { return workspace; }
    public void setWorkspace(String workspace) { this.workspace = workspace; }
    public int getFollowUpWaitSeconds() { return followUpWaitSeconds; }
    public void setFollowUpWaitSeconds(int followUpWaitSeconds) { this.followUpWaitSeconds = followUpWaitSeconds; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public int getEventPostAttempts() { return eventPostAttempts; }
    public void setEventPostAttempts(int eventPostAttempts) { this.eventPostAttempts = eventPostAttempts; }
}
