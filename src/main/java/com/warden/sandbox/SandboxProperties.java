package com.warden.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warden")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getImage() { return sandbox.image; }
    public String getOrchestratorUrl() { return sandbox.orchestratorUrl; }
    public String getProjectsRoot() { return sandbox.projectsRoot; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getCpuCount() { return sandbox.cpuCount; }
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public int getHeartbeatTimeoutSeconds() { return sandbox.heartbeatTimeoutSeconds; }
    public int getStopGraceSeconds() { return sandbox.stopGraceSeconds; }
    public long getLivenessIntervalMs() { return sandbox.livenessIntervalMs; }
    public boolean isNetworkInternal() { return sandbox.networkInternal; }
    public String getHostProjectsRoot() { return sandbox.hostProjectsRoot; }
    public String getGatewayContainer() { return sandbox.gatewayContainer; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private String provider = "docker";
        private String image = "ghcr.io/warden/worker:latest";
        /** URL workers use to reach the orchestrator from inside the sandbox. */
        private String orchestratorUrl = "http://warden-gateway:8080";
        private String projectsRoot = "/tmp/warden/projects";
        /**
         * Host-side path of {@code projectsRoot}, when the orchestrator itself runs in a
         * container and sees the projects through a volume. Empty means same path.
         */
        private String hostProjectsRoot = "";
        private int memoryLimitMb = 4096;
        private int cpuCount = 2;
        private int timeoutSeconds = 3600;
        private int heartbeatTimeoutSeconds = 300;
        private int stopGraceSeconds = 10;
        private long livenessIntervalMs = 5000;
        /** Creates job networks as internal, so the gateway container is the only reachable peer. */
        private boolean networkInternal = true;
        /** Container running the orchestrator and egress proxy, attached to every job network. */
        private String gatewayContainer = "";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getOrchestratorUrl() { return orchestratorUrl; }
        public void setOrchestratorUrl(String orchestratorUrl) { this.orchestratorUrl = orchestratorUrl; }
        public String getProjectsRoot() { return projectsRoot; }
        public void setProjectsRoot(String projectsRoot) { this.projectsRoot = projectsRoot; }
        public String getHostProjectsRoot() { return hostProjectsRoot; }
        public void setHostProjectsRoot(String hostProjectsRoot) { this.hostProjectsRoot = hostProjectsRoot; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getHeartbeatTimeoutSeconds() { return heartbeatTimeoutSeconds; }
        public void setHeartbeatTimeoutSeconds(int heartbeatTimeoutSeconds) { this.heartbeatTimeoutSeconds = heartbeatTimeoutSeconds; }
        public int getStopGraceSeconds() { return stopGraceSeconds; }
        public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
        public long getLivenessIntervalMs() { return livenessIntervalMs; }
        public void setLivenessIntervalMs(long livenessIntervalMs) { this.livenessIntervalMs = livenessIntervalMs; }
        public boolean isNetworkInternal() { return networkInternal; }
        public void setNetworkInternal(boolean networkInternal) { this.networkInternal = networkInternal; }
        public String getGatewayContainer() { return gatewayContainer; }
        public void setGatewayContainer(String gatewayContainer) { this.gatewayContainer = gatewayContainer; }
    }
}
