package com.warden.egress;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "warden.egress")
public class EgressProperties {

    private boolean enabled = true;
    private String bindAddress = "0.0.0.0";
    private int port = 3128;
    /** Host name sandboxes use to reach the proxy. */
    private String advertisedHost = "warden-gateway";
    private int connectTimeoutSeconds = 10;
    private int requestTimeoutSeconds = 120;
    private long maxBodyBytes = 10 * 1024 * 1024;
    /** Ports a CONNECT tunnel may target. */
    private List<Integer> tunnelPorts = new ArrayList<>(List.of(443));
    /** Domains every job may reach because a built-in tool requires them. */
    private List<String> toolDomains = new ArrayList<>();
    /** Credential table keyed by reference; values never leave the proxy. */
    private Map<String, Credential> credentials = new LinkedHashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getBindAddress() { return bindAddress; }
    public void setBindAddress(String bindAddress) { this.bindAddress = bindAddress; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getAdvertisedHost() { return advertisedHost; }
    public void setAdvertisedHost(String advertisedHost) { this.advertisedHost = advertisedHost; }
    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public long getMaxBodyBytes() { return maxBodyBytes; }
    public void setMaxBodyBytes(long maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }
    public List<Integer> getTunnelPorts() { return tunnelPorts; }
    public void setTunnelPorts(List<Integer> tunnelPorts) { this.tunnelPorts = tunnelPorts; }
    public List<String> getToolDomains() { return toolDomains; }
    public void setToolDomains(List<String> toolDomains) { this.toolDomains = toolDomains; }
    public Map<String, Credential> getCredentials() { return credentials; }
    public void setCredentials(Map<String, Credential> credentials) { this.credentials = credentials; }

    /**
     * One injectable credential. Either {@code value} or {@code env} supplies the secret;
     * {@code prefix} is prepended (for example {@code "Bearer "}).
     */
    public static class Credential {
        private String header = "Authorization";
        private String prefix = "";
        private String value;
        private String env;

        public String getHeader() { return header; }
        public void setHeader(String header) { this.header = header; }
        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }
        public String getEnv() { return env; }
        public void setEnv(String env) { this.env = env; }
    }
}
