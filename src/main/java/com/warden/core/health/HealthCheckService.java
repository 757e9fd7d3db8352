package com.warden.core.health;

import com.warden.egress.EgressProperties;
import com.warden.egress.EgressProxyServer;
import com.warden.sandbox.SandboxProperties;
import com.warden.sandbox.SandboxProvider;
import com.warden.sandbox.SandboxSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProvider sandboxProvider;
    private final SandboxSupervisor supervisor;
    private final DataSource dataSource;
    private final EgressProxyServer egressProxyServer;
    private final EgressProperties egressProperties;
    private final SandboxProperties sandboxProperties;

    public HealthCheckService(
            @Autowired(required = false) SandboxProvider sandboxProvider,
            @Autowired(required = false) SandboxSupervisor supervisor,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) EgressProxyServer egressProxyServer,
            EgressProperties egressProperties,
            @Autowired(required = false) SandboxProperties sandboxProperties) {
        this.sandboxProvider = sandboxProvider;
        this.supervisor = supervisor;
        this.dataSource = dataSource;
        this.egressProxyServer = egressProxyServer;
        this.egressProperties = egressProperties;
        this.sandboxProperties = sandboxProperties;
    }

    public List<ComponentHealth> checkAll() {
        var results = new ArrayList<ComponentHealth>();
        results.add(checkDocker());
        results.add(checkStore());
        results.add(checkEgress());
        results.add(checkIsolation());
        return results;
    }

    private ComponentHealth checkDocker() {
        if (sandboxProvider == null) {
            return ComponentHealth.down("docker", "No SandboxProvider configured", Map.of());
        }
        Map<String, String> metadata = supervisor != null
                ? Map.of("active_sandboxes", String.valueOf(supervisor.activeSandboxCount()))
                : Map.of();
        if (sandboxProvider.ping()) {
            return ComponentHealth.up("docker", "Docker daemon reachable", metadata);
        }
        return ComponentHealth.down("docker", "Docker daemon not reachable", metadata);
    }

    private ComponentHealth checkStore() {
        if (dataSource == null) {
            return ComponentHealth.up("store", "In-memory store (state is lost on restart)", Map.of("type", "memory"));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return ComponentHealth.up("store", "Database connection valid", Map.of("type", "jdbc"));
            }
            return ComponentHealth.down("store", "Database connection invalid", Map.of("type", "jdbc"));
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return ComponentHealth.down("store", "Database error: " + e.getMessage(), Map.of("type", "jdbc"));
        }
    }

    private ComponentHealth checkEgress() {
        if (!egressProperties.isEnabled()) {
            return ComponentHealth.degraded("egress", "Egress proxy disabled; sandboxes have no outbound HTTP", Map.of());
        }
        if (egressProxyServer != null && egressProxyServer.isRunning()) {
            return ComponentHealth.up("egress", "Egress proxy listening",
                    Map.of("port", String.valueOf(egressProxyServer.getLocalPort())));
        }
        return ComponentHealth.down("egress", "Egress proxy not listening", Map.of());
    }

    /** Whether sandbox traffic is forced through the egress proxy at the network level. */
    private ComponentHealth checkIsolation() {
        if (sandboxProperties == null) {
            return ComponentHealth.down("isolation", "No sandbox configuration", Map.of());
        }
        if (!sandboxProperties.isNetworkInternal()) {
            return ComponentHealth.degraded("isolation",
                    "Job networks are routable; HTTP_PROXY is advisory", Map.of("network_internal", "false"));
        }
        if (sandboxProperties.getGatewayContainer().isBlank()) {
            return ComponentHealth.down("isolation",
                    "Internal job networks need warden.sandbox.gateway-container", Map.of("network_internal", "true"));
        }
        return ComponentHealth.up("isolation", "Job networks are internal",
                Map.of("network_internal", "true", "gateway", sandboxProperties.getGatewayContainer()));
    }
}
