package com.warden.core.health;

import com.warden.egress.EgressProperties;
import com.warden.egress.EgressProxyServer;
import com.warden.sandbox.SandboxProperties;
import com.warden.sandbox.SandboxProvider;
import com.warden.sandbox.SandboxSupervisor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static ComponentHealth component(List<ComponentHealth> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    private static SandboxProperties sandbox(boolean networkInternal, String gateway) {
        var properties = new SandboxProperties();
        properties.getSandbox().setNetworkInternal(networkInternal);
        properties.getSandbox().setGatewayContainer(gateway);
        return properties;
    }

    @Test
    @DisplayName("checkAll returns docker, store and egress components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, null, null, new EgressProperties(), sandbox(true, "warden-orchestrator"));

        var components = service.checkAll().stream().map(ComponentHealth::component).toList();

        assertEquals(List.of("docker", "store", "egress", "isolation"), components);
    }

    @Test
    @DisplayName("no provider and no listening proxy -> docker and egress DOWN, memory store UP")
    void nothingWired() {
        var results = new HealthCheckService(null, null, null, null, new EgressProperties(), sandbox(true, "warden-orchestrator")).checkAll();

        assertEquals(ComponentHealth.Status.DOWN, component(results, "docker").status());
        assertEquals(ComponentHealth.Status.UP, component(results, "store").status());
        assertEquals("memory", component(results, "store").metadata().get("type"));
        assertEquals(ComponentHealth.Status.DOWN, component(results, "egress").status());
    }

    @Test
    @DisplayName("reachable Docker -> UP with the active sandbox count")
    void dockerUp() {
        var provider = mock(SandboxProvider.class);
        when(provider.ping()).thenReturn(true);
        var supervisor = mock(SandboxSupervisor.class);
        when(supervisor.activeSandboxCount()).thenReturn(2);

        var docker = component(new HealthCheckService(provider, supervisor, null, null, new EgressProperties(), sandbox(true, "warden-orchestrator"))
                .checkAll(), "docker");

        assertEquals(ComponentHealth.Status.UP, docker.status());
        assertEquals("2", docker.metadata().get("active_sandboxes"));
    }

    @Test
    @DisplayName("database errors -> store DOWN")
    void storeDown() throws Exception {
        var dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        var store = component(new HealthCheckService(null, null, dataSource, null, new EgressProperties(), sandbox(true, "warden-orchestrator"))
                .checkAll(), "store");

        assertEquals(ComponentHealth.Status.DOWN, store.status());
        assertTrue(store.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("valid database connection -> store UP")
    void storeUp() throws Exception {
        var dataSource = mock(DataSource.class);
        var connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(5)).thenReturn(true);

        var store = component(new HealthCheckService(null, null, dataSource, null, new EgressProperties(), sandbox(true, "warden-orchestrator"))
                .checkAll(), "store");

        assertEquals(ComponentHealth.Status.UP, store.status());
    }

    @Test
    @DisplayName("egress disabled -> DEGRADED, listening -> UP with port")
    void egress() {
        var disabled = new EgressProperties();
        disabled.setEnabled(false);
        assertEquals(ComponentHealth.Status.DEGRADED,
                component(new HealthCheckService(null, null, null, null, disabled, sandbox(true, "warden-orchestrator")).checkAll(), "egress").status());

        var server = mock(EgressProxyServer.class);
        when(server.isRunning()).thenReturn(true);
        when(server.getLocalPort()).thenReturn(3128);
        var egress = component(new HealthCheckService(null, null, null, server, new EgressProperties(), sandbox(true, "warden-orchestrator")).checkAll(), "egress");
        assertEquals(ComponentHealth.Status.UP, egress.status());
        assertEquals("3128", egress.metadata().get("port"));
    }

    @Test
    @DisplayName("isolation: internal with a gateway -> UP, without one -> DOWN, routable -> DEGRADED")
    void isolation() {
        var egress = new EgressProperties();

        assertEquals(ComponentHealth.Status.UP, component(
                new HealthCheckService(null, null, null, null, egress, sandbox(true, "warden-orchestrator")).checkAll(),
                "isolation").status());
        assertEquals(ComponentHealth.Status.DOWN, component(
                new HealthCheckService(null, null, null, null, egress, sandbox(true, "")).checkAll(),
                "isolation").status());
        assertEquals(ComponentHealth.Status.DEGRADED, component(
                new HealthCheckService(null, null, null, null, egress, sandbox(false, "")).checkAll(),
                "isolation").status());
    }

    @Test
    @DisplayName("overall status is the worst component status; nothing checked is DOWN")
    void overall() {
        var up = ComponentHealth.up("docker", "ok", Map.of());
        var degraded = ComponentHealth.degraded("isolation", "routable", null);
        var down = ComponentHealth.down("store", "gone", Map.of());

        assertEquals(ComponentHealth.Status.UP, ComponentHealth.overall(List.of(up)));
        assertEquals(ComponentHealth.Status.DEGRADED, ComponentHealth.overall(List.of(up, degraded)));
        assertEquals(ComponentHealth.Status.DOWN, ComponentHealth.overall(List.of(degraded, down, up)));
        assertEquals(ComponentHealth.Status.DOWN, ComponentHealth.overall(List.of()));
        assertEquals(200, ComponentHealth.Status.DEGRADED.httpStatus());
        assertEquals(503, ComponentHealth.Status.DOWN.httpStatus());
        assertTrue(degraded.metadata().isEmpty());
    }
}
