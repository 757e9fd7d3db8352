package com.warden.egress;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

/**
 * Embedded Jetty front end of the egress proxy. Sandboxes reach it through
 * HTTP_PROXY/HTTPS_PROXY: CONNECT goes to {@link EgressTunnelHandler}, plain HTTP to
 * {@link EgressForwardHandler}, and both defer to {@link EgressProxy} for the policy.
 */
@Component
@ConditionalOnWebApplication
@ConditionalOnProperty(name = "warden.egress.enabled", havingValue = "true", matchIfMissing = true)
public class EgressProxyServer {

    private static final Logger log = LoggerFactory.getLogger(EgressProxyServer.class);

    private final EgressProxy proxy;
    private final EgressProperties properties;
    private final Object lifecycleLock = new Object();

    private Server server;
    private ServerConnector connector;

    public EgressProxyServer(EgressProxy proxy, EgressProperties properties) {
        this.proxy = proxy;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return;
            }
            QueuedThreadPool threadPool = new QueuedThreadPool();
            threadPool.setDaemon(true);
            threadPool.setName("egress-proxy");
            server = new Server(threadPool);

            HttpConfiguration httpConfig = new HttpConfiguration();
            httpConfig.setSendServerVersion(false);
            connector = new ServerConnector(server, new HttpConnectionFactory(httpConfig));
            connector.setHost(properties.getBindAddress());
            connector.setPort(properties.getPort());
            connector.setIdleTimeout(properties.getRequestTimeoutSeconds() * 1000L);
            server.addConnector(connector);

            EgressTunnelHandler tunnels = new EgressTunnelHandler(proxy,
                    new EgressForwardHandler(proxy, properties.getMaxBodyBytes()));
            tunnels.setConnectTimeout(properties.getConnectTimeoutSeconds() * 1000L);
            tunnels.setIdleTimeout(properties.getRequestTimeoutSeconds() * 1000L);
            server.setHandler(tunnels);

            try {
                server.start();
            } catch (Exception e) {
                server = null;
                throw new IllegalStateException("Cannot start egress proxy on "
                        + properties.getBindAddress() + ":" + properties.getPort(), e);
            }
            log.info("Egress proxy listening on {}:{}", properties.getBindAddress(), getLocalPort());
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (server == null) {
                return;
            }
            try {
                server.setStopTimeout(2000);
                server.stop();
                log.info("Egress proxy stopped");
            } catch (Exception e) {
                log.warn("Error stopping egress proxy: {}", e.getMessage(), e);
            } finally {
                server = null;
                connector = null;
            }
        }
    }

    public int getLocalPort() {
        synchronized (lifecycleLock) {
            return connector != null ? connector.getLocalPort() : -1;
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return server != null && server.isRunning();
        }
    }
}
