package com.warden.egress;

import org.eclipse.jetty.server.handler.ConnectHandler;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.HostPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CONNECT tunnels. The destination is admitted by {@link EgressProxy#authorizeTunnel}
 * before Jetty opens the upstream socket; everything else goes to the wrapped handler.
 */
class EgressTunnelHandler extends ConnectHandler {

    private static final Logger log = LoggerFactory.getLogger(EgressTunnelHandler.class);

    private final EgressProxy proxy;

    EgressTunnelHandler(EgressProxy proxy, Handler forward) {
        super(forward);
        this.proxy = proxy;
    }

    @Override
    protected void handleConnect(Request request, Response response, Callback callback, String serverAddress) {
        HostPort destination;
        try {
            destination = new HostPort(serverAddress);
        } catch (IllegalArgumentException e) {
            refuse(response, EgressResponse.badRequest("CONNECT target must be host:port"), callback);
            return;
        }
        int port = destination.getPort(0);
        if (port <= 0) {
            refuse(response, EgressResponse.badRequest("CONNECT target must be host:port"), callback);
            return;
        }

        String host = destination.getHost();
        EgressDecision decision = proxy.authorizeTunnel(EgressForwardHandler.credentialsOf(request), host, port);
        switch (decision) {
            case ALLOWED -> {
                log.debug("Opening tunnel to {}:{}", host, port);
                super.handleConnect(request, response, callback, serverAddress);
            }
            case UNAUTHENTICATED -> refuse(response, EgressResponse.proxyAuthRequired(), callback);
            case DENIED -> refuse(response, EgressResponse.denied(host), callback);
        }
    }

    private static void refuse(Response response, EgressResponse refusal, Callback callback) {
        EgressForwardHandler.write(response, refusal, true, callback);
    }
}
