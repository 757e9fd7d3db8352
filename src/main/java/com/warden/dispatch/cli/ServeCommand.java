package com.warden.dispatch.cli;

import com.warden.egress.EgressProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: warden serve
 * <p>
 * Starts the orchestrator: control, routine and internal APIs, the egress proxy and the
 * schedulers. The web server is enabled by {@link com.warden.WardenApplication#main}
 * through {@link CliRunner#isServeInvocation}; {@link CliRunner} then skips picocli.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 warden serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Warden orchestrator")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final EgressProperties egressProperties;

    public ServeCommand(EgressProperties egressProperties) {
        this.egressProperties = egressProperties;
    }

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Warden orchestrator running on port " + port);
        System.out.println();
        System.out.println("  Jobs API:     http://localhost:" + port + "/api/v1/jobs");
        System.out.println("  Routines API: http://localhost:" + port + "/api/v1/routines");
        if (egressProperties.isEnabled()) {
            System.out.println("  Egress proxy: " + egressProperties.getBindAddress() + ":" + egressProperties.getPort());
        } else {
            ConsoleOutput.error("Egress proxy disabled: sandboxes have no outbound HTTP");
        }
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
