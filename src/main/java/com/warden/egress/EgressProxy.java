package com.warden.egress;

import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.security.JwtTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Policy core of the egress proxy, independent of the socket layer.
 * <p>
 * A request is forwarded only when its job authenticates and its host matches one of the
 * job's rules. When the matched rule carries a credential reference, the secret is resolved
 * here and set on the outbound request, replacing any value the sandbox sent for that header.
 */
@Service
public class EgressProxy {

    private static final Logger log = LoggerFactory.getLogger(EgressProxy.class);

    /** Never copied from the sandbox request to the upstream request. */
    private static final Set<String> REQUEST_HEADERS_DROPPED = Set.of(
            "connection", "keep-alive", "proxy-authorization", "proxy-connection", "proxy-authenticate",
            "te", "trailer", "transfer-encoding", "upgrade", "host", "content-length", "expect");

    /** Never relayed back; Jetty sets framing headers itself. */
    private static final Set<String> RESPONSE_HEADERS_DROPPED = Set.of(
            "connection", "keep-alive", "proxy-connection", "transfer-encoding", "content-length", "trailer");

    private final EgressAllowlist allowlist;
    private final CredentialVault vault;
    private final JwtTokenService tokenService;
    private final HttpClient httpClient;
    private final EgressProperties properties;
    private final WardenMetrics metrics;

    public EgressProxy(EgressAllowlist allowlist,
                       CredentialVault vault,
                       JwtTokenService tokenService,
                       @Qualifier("egressHttpClient") HttpClient httpClient,
                       EgressProperties properties,
                       @Autowired(required = false) WardenMetrics metrics) {
        this.allowlist = allowlist;
        this.vault = vault;
        this.tokenService = tokenService;
        this.httpClient = httpClient;
        this.properties = properties;
        this.metrics = metrics;
    }

    public EgressResponse handle(ProxyCredentials credentials, EgressRequest request) {
        if (!authenticated(credentials)) {
            record("unauthenticated", false);
            return EgressResponse.proxyAuthRequired();
        }
        String jobId = credentials.jobId();
        String host = request.target().getHost();
        if (host == null || !request.target().isAbsolute()) {
            return EgressResponse.badRequest("Proxy requests must use an absolute URI");
        }

        MdcContext.setJob(jobId);
        try {
            Optional<DomainAllowRule> rule = allowlist.match(jobId, host);
            if (rule.isEmpty()) {
                log.info("Denied egress to {} ({} {})", host, request.method(), request.target().getPath());
                record("denied", false);
                return EgressResponse.denied(host);
            }

            InjectedCredential credential = null;
            String ref = rule.get().credentialRef();
            if (ref != null) {
                credential = vault.resolve(ref).orElse(null);
                if (credential == null) {
                    log.warn("Credential '{}' for {} could not be resolved", ref, host);
                    record("error", false);
                    return EgressResponse.badGateway("Credential for " + host + " is unavailable");
                }
            }

            return forward(request, credential);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Admission check for a CONNECT tunnel. Tunnelled traffic is opaque, so no credential
     * can be injected into it.
     */
    public EgressDecision authorizeTunnel(ProxyCredentials credentials, String host, int port) {
        if (!authenticated(credentials)) {
            record("unauthenticated", false);
            return EgressDecision.UNAUTHENTICATED;
        }
        if (!properties.getTunnelPorts().contains(port) || allowlist.match(credentials.jobId(), host).isEmpty()) {
            log.info("Denied tunnel from job {} to {}:{}", credentials.jobId(), host, port);
            record("denied", false);
            return EgressDecision.DENIED;
        }
        record("allowed", false);
        return EgressDecision.ALLOWED;
    }

    private EgressResponse forward(EgressRequest request, InjectedCredential credential) {
        HttpRequest outbound;
        try {
            outbound = outboundRequest(request, credential);
        } catch (IllegalArgumentException e) {
            return EgressResponse.badRequest("Unsupported request: " + e.getMessage());
        }

        try {
            HttpResponse<byte[]> upstream = httpClient.send(outbound, HttpResponse.BodyHandlers.ofByteArray());
            log.debug("Forwarded {} {} -> {}", request.method(), request.target().getHost(), upstream.statusCode());
            record("allowed", credential != null);
            return new EgressResponse(upstream.statusCode(), relayedHeaders(upstream.headers().map()), upstream.body());
        } catch (IOException e) {
            log.warn("Upstream request to {} failed: {}", request.target().getHost(), e.getMessage());
            record("error", credential != null);
            return EgressResponse.badGateway("Upstream request failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record("error", credential != null);
            return EgressResponse.badGateway("Upstream request interrupted");
        }
    }

    private HttpRequest outboundRequest(EgressRequest request, InjectedCredential credential) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.target())
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .method(request.method(), request.body().length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(request.body()));

        String injectedHeader = credential != null ? credential.header().toLowerCase(Locale.ROOT) : null;
        request.headers().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (REQUEST_HEADERS_DROPPED.contains(lower) || lower.equals(injectedHeader)) {
                return;
            }
            for (String value : values) {
                builder.header(name, value);
            }
        });
        if (credential != null) {
            builder.header(credential.header(), credential.value());
        }
        return builder.build();
    }

    private boolean authenticated(ProxyCredentials credentials) {
        return credentials != null && tokenService.isValidForJob(credentials.token(), credentials.jobId());
    }

    private static Map<String, List<String>> relayedHeaders(Map<String, List<String>> upstream) {
        Map<String, List<String>> relayed = new LinkedHashMap<>();
        upstream.forEach((name, values) -> {
            if (name.startsWith(":") || RESPONSE_HEADERS_DROPPED.contains(name.toLowerCase(Locale.ROOT))) {
                return;
            }
            relayed.put(name, values);
        });
        return relayed;
    }

    private void record(String decision, boolean credentialInjected) {
        if (metrics != null) {
            metrics.recordEgressDecision(decision, credentialInjected);
        }
    }
}
