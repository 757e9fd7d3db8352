package com.warden.egress;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the proxy writes back to the sandbox: either the relayed upstream response or a
 * proxy-generated refusal marked with {@value #DECISION_HEADER}.
 */
public record EgressResponse(int status, Map<String, List<String>> headers, byte[] body) {

    public static final String DECISION_HEADER = "X-Warden-Egress";

    public EgressResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public static EgressResponse denied(String host) {
        return refusal(403, "denied", "Egress to " + host + " is not allowed for this job\n");
    }

    public static EgressResponse proxyAuthRequired() {
        EgressResponse refusal = refusal(407, "unauthenticated", "Proxy authentication required\n");
        Map<String, List<String>> headers = new LinkedHashMap<>(refusal.headers());
        headers.put("Proxy-Authenticate", List.of("Basic realm=\"warden-egress\""));
        return new EgressResponse(407, headers, refusal.body());
    }

    public static EgressResponse badGateway(String message) {
        return error(502, message);
    }

    public static EgressResponse badRequest(String message) {
        return error(400, message);
    }

    public static EgressResponse error(int status, String message) {
        return refusal(status, "error", message + "\n");
    }

    public String decision() {
        List<String> values = headers.get(DECISION_HEADER);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static EgressResponse refusal(int status, String decision, String text) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put(DECISION_HEADER, List.of(decision));
        headers.put("Content-Type", List.of("text/plain; charset=utf-8"));
        return new EgressResponse(status, headers, text.getBytes(StandardCharsets.UTF_8));
    }
}
