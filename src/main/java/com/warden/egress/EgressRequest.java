package com.warden.egress;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * A forward-proxy request as received from a sandbox.
 *
 * @param target absolute-form request target
 * @param headers request headers, names compared case-insensitively by the proxy
 */
public record EgressRequest(String method, URI target, Map<String, List<String>> headers, byte[] body) {

    public EgressRequest {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }
}
