package com.warden.egress;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpHeaderValue;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Handles absolute-form {@code http://} requests. Jetty does the HTTP/1.1 framing
 * (chunked uploads, keep-alive); the body is buffered and the decision is left to
 * {@link EgressProxy#handle}.
 */
class EgressForwardHandler extends Handler.Abstract {

    private static final Logger log = LoggerFactory.getLogger(EgressForwardHandler.class);

    private static final Set<String> FRAMING_HEADERS = Set.of("content-length", "transfer-encoding", "connection");

    private final EgressProxy proxy;
    private final long maxBodyBytes;

    EgressForwardHandler(EgressProxy proxy, long maxBodyBytes) {
        this.proxy = proxy;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
        ProxyCredentials credentials = credentialsOf(request);

        URI target = targetOf(request);
        if (target == null) {
            write(response, EgressResponse.badRequest("Only absolute http:// targets may be forwarded; use CONNECT for https"),
                    false, callback);
            return true;
        }

        byte[] body;
        try (InputStream in = Content.Source.asInputStream(request)) {
            body = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxBodyBytes + 1));
        }
        if (body.length > maxBodyBytes) {
            log.debug("Rejected {} {}: body over {} bytes", request.getMethod(), target.getHost(), maxBodyBytes);
            write(response, EgressResponse.error(413, "Request body exceeds " + maxBodyBytes + " bytes"), true, callback);
            return true;
        }

        EgressResponse egress = proxy.handle(credentials, new EgressRequest(request.getMethod(), target, headersOf(request), body));
        write(response, egress, false, callback);
        return true;
    }

    static ProxyCredentials credentialsOf(Request request) {
        return ProxyCredentials.fromHeader(request.getHeaders().get(HttpHeader.PROXY_AUTHORIZATION)).orElse(null);
    }

    static void write(Response response, EgressResponse egress, boolean close, Callback callback) {
        response.setStatus(egress.status());
        HttpFields.Mutable headers = response.getHeaders();
        egress.headers().forEach((name, values) -> {
            if (FRAMING_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                return;
            }
            for (String value : values) {
                headers.add(name, value);
            }
        });
        headers.put(HttpHeader.CONTENT_LENGTH, String.valueOf(egress.body().length));
        if (close) {
            headers.put(HttpHeader.CONNECTION, HttpHeaderValue.CLOSE.asString());
        }
        response.write(true, ByteBuffer.wrap(egress.body()), callback);
    }

    private static URI targetOf(Request request) {
        try {
            URI uri = URI.create(request.getHttpURI().asString());
            if (!uri.isAbsolute() || uri.getHost() == null || !"http".equalsIgnoreCase(uri.getScheme())) {
                return null;
            }
            return uri;
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable proxy target: {}", e.getMessage());
            return null;
        }
    }

    private static Map<String, List<String>> headersOf(Request request) {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (HttpField field : request.getHeaders()) {
            headers.computeIfAbsent(field.getName(), k -> new ArrayList<>()).add(field.getValue());
        }
        return headers;
    }
}
