package com.warden.egress;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EgressProxyServerTest {

    private EgressProxy proxy;
    private EgressProxyServer server;
    private final ProxyCredentials credentials = new ProxyCredentials("job-1", "token");

    @BeforeEach
    void setUp() {
        proxy = mock(EgressProxy.class);
        var properties = new EgressProperties();
        properties.setBindAddress("127.0.0.1");
        properties.setPort(0);
        properties.setMaxBodyBytes(64);
        server = new EgressProxyServer(proxy, properties);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private String exchange(String request) throws Exception {
        try (Socket socket = new Socket("127.0.0.1", server.getLocalPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(request.getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            InputStream in = socket.getInputStream();
            return new String(in.readAllBytes(), StandardCharsets.ISO_8859_1);
        }
    }

    private static String readHead(InputStream in) throws Exception {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            head.write(b);
            if (head.toString(StandardCharsets.ISO_8859_1).endsWith("\r\n\r\n")) {
                break;
            }
        }
        return head.toString(StandardCharsets.ISO_8859_1);
    }

    private static int count(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    @Nested
    @DisplayName("plain HTTP")
    class PlainHttpTests {

        @Test
        @DisplayName("requests are handed to the proxy with the sandbox identity")
        void forwardsToProxy() throws Exception {
            when(proxy.handle(eq(credentials), any())).thenReturn(EgressResponse.denied("example.com"));

            String response = exchange("GET http://example.com/ HTTP/1.1\r\nHost: example.com\r\n"
                    + "Proxy-Authorization: " + credentials.toHeader() + "\r\nConnection: close\r\n\r\n");

            assertTrue(response.startsWith("HTTP/1.1 403 Forbidden"));
            assertTrue(response.contains("X-Warden-Egress: denied"));
            verify(proxy).handle(eq(credentials), argThat(req -> req.target().getHost().equals("example.com")));
        }

        @Test
        @DisplayName("a chunked upload reaches the proxy as one body")
        void chunkedUpload() throws Exception {
            when(proxy.handle(any(), any())).thenReturn(new EgressResponse(201, null, "stored".getBytes(StandardCharsets.UTF_8)));

            String response = exchange("POST http://example.com/upload HTTP/1.1\r\nHost: example.com\r\n"
                    + "Proxy-Authorization: " + credentials.toHeader() + "\r\n"
                    + "Transfer-Encoding: chunked\r\nConnection: close\r\n\r\n"
                    + "5\r\nhello\r\n6\r\n world\r\n0\r\n\r\n");

            ArgumentCaptor<EgressRequest> request = ArgumentCaptor.forClass(EgressRequest.class);
            verify(proxy).handle(eq(credentials), request.capture());
            assertEquals("POST", request.getValue().method());
            assertEquals("hello world", new String(request.getValue().body(), StandardCharsets.UTF_8));
            assertTrue(response.startsWith("HTTP/1.1 201 "));
            assertTrue(response.endsWith("stored"));
        }

        @Test
        @DisplayName("one connection carries several requests")
        void keepAlive() throws Exception {
            when(proxy.handle(any(), any())).thenReturn(EgressResponse.denied("example.com"));

            String response = exchange("GET http://example.com/a HTTP/1.1\r\nHost: example.com\r\n\r\n"
                    + "GET http://example.com/b HTTP/1.1\r\nHost: example.com\r\nConnection: close\r\n\r\n");

            assertEquals(2, count(response, "HTTP/1.1 403 "));
            verify(proxy, times(2)).handle(any(), any());
        }

        @Test
        @DisplayName("https URLs without CONNECT are rejected before reaching the proxy")
        void rejectsAbsoluteHttps() throws Exception {
            String response = exchange("GET https://example.com/ HTTP/1.1\r\nHost: example.com\r\nConnection: close\r\n\r\n");

            assertTrue(response.startsWith("HTTP/1.1 400 "));
            verify(proxy, never()).handle(any(), any());
        }

        @Test
        @DisplayName("a body over the limit is answered with 413")
        void bodyTooLarge() throws Exception {
            String body = "x".repeat(100);

            String response = exchange("POST http://example.com/ HTTP/1.1\r\nHost: example.com\r\n"
                    + "Content-Length: " + body.length() + "\r\nConnection: close\r\n\r\n" + body);

            assertTrue(response.startsWith("HTTP/1.1 413 "));
            verify(proxy, never()).handle(any(), any());
        }
    }

    @Nested
    @DisplayName("CONNECT")
    class ConnectTests {

        @Test
        @DisplayName("refused by policy answers 407 or 403")
        void connectRefused() throws Exception {
            when(proxy.authorizeTunnel(any(), eq("example.com"), anyInt())).thenReturn(EgressDecision.DENIED);
            when(proxy.authorizeTunnel(isNull(), eq("pypi.org"), anyInt())).thenReturn(EgressDecision.UNAUTHENTICATED);

            assertTrue(exchange("CONNECT example.com:443 HTTP/1.1\r\nHost: example.com:443\r\n\r\n")
                    .startsWith("HTTP/1.1 403 "));
            String unauthenticated = exchange("CONNECT pypi.org:443 HTTP/1.1\r\nHost: pypi.org:443\r\n\r\n");
            assertTrue(unauthenticated.startsWith("HTTP/1.1 407 "));
            assertTrue(unauthenticated.contains("Proxy-Authenticate: Basic"));
        }

        @Test
        @DisplayName("an admitted tunnel relays bytes both ways")
        void tunnelRelays() throws Exception {
            try (ServerSocket upstream = new ServerSocket(0)) {
                Thread echo = new Thread(() -> {
                    try (Socket accepted = upstream.accept()) {
                        byte[] ping = accepted.getInputStream().readNBytes(4);
                        assertEquals("ping", new String(ping, StandardCharsets.ISO_8859_1));
                        accepted.getOutputStream().write("pong".getBytes(StandardCharsets.ISO_8859_1));
                        accepted.getOutputStream().flush();
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                });
                echo.setDaemon(true);
                echo.start();
                int port = upstream.getLocalPort();
                when(proxy.authorizeTunnel(eq(credentials), eq("127.0.0.1"), eq(port))).thenReturn(EgressDecision.ALLOWED);

                try (Socket socket = new Socket("127.0.0.1", server.getLocalPort())) {
                    socket.setSoTimeout(5000);
                    OutputStream out = socket.getOutputStream();
                    out.write(("CONNECT 127.0.0.1:" + port + " HTTP/1.1\r\nHost: 127.0.0.1:" + port + "\r\n"
                            + "Proxy-Authorization: " + credentials.toHeader() + "\r\n\r\n")
                            .getBytes(StandardCharsets.ISO_8859_1));
                    out.flush();
                    InputStream in = socket.getInputStream();

                    assertTrue(readHead(in).startsWith("HTTP/1.1 200 "));
                    out.write("ping".getBytes(StandardCharsets.ISO_8859_1));
                    out.flush();
                    assertEquals("pong", new String(in.readNBytes(4), StandardCharsets.ISO_8859_1));
                }
                echo.join(5000);
            }
        }
    }

    @Test
    void reportsRunning() {
        assertTrue(server.isRunning());
        assertTrue(server.getLocalPort() > 0);

        server.stop();

        assertFalse(server.isRunning());
        assertEquals(-1, server.getLocalPort());
    }
}
