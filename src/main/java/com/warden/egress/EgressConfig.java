package com.warden.egress;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class EgressConfig {

    /**
     * Upstream client for forwarded requests. Redirects are not followed here: the sandbox
     * receives the 3xx and its next request passes the allowlist again.
     */
    @Bean
    public HttpClient egressHttpClient(EgressProperties properties) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
    }
}
