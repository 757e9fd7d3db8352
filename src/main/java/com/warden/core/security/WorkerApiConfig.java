package com.warden.core.security;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Applies worker token checks to the internal API.
 */
@Configuration
public class WorkerApiConfig implements WebMvcConfigurer {

    static final String INTERNAL_PATTERN = "/internal/**";

    private final JwtTokenService tokenService;

    public WorkerApiConfig(JwtTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new WorkerTokenInterceptor(tokenService))
                .addPathPatterns(INTERNAL_PATTERN);
    }
}
