package com.warden.core.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.Map;

/**
 * Guards {@code /internal/jobs/{id}/**}: the bearer token must have been minted for
 * that same job id, so a sandbox cannot report on another sandbox's job.
 * <p>
 * The job id is taken from the URI variables of the matched handler, i.e. the decoded
 * value the controller receives, never from the raw request URI.
 */
public class WorkerTokenInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(WorkerTokenInterceptor.class);

    static final String JOB_ID_VARIABLE = "id";

    private final JwtTokenService tokenService;

    public WorkerTokenInterceptor(JwtTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        String jobId = jobIdFrom(request);
        String token = bearerToken(request.getHeader("Authorization"));

        if (jobId != null && tokenService.isValidForJob(token, jobId)) {
            return true;
        }

        log.debug("Rejected internal call {} {} for job {}", request.getMethod(), request.getRequestURI(), jobId);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"Invalid or missing worker token\"}");
        return false;
    }

    static String jobIdFrom(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (!(variables instanceof Map<?, ?> map)) {
            return null;
        }
        Object id = map.get(JOB_ID_VARIABLE);
        return id instanceof String value && !value.isBlank() ? value : null;
    }

    private static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        return header.substring(7).trim();
    }
}
