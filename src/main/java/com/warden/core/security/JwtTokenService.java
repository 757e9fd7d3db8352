package com.warden.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Mints and verifies the short-lived token a sandboxed worker uses to call back into
 * the orchestrator and to authenticate to the egress proxy. The token is bound to one job.
 */
@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    static final String WORKER_SCOPE = "worker";

    private final SecretKey signingKey;
    private final int expirationSeconds;

    public JwtTokenService(
            @Value("${warden.security.jwt.secret}") String secret,
            @Value("${warden.security.jwt.expiration-seconds:3600}") int expirationSeconds) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
    }

    public String generateWorkerToken(String jobId) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + expirationSeconds * 1000L);

        return Jwts.builder()
                .subject(jobId)
                .claim("scope", WORKER_SCOPE)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * True iff {@code token} is a valid, unexpired worker token issued for {@code jobId}.
     */
    public boolean isValidForJob(String token, String jobId) {
        if (token == null || token.isBlank() || jobId == null) {
            return false;
        }
        try {
            Claims claims = validateToken(token);
            return jobId.equals(claims.getSubject()) && WORKER_SCOPE.equals(claims.get("scope", String.class));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected worker token for job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    public int getExpirationSeconds() {
        return expirationSeconds;
    }
}
