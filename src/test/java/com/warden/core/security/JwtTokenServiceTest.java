package com.warden.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.security.SignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenServiceTest {

    private static final String SECRET = "warden-test-secret-must-be-at-least-32-bytes-long";
    private static final int EXPIRATION_SECONDS = 600;

    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        service = new JwtTokenService(SECRET, EXPIRATION_SECONDS);
    }

    @Nested
    @DisplayName("generateWorkerToken")
    class GenerateTokenTests {

        @Test
        @DisplayName("token carries the job id as subject and the worker scope")
        void generatesTokenWithExpectedClaims() {
            String token = service.generateWorkerToken("job-001");

            Claims claims = service.validateToken(token);
            assertEquals("job-001", claims.getSubject());
            assertEquals("worker", claims.get("scope", String.class));
            assertNotNull(claims.getIssuedAt());
            assertNotNull(claims.getExpiration());
        }
    }

    @Nested
    @DisplayName("validateToken")
    class ValidateTokenTests {

        @Test
        @DisplayName("throws on expired token")
        void throwsOnExpiredToken() {
            JwtTokenService shortLivedService = new JwtTokenService(SECRET, 0);
            String token = shortLivedService.generateWorkerToken("job-001");

            assertThrows(ExpiredJwtException.class, () -> service.validateToken(token));
        }

        @Test
        @DisplayName("throws on invalid signature")
        void throwsOnInvalidSignature() {
            String token = service.generateWorkerToken("job-001");
            JwtTokenService otherService = new JwtTokenService(
                    "a-completely-different-secret-key-at-least-32-bytes", EXPIRATION_SECONDS);

            assertThrows(SignatureException.class, () -> otherService.validateToken(token));
        }
    }

    @Nested
    @DisplayName("isValidForJob")
    class ValidForJobTests {

        @Test
        @DisplayName("accepts the token only for the job it was minted for")
        void boundToJob() {
            String token = service.generateWorkerToken("job-001");

            assertTrue(service.isValidForJob(token, "job-001"));
            assertFalse(service.isValidForJob(token, "job-002"));
        }

        @Test
        @DisplayName("rejects missing, malformed and expired tokens without throwing")
        void rejectsBadTokens() {
            String expired = new JwtTokenService(SECRET, 0).generateWorkerToken("job-001");

            assertFalse(service.isValidForJob(null, "job-001"));
            assertFalse(service.isValidForJob(" ", "job-001"));
            assertFalse(service.isValidForJob("not.a.valid.token", "job-001"));
            assertFalse(service.isValidForJob(expired, "job-001"));
            assertFalse(service.isValidForJob(service.generateWorkerToken("job-001"), null));
        }
    }
}
