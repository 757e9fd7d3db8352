package com.warden.core.jobs;

import com.warden.core.model.JobMode;
import com.warden.core.model.JobSpec;
import com.warden.egress.CredentialVault;
import com.warden.egress.EgressProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobSpecValidatorTest {

    private JobSpecValidator validator;

    @BeforeEach
    void setUp() {
        var egress = new EgressProperties();
        var github = new EgressProperties.Credential();
        github.setValue("ghp_test");
        github.setPrefix("Bearer ");
        egress.setCredentials(Map.of("github-token", github));
        validator = new JobSpecValidator(new JobProperties(), new CredentialVault(egress));
    }

    private static JobSpec spec(JobMode mode) {
        return JobSpec.of(null, "Summarize open issues\nand label them", mode);
    }

    @Nested
    @DisplayName("required fields")
    class RequiredFields {

        @Test
        @DisplayName("description is required")
        void descriptionRequired() {
            var ex = assertThrows(ValidationException.class,
                    () -> validator.validate(JobSpec.of("t", "  ", JobMode.WORKER)));
            assertTrue(ex.getMessage().contains("description"));
        }

        @Test
        @DisplayName("mode is required")
        void modeRequired() {
            assertThrows(ValidationException.class,
                    () -> validator.validate(JobSpec.of("t", "do it", null)));
        }

        @Test
        @DisplayName("title defaults to the first line of the description")
        void titleDefaults() {
            assertEquals("Summarize open issues", validator.validate(spec(JobMode.WORKER)).title());
        }

        @Test
        @DisplayName("overlong title is rejected")
        void overlongTitle() {
            assertThrows(ValidationException.class,
                    () -> validator.validate(JobSpec.of("x".repeat(121), "d", JobMode.WORKER)));
        }
    }

    @Nested
    @DisplayName("bounds and defaults")
    class Bounds {

        @Test
        @DisplayName("generic worker gets the default iteration bound and no model")
        void workerDefaults() {
            JobSpec result = validator.validate(spec(JobMode.WORKER));
            assertEquals(50, result.maxIterations());
            assertNull(result.maxTurns());
            assertNull(result.model());
        }

        @Test
        @DisplayName("coding bridge gets turn and model defaults")
        void bridgeDefaults() {
            JobSpec result = validator.validate(spec(JobMode.CLAUDE_CODE));
            assertEquals(30, result.maxTurns());
            assertEquals("sonnet", result.model());
        }

        @Test
        @DisplayName("iteration bound outside 1..1000 is rejected")
        void iterationBound() {
            assertThrows(ValidationException.class,
                    () -> validator.validate(spec(JobMode.WORKER).withMaxIterations(0)));
            assertThrows(ValidationException.class,
                    () -> validator.validate(spec(JobMode.WORKER).withMaxIterations(1001)));
            assertEquals(1000, validator.validate(spec(JobMode.WORKER).withMaxIterations(1000)).maxIterations());
        }

        @Test
        @DisplayName("project dir must be a single directory name")
        void projectDir() {
            JobSpec traversal = new JobSpec("t", "d", JobMode.WORKER, null, null, null, null, null, "../etc", null);
            assertThrows(ValidationException.class, () -> validator.validate(traversal));

            JobSpec dotdot = new JobSpec("t", "d", JobMode.WORKER, null, null, null, null, null, "..", null);
            assertThrows(ValidationException.class, () -> validator.validate(dotdot));

            JobSpec ok = new JobSpec("t", "d", JobMode.WORKER, null, null, null, null, null, "my-app_2", null);
            assertEquals("my-app_2", validator.validate(ok).projectDir());
        }
    }

    @Nested
    @DisplayName("egress declarations")
    class Egress {

        @Test
        @DisplayName("domains are normalized and de-duplicated")
        void domainsNormalized() {
            JobSpec result = validator.validate(spec(JobMode.WORKER)
                    .withAllowedDomains(List.of("API.GitHub.com.", "api.github.com", "*.pypi.org")));
            assertEquals(List.of("api.github.com", "*.pypi.org"), result.allowedDomains());
        }

        @Test
        @DisplayName("invalid domain is rejected")
        void invalidDomain() {
            assertThrows(ValidationException.class,
                    () -> validator.validate(spec(JobMode.WORKER).withAllowedDomains(List.of("http://x.com/path"))));
        }

        @Test
        @DisplayName("grant must name a configured credential reference")
        void unknownCredential() {
            var ex = assertThrows(ValidationException.class, () -> validator.validate(
                    spec(JobMode.WORKER).withCredentialGrants(Map.of("api.github.com", "aws-root"))));
            assertTrue(ex.getMessage().contains("aws-root"));
        }

        @Test
        @DisplayName("known grant is kept as a reference")
        void knownCredential() {
            JobSpec result = validator.validate(
                    spec(JobMode.WORKER).withCredentialGrants(Map.of("API.github.com", "github-token")));
            assertEquals(Map.of("api.github.com", "github-token"), result.credentialGrants());
        }
    }
}
