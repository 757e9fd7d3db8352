package com.warden.egress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EgressAllowlistTest {

    private final EgressAllowlist allowlist = new EgressAllowlist();

    @Test
    @DisplayName("unknown jobs and jobs without rules match nothing")
    void defaultDeny() {
        allowlist.grant("job-1", List.of());

        assertTrue(allowlist.match("job-1", "github.com").isEmpty());
        assertTrue(allowlist.match("job-2", "github.com").isEmpty());
        assertTrue(allowlist.match(null, "github.com").isEmpty());
    }

    @Test
    @DisplayName("rules are scoped to the job they were granted for")
    void scoped() {
        allowlist.grant("job-1", List.of(new DomainAllowRule("github.com", "job-1", null)));

        assertTrue(allowlist.match("job-1", "github.com").isPresent());
        assertTrue(allowlist.match("job-2", "github.com").isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> allowlist.grant("job-2", List.of(new DomainAllowRule("github.com", "job-1", null))));
    }

    @Test
    @DisplayName("exact rule wins over a wildcard so its credential is the one used")
    void exactBeatsWildcard() {
        allowlist.grant("job-1", List.of(
                new DomainAllowRule("*.github.com", "job-1", null),
                new DomainAllowRule("api.github.com", "job-1", "github-token")));

        DomainAllowRule rule = allowlist.match("job-1", "api.github.com").orElseThrow();
        assertEquals("github-token", rule.credentialRef());
        assertNull(allowlist.match("job-1", "raw.github.com").orElseThrow().credentialRef());
    }

    @Test
    @DisplayName("revoke removes every rule for the job")
    void revoke() {
        allowlist.grant("job-1", List.of(new DomainAllowRule("github.com", "job-1", null)));

        allowlist.revoke("job-1");
        allowlist.revoke("job-1");

        assertTrue(allowlist.match("job-1", "github.com").isEmpty());
        assertTrue(allowlist.rulesFor("job-1").isEmpty());
    }
}
