package com.warden.egress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job-scoped domain allowlist owned by the egress proxy. Default-deny: a job with no
 * rules, or an unknown job, matches nothing.
 * <p>
 * Rules are written once at provisioning and removed at teardown; between those the
 * table is read-only for that job.
 */
@Component
public class EgressAllowlist {

    private static final Logger log = LoggerFactory.getLogger(EgressAllowlist.class);

    private final ConcurrentHashMap<String, List<DomainAllowRule>> rulesByScope = new ConcurrentHashMap<>();

    public void grant(String jobId, List<DomainAllowRule> rules) {
        for (DomainAllowRule rule : rules) {
            if (!jobId.equals(rule.scope())) {
                throw new IllegalArgumentException("Rule for " + rule.domain() + " is scoped to "
                        + rule.scope() + ", not " + jobId);
            }
        }
        rulesByScope.put(jobId, List.copyOf(rules));
        log.info("Egress allowlist for job {}: {}", jobId, rules.stream().map(DomainAllowRule::domain).toList());
    }

    public void revoke(String jobId) {
        if (rulesByScope.remove(jobId) != null) {
            log.info("Egress allowlist for job {} revoked", jobId);
        }
    }

    /**
     * The rule admitting {@code host} for {@code jobId}. Exact rules win over wildcards so
     * a credential bound to a specific host is the one injected.
     */
    public Optional<DomainAllowRule> match(String jobId, String host) {
        if (jobId == null) {
            return Optional.empty();
        }
        List<DomainAllowRule> rules = rulesByScope.get(jobId);
        if (rules == null) {
            return Optional.empty();
        }
        return rules.stream()
                .filter(rule -> rule.matches(host))
                .min(Comparator.comparing(DomainAllowRule::isWildcard));
    }

    public List<DomainAllowRule> rulesFor(String jobId) {
        return rulesByScope.getOrDefault(jobId, List.of());
    }
}
