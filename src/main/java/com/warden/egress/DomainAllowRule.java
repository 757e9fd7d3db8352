package com.warden.egress;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One allowlist entry. Holds only a credential reference, never the secret.
 *
 * @param domain        exact host, or {@code *.example.com} for any subdomain
 * @param scope         the job id the rule applies to
 * @param credentialRef reference resolved by {@link CredentialVault}, or null
 */
public record DomainAllowRule(String domain, String scope, String credentialRef) {

    private static final Pattern DOMAIN_PATTERN = Pattern.compile(
            "^(\\*\\.)?([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

    public DomainAllowRule {
        domain = normalize(domain);
    }

    public boolean matches(String host) {
        if (host == null) {
            return false;
        }
        String candidate = normalize(host);
        if (domain.startsWith("*.")) {
            return candidate.endsWith(domain.substring(1));
        }
        return domain.equals(candidate);
    }

    public boolean isWildcard() {
        return domain.startsWith("*.");
    }

    /** Syntactic check used when validating job specs. */
    public static boolean isValidPattern(String domain) {
        return domain != null && DOMAIN_PATTERN.matcher(normalize(domain)).matches();
    }

    static String normalize(String domain) {
        String value = domain.trim().toLowerCase(Locale.ROOT);
        return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
    }
}
