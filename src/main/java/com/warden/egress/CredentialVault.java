package com.warden.egress;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves credential references from {@code warden.egress.credentials}. Secrets are read
 * at request time, from the configured value or the named environment variable of the
 * orchestrator process; they are never handed to a sandbox.
 */
@Component
public class CredentialVault {

    private final EgressProperties properties;
    private final Function<String, String> environment;

    public CredentialVault(EgressProperties properties) {
        this(properties, System::getenv);
    }

    CredentialVault(EgressProperties properties, Function<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public boolean contains(String ref) {
        return ref != null && properties.getCredentials().containsKey(ref);
    }

    public Optional<InjectedCredential> resolve(String ref) {
        Map<String, EgressProperties.Credential> table = properties.getCredentials();
        EgressProperties.Credential credential = ref == null ? null : table.get(ref);
        if (credential == null) {
            return Optional.empty();
        }
        String secret = credential.getValue();
        if ((secret == null || secret.isBlank()) && credential.getEnv() != null) {
            secret = environment.apply(credential.getEnv());
        }
        if (secret == null || secret.isBlank()) {
            return Optional.empty();
        }
        String prefix = credential.getPrefix() != null ? credential.getPrefix() : "";
        return Optional.of(new InjectedCredential(credential.getHeader(), prefix + secret));
    }
}
