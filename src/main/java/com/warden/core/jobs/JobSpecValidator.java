package com.warden.core.jobs;

import com.warden.core.model.JobMode;
import com.warden.core.model.JobSpec;
import com.warden.egress.CredentialVault;
import com.warden.egress.DomainAllowRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks an incoming job spec and fills in defaults. Returns the spec that is stored.
 */
@Component
public class JobSpecValidator {

    static final int MAX_TITLE_LENGTH = 120;
    static final int MAX_ITERATIONS = 1000;
    static final int MAX_TURNS = 500;

    private static final Pattern PROJECT_DIR = Pattern.compile("[A-Za-z0-9._-]+");

    private final JobProperties properties;
    private final CredentialVault vault;

    public JobSpecValidator(JobProperties properties, CredentialVault vault) {
        this.properties = properties;
        this.vault = vault;
    }

    /**
     * @throws ValidationException naming the first offending field
     */
    public JobSpec validate(JobSpec spec) {
        if (spec == null) {
            throw new ValidationException("Job spec is required");
        }
        if (spec.description() == null || spec.description().isBlank()) {
            throw new ValidationException("description is required");
        }
        if (spec.mode() == null) {
            throw new ValidationException("mode is required (worker or claude_code)");
        }

        String title = spec.title();
        if (title == null || title.isBlank()) {
            title = defaultTitle(spec.description());
        } else if (title.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }

        List<String> domains = new ArrayList<>(new LinkedHashSet<>(normalizeDomains(spec.allowedDomains())));

        Map<String, String> grants = new LinkedHashMap<>();
        spec.credentialGrants().forEach((domain, ref) -> {
            String normalized = normalizeDomain(domain);
            if (ref == null || ref.isBlank()) {
                throw new ValidationException("credential grant for " + domain + " has no reference");
            }
            if (!vault.contains(ref)) {
                throw new ValidationException("unknown credential reference '" + ref + "' for " + domain);
            }
            grants.put(normalized, ref);
        });

        Integer maxIterations = bounded("max_iterations", spec.maxIterations(),
                properties.getDefaultMaxIterations(), MAX_ITERATIONS);
        Integer maxTurns = null;
        String model = null;
        if (spec.mode() == JobMode.CLAUDE_CODE) {
            maxTurns = bounded("max_turns", spec.maxTurns(), properties.getDefaultMaxTurns(), MAX_TURNS);
            model = spec.model() != null && !spec.model().isBlank() ? spec.model().trim() : properties.getDefaultModel();
        } else if (spec.maxTurns() != null) {
            maxTurns = bounded("max_turns", spec.maxTurns(), properties.getDefaultMaxTurns(), MAX_TURNS);
        }

        String projectDir = spec.projectDir();
        if (projectDir != null && !projectDir.isBlank()) {
            projectDir = projectDir.trim();
            if (!PROJECT_DIR.matcher(projectDir).matches() || projectDir.equals(".") || projectDir.equals("..")) {
                throw new ValidationException("project_dir must be a single directory name: " + spec.projectDir());
            }
        } else {
            projectDir = null;
        }

        return new JobSpec(title.trim(), spec.description(), spec.mode(), domains, grants,
                maxIterations, maxTurns, model, projectDir, spec.routineId());
    }

    private static List<String> normalizeDomains(List<String> domains) {
        List<String> result = new ArrayList<>();
        for (String domain : domains) {
            result.add(normalizeDomain(domain));
        }
        return result;
    }

    private static String normalizeDomain(String domain) {
        if (!DomainAllowRule.isValidPattern(domain)) {
            throw new ValidationException("invalid domain: " + domain);
        }
        String normalized = domain.trim().toLowerCase(Locale.ROOT);
        return normalized.endsWith(".") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }

    private static Integer bounded(String field, Integer value, int defaultValue, int max) {
        int effective = value != null ? value : defaultValue;
        if (effective < 1 || effective > max) {
            throw new ValidationException(field + " must be between 1 and " + max);
        }
        return effective;
    }

    static String defaultTitle(String description) {
        String firstLine = description.strip().lines().findFirst().orElse("");
        return firstLine.length() <= 60 ? firstLine : firstLine.substring(0, 57) + "...";
    }
}
