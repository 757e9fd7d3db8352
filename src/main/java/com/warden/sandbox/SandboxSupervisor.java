package com.warden.sandbox;

import com.warden.core.jobs.JobRegistry;
import com.warden.core.jobs.JobTransitionedEvent;
import com.warden.core.jobs.StateConflictException;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.Job;
import com.warden.core.model.JobMode;
import com.warden.core.model.JobState;
import com.warden.core.security.JwtTokenService;
import com.warden.egress.DomainAllowRule;
import com.warden.egress.EgressAllowlist;
import com.warden.egress.EgressProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Owns every job's sandbox from provisioning to teardown.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Writes the job's egress rules, mints its worker token and starts its container</li>
 *   <li>Polls liveness and moves silent, exited or overdue jobs to a terminal state</li>
 *   <li>Tears the sandbox down once the job is terminal, whatever made it so</li>
 * </ul>
 * The supervisor never writes job state directly; it asks the {@link JobRegistry}, and a
 * lost race against another transition is expected and tolerated.
 */
@Service
public class SandboxSupervisor {

    private static final Logger log = LoggerFactory.getLogger(SandboxSupervisor.class);

    public static final String ENV_JOB_ID = "WARDEN_JOB_ID";
    public static final String ENV_ORCHESTRATOR_URL = "WARDEN_ORCHESTRATOR_URL";
    public static final String ENV_JOB_TOKEN = "WARDEN_JOB_TOKEN";

    private final SandboxProvider provider;
    private final JobRegistry registry;
    private final EgressAllowlist allowlist;
    private final JwtTokenService tokenService;
    private final ProjectWorkspaces workspaces;
    private final SandboxProperties properties;
    private final EgressProperties egressProperties;
    private final Executor executor;
    private final Clock clock;
    private final WardenMetrics metrics;

    private final ConcurrentHashMap<String, SandboxHandle> handles = new ConcurrentHashMap<>();

    public SandboxSupervisor(SandboxProvider provider,
                             JobRegistry registry,
                             EgressAllowlist allowlist,
                             JwtTokenService tokenService,
                             ProjectWorkspaces workspaces,
                             SandboxProperties properties,
                             EgressProperties egressProperties,
                             @Qualifier("sandboxExecutor") Executor executor,
                             Clock clock,
                             @Autowired(required = false) WardenMetrics metrics) {
        this.provider = provider;
        this.registry = registry;
        this.allowlist = allowlist;
        this.tokenService = tokenService;
        this.workspaces = workspaces;
        this.properties = properties;
        this.egressProperties = egressProperties;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /** Queues provisioning and returns immediately. */
    public void provisionAsync(Job job) {
        executor.execute(() -> provision(job));
    }

    /**
     * Provisions the job's sandbox and moves it to IN_PROGRESS. Failures move it to FAILED
     * with the cause in the reason; nothing is retried.
     */
    public void provision(Job job) {
        MdcContext.setJob(job.id(), job.mode().wireName());
        long start = System.currentTimeMillis();
        try {
            if (registry.get(job.id()).state() != JobState.PENDING) {
                log.info("Job {} left PENDING before provisioning, skipping", job.id());
                return;
            }

            allowlist.grant(job.id(), allowRules(job));
            Path projectDir = workspaces.prepare(job);
            String token = tokenService.generateWorkerToken(job.id());

            SandboxRequest request = new SandboxRequest(
                    job.id(),
                    properties.getImage(),
                    workspaces.hostPath(job),
                    workerEnv(job.id(), token),
                    workerCommand(job),
                    properties.getMemoryLimitMb(),
                    properties.getCpuCount(),
                    properties.isNetworkInternal());

            SandboxHandle handle = provider.openSandbox(request);
            handles.put(job.id(), handle);
            recordProvisioning(true, start);
            log.info("Provisioned sandbox {} for job {} (project {})", handle.sandboxId(), job.id(), projectDir);

            try {
                registry.transition(job.id(), JobState.IN_PROGRESS, "sandbox started");
            } catch (StateConflictException e) {
                // Cancelled, or the worker already reported in
                if (registry.get(job.id()).isTerminal()) {
                    log.info("Job {} became {} while provisioning, tearing down", job.id(), e.getCurrentState());
                    teardown(job.id());
                }
            }
        } catch (RuntimeException e) {
            recordProvisioning(false, start);
            log.error("Provisioning failed for job {}: {}", job.id(), e.getMessage(), e);
            try {
                registry.transition(job.id(), JobState.FAILED, "provisioning failed: " + e.getMessage());
            } catch (StateConflictException conflict) {
                log.info("Job {} already {}, not marking provisioning failure", job.id(), conflict.getCurrentState());
            }
            teardown(job.id());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Liveness sweep over in-progress jobs: exited sandboxes, heartbeat timeouts and
     * wall-clock timeouts each end the job.
     */
    @Scheduled(fixedDelayString = "${warden.sandbox.liveness-interval-ms:5000}")
    public void checkLiveness() {
        Instant now = clock.instant();
        for (Job job : registry.active()) {
            if (job.state() != JobState.IN_PROGRESS) {
                continue;
            }
            MdcContext.setJob(job.id(), job.mode().wireName());
            try {
                checkJob(job, now);
            } catch (StateConflictException e) {
                log.debug("Liveness transition for job {} lost a race: {}", job.id(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Liveness check failed for job {}: {}", job.id(), e.getMessage(), e);
            } finally {
                MdcContext.clear();
            }
        }
    }

    private void checkJob(Job job, Instant now) {
        Instant started = job.startedAt() != null ? job.startedAt() : job.createdAt();
        if (Duration.between(started, now).getSeconds() > properties.getTimeoutSeconds()) {
            registry.transition(job.id(), JobState.FAILED,
                    "job exceeded timeout of " + properties.getTimeoutSeconds() + "s");
            return;
        }

        SandboxHandle handle = handles.get(job.id());
        if (handle != null) {
            SandboxStatus status = provider.inspect(handle);
            if (status.exited()) {
                registry.transition(job.id(), JobState.INTERRUPTED,
                        "worker exited without reporting a result (exit code " + status.exitCode() + ")");
                return;
            }
        }

        Instant lastActivity = job.lastActivityAt() != null ? job.lastActivityAt() : started;
        if (Duration.between(lastActivity, now).getSeconds() > properties.getHeartbeatTimeoutSeconds()) {
            registry.transition(job.id(), JobState.INTERRUPTED, "heartbeat timeout");
        }
    }

    @EventListener
    public void onJobTransitioned(JobTransitionedEvent event) {
        if (event.isTerminal()) {
            String jobId = event.job().id();
            executor.execute(() -> teardown(jobId));
        }
    }

    /** Asks for teardown ahead of a cancellation; the terminal transition follows. */
    public void requestTeardown(String jobId) {
        executor.execute(() -> teardown(jobId));
    }

    /**
     * Idempotent: the first caller removes the sandbox, later callers only make sure the
     * egress rules are gone.
     */
    public void teardown(String jobId) {
        SandboxHandle handle = handles.remove(jobId);
        if (handle != null) {
            provider.teardownSandbox(handle, properties.getStopGraceSeconds());
        }
        allowlist.revoke(jobId);
    }

    /**
     * Ends every active job and removes its sandbox synchronously. Used on orchestrator
     * shutdown so no container outlives the process that supervises it.
     */
    public void shutdown(String reason) {
        for (Job job : registry.active()) {
            JobState target = job.state() == JobState.PENDING ? JobState.FAILED : JobState.INTERRUPTED;
            try {
                registry.transition(job.id(), target, reason);
            } catch (StateConflictException e) {
                log.debug("Job {} already {} during shutdown", job.id(), e.getCurrentState());
            }
        }
        for (String jobId : new ArrayList<>(handles.keySet())) {
            teardown(jobId);
        }
    }

    /**
     * Removes sandboxes left behind by an earlier orchestrator process.
     */
    public int removeOrphans() {
        Set<String> keep = registry.active().stream().map(Job::id).collect(Collectors.toSet());
        keep.addAll(handles.keySet());
        int removed = provider.removeOrphans(keep);
        if (removed > 0) {
            log.info("Removed {} orphaned sandbox(es)", removed);
        }
        return removed;
    }

    public int activeSandboxCount() {
        return handles.size();
    }

    public boolean hasSandbox(String jobId) {
        return handles.containsKey(jobId);
    }

    /**
     * Operator-declared domains, tool domains and credential-grant domains. A grant also
     * admits its domain and carries the credential reference.
     */
    List<DomainAllowRule> allowRules(Job job) {
        Map<String, String> grants = job.spec().credentialGrants();
        Set<String> domains = new LinkedHashSet<>();
        domains.addAll(job.spec().allowedDomains());
        domains.addAll(egressProperties.getToolDomains());
        domains.addAll(grants.keySet());

        Map<String, DomainAllowRule> rules = new LinkedHashMap<>();
        for (String domain : domains) {
            DomainAllowRule rule = new DomainAllowRule(domain, job.id(), grants.get(domain));
            rules.merge(rule.domain(), rule, (a, b) -> a.credentialRef() != null ? a : b);
        }
        return List.copyOf(rules.values());
    }

    /** The worker environment. Nothing else from the orchestrator reaches the sandbox. */
    Map<String, String> workerEnv(String jobId, String token) {
        String proxyUrl = "http://" + jobId + ":" + token + "@"
                + egressProperties.getAdvertisedHost() + ":" + egressProperties.getPort();
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_JOB_ID, jobId);
        env.put(ENV_ORCHESTRATOR_URL, properties.getOrchestratorUrl());
        env.put(ENV_JOB_TOKEN, token);
        env.put("HTTP_PROXY", proxyUrl);
        env.put("HTTPS_PROXY", proxyUrl);
        return env;
    }

    List<String> workerCommand(Job job) {
        List<String> command = new ArrayList<>();
        if (job.mode() == JobMode.CLAUDE_CODE) {
            command.add("claude-bridge");
            command.add("--job-id=" + job.id());
            command.add("--orchestrator-url=" + properties.getOrchestratorUrl());
            if (job.spec().maxTurns() != null) {
                command.add("--max-turns=" + job.spec().maxTurns());
            }
            if (job.spec().model() != null) {
                command.add("--model=" + job.spec().model());
            }
        } else {
            command.add("worker");
            command.add("--job-id=" + job.id());
            command.add("--orchestrator-url=" + properties.getOrchestratorUrl());
            if (job.spec().maxIterations() != null) {
                command.add("--max-iterations=" + job.spec().maxIterations());
            }
        }
        return command;
    }

    private void recordProvisioning(boolean success, long start) {
        if (metrics != null) {
            metrics.recordProvisioning(success, System.currentTimeMillis() - start);
        }
    }
}
