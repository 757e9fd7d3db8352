package com.warden.sandbox;

import com.warden.core.events.EventPipeline;
import com.warden.core.events.InMemoryEventStore;
import com.warden.core.jobs.InMemoryJobStore;
import com.warden.core.jobs.JobOrchestrator;
import com.warden.core.jobs.JobProperties;
import com.warden.core.jobs.JobRegistry;
import com.warden.core.jobs.JobSpecValidator;
import com.warden.core.jobs.JobTransitionedEvent;
import com.warden.core.jobs.PromptQueue;
import com.warden.core.model.Job;
import com.warden.core.model.JobMode;
import com.warden.core.model.JobSpec;
import com.warden.core.model.JobState;
import com.warden.core.security.JwtTokenService;
import com.warden.egress.CredentialVault;
import com.warden.egress.DomainAllowRule;
import com.warden.egress.EgressAllowlist;
import com.warden.egress.EgressProperties;
import com.warden.support.MutableClock;
import com.warden.support.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class SandboxSupervisorTest {

    @TempDir
    Path projectsRoot;

    private MutableClock clock;
    private JobRegistry registry;
    private SandboxProvider provider;
    private EgressAllowlist allowlist;
    private JwtTokenService tokenService;
    private EgressProperties egressProperties;
    private SandboxProperties properties;
    private SandboxSupervisor supervisor;
    private JobOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        var publisher = new RecordingPublisher();
        var jobProperties = new JobProperties();
        registry = new JobRegistry(new InMemoryJobStore(), publisher, jobProperties, clock, null);
        var pipeline = new EventPipeline(new InMemoryEventStore(), jobProperties, Runnable::run, clock, null);

        provider = mock(SandboxProvider.class);
        when(provider.openSandbox(any())).thenAnswer(inv -> {
            SandboxRequest request = inv.getArgument(0);
            return new SandboxHandle(request.jobId(), "ctr-" + request.jobId(), "net-" + request.jobId());
        });
        when(provider.inspect(any())).thenReturn(new SandboxStatus(true, true, 0));

        allowlist = new EgressAllowlist();
        tokenService = new JwtTokenService("sandbox-test-secret-that-is-long-enough-for-hs256", 600);
        egressProperties = new EgressProperties();
        egressProperties.getToolDomains().add("api.anthropic.com");
        var github = new EgressProperties.Credential();
        github.setValue("ghp_secret");
        egressProperties.getCredentials().put("github-token", github);

        properties = new SandboxProperties();
        properties.getSandbox().setProjectsRoot(projectsRoot.toString());
        properties.getSandbox().setOrchestratorUrl("http://orchestrator:8080");

        supervisor = new SandboxSupervisor(provider, registry, allowlist, tokenService,
                new ProjectWorkspaces(properties), properties, egressProperties, Runnable::run, clock, null);
        publisher.addListener(event -> {
            if (event instanceof JobTransitionedEvent transitioned) {
                supervisor.onJobTransitioned(transitioned);
                pipeline.onJobTransitioned(transitioned);
            }
        });

        var validator = new JobSpecValidator(jobProperties, new CredentialVault(egressProperties));
        orchestrator = new JobOrchestrator(registry, validator, supervisor, pipeline, new PromptQueue(), clock);
    }

    private static JobSpec spec() {
        return JobSpec.of("build", "Build the project", JobMode.WORKER)
                .withAllowedDomains(List.of("pypi.org"))
                .withCredentialGrants(Map.of("api.github.com", "github-token"));
    }

    private SandboxRequest lastRequest() {
        ArgumentCaptor<SandboxRequest> captor = ArgumentCaptor.forClass(SandboxRequest.class);
        verify(provider, atLeastOnce()).openSandbox(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("provisioning")
    class Provisioning {

        @Test
        @DisplayName("starts the sandbox, writes egress rules and moves the job to IN_PROGRESS")
        void success() {
            Job job = orchestrator.create(spec());

            assertEquals(JobState.IN_PROGRESS, registry.get(job.id()).state());
            assertTrue(supervisor.hasSandbox(job.id()));
            assertTrue(allowlist.match(job.id(), "pypi.org").isPresent());
            assertEquals("github-token", allowlist.match(job.id(), "api.github.com").orElseThrow().credentialRef());
            assertTrue(allowlist.match(job.id(), "api.anthropic.com").isPresent());
            assertTrue(Files.isDirectory(projectsRoot.resolve(job.id())));
        }

        @Test
        @DisplayName("the sandbox receives its job identity and proxy settings but no secrets")
        void environment() {
            Job job = orchestrator.create(spec());
            SandboxRequest request = lastRequest();

            assertEquals(Set.of("WARDEN_JOB_ID", "WARDEN_ORCHESTRATOR_URL", "WARDEN_JOB_TOKEN", "HTTP_PROXY", "HTTPS_PROXY"),
                    request.env().keySet());
            assertEquals(job.id(), request.env().get("WARDEN_JOB_ID"));
            assertTrue(tokenService.isValidForJob(request.env().get("WARDEN_JOB_TOKEN"), job.id()));
            assertTrue(request.env().get("HTTP_PROXY").endsWith("@warden-gateway:3128"));
            assertTrue(request.networkInternal());
            assertFalse(request.env().values().stream().anyMatch(value -> value.contains("ghp_secret")));
            assertEquals(List.of("worker", "--job-id=" + job.id(), "--orchestrator-url=http://orchestrator:8080",
                    "--max-iterations=50"), request.command());
        }

        @Test
        @DisplayName("a provider failure fails the job and removes its rules")
        void failure() {
            when(provider.openSandbox(any())).thenThrow(new ProvisionException("image not found"));

            Job job = orchestrator.create(spec());

            Job failed = registry.get(job.id());
            assertEquals(JobState.FAILED, failed.state());
            assertTrue(failed.lastTransition().reason().contains("image not found"));
            assertFalse(failed.result().success());
            assertTrue(allowlist.rulesFor(job.id()).isEmpty());
            assertFalse(supervisor.hasSandbox(job.id()));
        }

        @Test
        @DisplayName("a job cancelled before provisioning is left alone")
        void cancelledBeforeProvisioning() {
            Job job = registry.register(spec(), null);
            registry.transition(job.id(), JobState.CANCELLED, "cancelled by operator");

            supervisor.provision(job);

            verify(provider, never()).openSandbox(any());
        }
    }

    @Nested
    @DisplayName("liveness")
    class Liveness {

        @Test
        @DisplayName("silence past the heartbeat timeout interrupts the job, which can be restarted")
        void heartbeatTimeout() {
            Job job = orchestrator.create(spec());

            clock.advanceSeconds(200);
            registry.touch(job.id());
            clock.advanceSeconds(200);
            supervisor.checkLiveness();
            assertEquals(JobState.IN_PROGRESS, registry.get(job.id()).state());

            clock.advanceSeconds(101);
            supervisor.checkLiveness();

            Job interrupted = registry.get(job.id());
            assertEquals(JobState.INTERRUPTED, interrupted.state());
            assertEquals("heartbeat timeout", interrupted.lastTransition().reason());
            verify(provider).teardownSandbox(new SandboxHandle(job.id(), "ctr-" + job.id(), "net-" + job.id()), 10);
            assertTrue(allowlist.rulesFor(job.id()).isEmpty());

            Job restarted = orchestrator.restart(job.id());
            assertEquals(job.id(), restarted.restartedFrom());
            assertEquals(JobState.IN_PROGRESS, registry.get(restarted.id()).state());
            assertEquals(job.spec().allowedDomains(), registry.get(restarted.id()).spec().allowedDomains());
        }

        @Test
        @DisplayName("a worker that exits without a result interrupts the job")
        void exitedWorker() {
            Job job = orchestrator.create(spec());
            when(provider.inspect(any())).thenReturn(new SandboxStatus(true, false, 137));

            supervisor.checkLiveness();

            Job interrupted = registry.get(job.id());
            assertEquals(JobState.INTERRUPTED, interrupted.state());
            assertTrue(interrupted.lastTransition().reason().contains("exit code 137"));
        }

        @Test
        @DisplayName("running past the wall-clock timeout fails the job")
        void wallClockTimeout() {
            properties.getSandbox().setTimeoutSeconds(600);
            Job job = orchestrator.create(spec());

            for (int i = 0; i < 4; i++) {
                clock.advanceSeconds(160);
                registry.touch(job.id());
            }
            supervisor.checkLiveness();

            Job failed = registry.get(job.id());
            assertEquals(JobState.FAILED, failed.state());
            assertEquals("job exceeded timeout of 600s", failed.lastTransition().reason());
        }

        @Test
        @DisplayName("a job that completes normally has its sandbox torn down once")
        void teardownOnCompletion() {
            Job job = orchestrator.create(spec());

            registry.transition(job.id(), JobState.COMPLETED, "done");
            supervisor.teardown(job.id());

            verify(provider, times(1)).teardownSandbox(any(), anyInt());
            assertEquals(0, supervisor.activeSandboxCount());
        }
    }

    @Test
    @DisplayName("shutdown ends active jobs and removes every sandbox")
    void shutdown() {
        Job running = orchestrator.create(spec());
        Job pending = registry.register(spec(), null);

        supervisor.shutdown("orchestrator shutting down");

        assertEquals(JobState.INTERRUPTED, registry.get(running.id()).state());
        assertEquals(JobState.FAILED, registry.get(pending.id()).state());
        assertEquals(0, supervisor.activeSandboxCount());
    }

    @Test
    @DisplayName("orphan sweep keeps active jobs")
    void removeOrphans() {
        Job running = orchestrator.create(spec());
        when(provider.removeOrphans(any())).thenReturn(2);

        assertEquals(2, supervisor.removeOrphans());
        verify(provider).removeOrphans(argThat(keep -> keep.contains(running.id())));
    }

    @Nested
    @DisplayName("worker wiring")
    class Wiring {

        @Test
        @DisplayName("a grant admits its domain and a duplicate declared domain keeps the credential")
        void allowRulesMerge() {
            JobSpec spec = JobSpec.of("t", "d", JobMode.WORKER)
                    .withAllowedDomains(List.of("API.github.com", "pypi.org"))
                    .withCredentialGrants(Map.of("api.github.com", "github-token"));
            Job job = Job.create("job-9", spec, null, clock.instant());

            List<DomainAllowRule> rules = supervisor.allowRules(job);

            assertEquals(3, rules.size());
            assertEquals("github-token", rules.stream()
                    .filter(rule -> rule.domain().equals("api.github.com")).findFirst().orElseThrow().credentialRef());
            assertTrue(rules.stream().allMatch(rule -> rule.scope().equals("job-9")));
        }

        @Test
        @DisplayName("coding-agent jobs run the bridge with turns and model")
        void bridgeCommand() {
            JobSpec spec = new JobSpec("t", "d", JobMode.CLAUDE_CODE, List.of(), Map.of(),
                    null, 12, "opus", null, null);
            Job job = Job.create("job-7", spec, null, clock.instant());

            assertEquals(List.of("claude-bridge", "--job-id=job-7", "--orchestrator-url=http://orchestrator:8080",
                    "--max-turns=12", "--model=opus"), supervisor.workerCommand(job));
        }
    }
}
