package com.warden.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Docker-based SandboxProvider.
 *
 * <p>Each job gets:
 * <ul>
 *   <li>its own bridge network {@code warden-job-<id>}, internal unless the request says otherwise</li>
 *   <li>one bind mount mapping the job's project directory to /workspace</li>
 *   <li>all capabilities dropped and {@code no-new-privileges}</li>
 *   <li>memory and CPU limits from the request</li>
 * </ul>
 * An internal network has no route out, so the gateway container (the one running the
 * orchestrator and egress proxy) is attached to it under the alias {@value #GATEWAY_ALIAS}.
 * Without a gateway container only non-internal networks can be created; those get a
 * host.docker.internal entry instead.
 * <p>
 * Containers and networks carry the {@value #JOB_LABEL} label so orphans can be found
 * after an orchestrator restart.
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    public static final String JOB_LABEL = "warden.job-id";
    public static final String GATEWAY_ALIAS = "warden-gateway";
    static final String WORKSPACE = "/workspace";

    private final DockerClient dockerClient;
    private final String gatewayContainer;

    /**
     * @param gatewayContainer name or id of the container serving the orchestrator API and
     *                         egress proxy; null or blank when the orchestrator runs on the host
     */
    public DockerSandboxProvider(DockerClient dockerClient, String gatewayContainer) {
        this.dockerClient = dockerClient;
        this.gatewayContainer = gatewayContainer == null || gatewayContainer.isBlank() ? null : gatewayContainer.trim();
    }

    @Override
    public SandboxHandle openSandbox(SandboxRequest request) {
        String name = containerName(request.jobId());
        if (request.networkInternal() && gatewayContainer == null) {
            throw new ProvisionException("an internal job network needs warden.sandbox.gateway-container,"
                    + " otherwise the sandbox cannot reach the orchestrator or the egress proxy");
        }
        try {
            dockerClient.inspectImageCmd(request.image()).exec();
        } catch (NotFoundException e) {
            throw new ProvisionException("worker image " + request.image() + " is not available locally");
        }

        // Clean up any stale container with the same name from a previous attempt
        try {
            dockerClient.removeContainerCmd(name).withForce(true).exec();
            log.debug("Removed stale container {}", name);
        } catch (NotFoundException e) {
            log.trace("No stale container {}", name);
        }

        Map<String, String> labels = Map.of(JOB_LABEL, request.jobId());
        String networkId = null;
        try {
            networkId = dockerClient.createNetworkCmd()
                    .withName(name)
                    .withDriver("bridge")
                    .withInternal(request.networkInternal())
                    .withLabels(labels)
                    .exec()
                    .getId();
            attachGateway(networkId);

            var envList = new ArrayList<String>();
            request.env().forEach((k, v) -> envList.add(k + "=" + v));

            var hostConfig = HostConfig.newHostConfig()
                    .withBinds(new Bind(request.projectPath().toString(), new Volume(WORKSPACE), AccessMode.rw))
                    .withMemory((long) request.memoryLimitMb() * 1024 * 1024)
                    .withCpuCount((long) request.cpuCount())
                    .withCapDrop(Capability.ALL)
                    .withSecurityOpts(List.of("no-new-privileges"))
                    .withNetworkMode(name);
            if (!request.networkInternal()) {
                hostConfig.withExtraHosts("host.docker.internal:host-gateway");
            }

            var response = dockerClient.createContainerCmd(request.image())
                    .withName(name)
                    .withHostConfig(hostConfig)
                    .withEnv(envList)
                    .withCmd(request.command())
                    .withLabels(labels)
                    .withWorkingDir(WORKSPACE)
                    .exec();

            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Sandbox {} started (container {}, image {})", name, containerId, request.image());
            return new SandboxHandle(request.jobId(), containerId, networkId);
        } catch (DockerException e) {
            teardownSandbox(new SandboxHandle(request.jobId(), name, networkId), 0);
            throw new ProvisionException(e.getMessage(), e);
        }
    }

    @Override
    public SandboxStatus inspect(SandboxHandle handle) {
        try {
            InspectContainerResponse response = dockerClient.inspectContainerCmd(handle.sandboxId()).exec();
            var state = response.getState();
            boolean running = Boolean.TRUE.equals(state.getRunning());
            Long exitCode = state.getExitCodeLong();
            return new SandboxStatus(true, running, exitCode != null ? exitCode : -1);
        } catch (NotFoundException e) {
            return SandboxStatus.gone();
        }
    }

    @Override
    public void teardownSandbox(SandboxHandle handle, int stopGraceSeconds) {
        try {
            dockerClient.stopContainerCmd(handle.sandboxId()).withTimeout(stopGraceSeconds).exec();
        } catch (DockerException e) {
            log.debug("Container {} may already be stopped: {}", handle.sandboxId(), e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(handle.sandboxId()).withForce(true).exec();
            log.info("Sandbox {} torn down", handle.sandboxId());
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", handle.sandboxId());
        } catch (DockerException e) {
            log.warn("Failed to remove container {}", handle.sandboxId(), e);
        }
        if (handle.networkId() != null) {
            removeNetwork(handle.networkId());
        }
    }

    @Override
    public int removeOrphans(Set<String> keepJobIds) {
        int removed = 0;
        List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(List.of(JOB_LABEL))
                .exec();
        for (Container container : containers) {
            String jobId = container.getLabels() != null ? container.getLabels().get(JOB_LABEL) : null;
            if (jobId == null || keepJobIds.contains(jobId)) {
                continue;
            }
            log.info("Removing orphaned sandbox {} of job {}", container.getId(), jobId);
            teardownSandbox(new SandboxHandle(jobId, container.getId(), null), 0);
            removed++;
        }

        List<Network> networks = dockerClient.listNetworksCmd().exec();
        for (Network network : networks) {
            Map<String, String> networkLabels = network.getLabels();
            String jobId = networkLabels != null ? networkLabels.get(JOB_LABEL) : null;
            if (jobId != null && !keepJobIds.contains(jobId)) {
                removeNetwork(network.getId());
            }
        }
        return removed;
    }

    @Override
    public boolean ping() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    static String containerName(String jobId) {
        return "warden-job-" + jobId;
    }

    private void attachGateway(String networkId) {
        if (gatewayContainer == null) {
            return;
        }
        dockerClient.connectToNetworkCmd()
                .withNetworkId(networkId)
                .withContainerId(gatewayContainer)
                .withContainerNetwork(new ContainerNetwork().withAliases(GATEWAY_ALIAS))
                .exec();
        log.debug("Gateway {} attached to network {}", gatewayContainer, networkId);
    }

    private void detachGateway(String networkId) {
        if (gatewayContainer == null) {
            return;
        }
        try {
            dockerClient.disconnectFromNetworkCmd()
                    .withNetworkId(networkId)
                    .withContainerId(gatewayContainer)
                    .withForce(true)
                    .exec();
        } catch (NotFoundException e) {
            log.debug("Gateway not attached to network {}", networkId);
        } catch (DockerException e) {
            log.warn("Failed to detach gateway from network {}: {}", networkId, e.getMessage());
        }
    }

    private void removeNetwork(String networkId) {
        detachGateway(networkId);
        try {
            dockerClient.removeNetworkCmd(networkId).exec();
            log.debug("Network {} removed", networkId);
        } catch (NotFoundException e) {
            log.debug("Network {} already removed", networkId);
        } catch (DockerException e) {
            log.warn("Failed to remove network {}: {}", networkId, e.getMessage());
        }
    }
}
