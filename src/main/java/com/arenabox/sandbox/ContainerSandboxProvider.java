package com.arenabox.sandbox;

import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.transport.OrchestratorClient;
import com.arenabox.transport.OrchestratorResult;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.InternetProtocol;
import com.github.dockerjava.api.model.Ports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single-container sandboxes: host ports are bound directly to the container's ports.
 *
 * <p>When the engine reports that a container with the generated name already exists (an earlier
 * attempt created it, or a concurrent request won the race) that container is reused as the handle,
 * together with the host ports it was created with. A reused container whose bindings cannot be read
 * fails the call.
 */
public class ContainerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(ContainerSandboxProvider.class);

    private final OrchestratorClient client;

    public ContainerSandboxProvider(OrchestratorClient client) {
        this.client = client;
    }

    @Override
    public SandboxKind kind() {
        return SandboxKind.SINGLE;
    }

    @Override
    public OrchestratorResult<ProvisionedSandbox> openSandbox(OrchestratorConfig config, SandboxRequest request) {
        return client.execute(config, "create-container", docker -> {
            var exposed = new ArrayList<ExposedPort>();
            var bindings = new Ports();
            for (PortMapping mapping : request.ports()) {
                var port = toExposedPort(mapping.target());
                exposed.add(port);
                bindings.bind(port, Ports.Binding.bindPort(mapping.publishedPort()));
            }

            var hostConfig = HostConfig.newHostConfig()
                    .withPortBindings(bindings)
                    .withAutoRemove(true);

            String containerId;
            boolean reused = false;
            try {
                containerId = docker.createContainerCmd(request.image())
                        .withName(request.name())
                        .withExposedPorts(exposed)
                        .withHostConfig(hostConfig)
                        .exec()
                        .getId();
                log.info("Created container {} ({}) from {}", request.name(), containerId, request.image());
            } catch (ConflictException e) {
                Container existing = findByName(docker, request.name());
                if (existing == null) {
                    throw e;
                }
                containerId = existing.getId();
                reused = true;
                log.info("Container {} already exists, reusing {}", request.name(), containerId);
            }

            try {
                docker.startContainerCmd(containerId).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already running", containerId);
            }
            List<PortMapping> ports = reused ? boundPortsOf(docker, containerId, request.ports()) : request.ports();
            return new ProvisionedSandbox(containerId, ports);
        });
    }

    @Override
    public OrchestratorResult<Boolean> teardownSandbox(OrchestratorConfig config, String handle) {
        return client.execute(config, "remove-container", docker -> {
            try {
                docker.removeContainerCmd(handle).withForce(true).exec();
                log.info("Container {} removed", handle);
            } catch (NotFoundException e) {
                log.info("Container {} already gone", handle);
            }
            return Boolean.TRUE;
        });
    }

    static ExposedPort toExposedPort(PortSpec spec) {
        return new ExposedPort(spec.port(), InternetProtocol.parse(spec.protocol()));
    }

    private static Container findByName(DockerClient docker, String name) {
        List<Container> matches = docker.listContainersCmd()
                .withShowAll(true)
                .withNameFilter(List.of(name))
                .exec();
        if (matches == null) {
            return null;
        }
        // the name filter matches substrings, so confirm the exact name
        return matches.stream()
                .filter(c -> c.getNames() != null && List.of(c.getNames()).contains("/" + name))
                .findFirst()
                .orElse(null);
    }

    /**
     * Host ports a reused container was created with, read from its host configuration so that a
     * container that has not started yet still reports them.
     *
     * @throws IllegalStateException if any requested container port has no host binding
     */
    private static List<PortMapping> boundPortsOf(DockerClient docker, String containerId,
                                                  List<PortMapping> requested) {
        HostConfig hostConfig = docker.inspectContainerCmd(containerId).exec().getHostConfig();
        Map<ExposedPort, Ports.Binding[]> bindings = hostConfig != null && hostConfig.getPortBindings() != null
                ? hostConfig.getPortBindings().getBindings()
                : Map.of();
        var mappings = new ArrayList<PortMapping>(requested.size());
        for (PortMapping mapping : requested) {
            Integer hostPort = hostPortOf(bindings.get(toExposedPort(mapping.target())));
            if (hostPort == null) {
                throw new IllegalStateException("Container " + containerId + " has no host binding for "
                        + mapping.target().port() + "/" + mapping.target().protocol());
            }
            mappings.add(new PortMapping(hostPort, mapping.target()));
        }
        return mappings;
    }

    private static Integer hostPortOf(Ports.Binding[] bindings) {
        if (bindings == null) {
            return null;
        }
        for (Ports.Binding binding : bindings) {
            String spec = binding != null ? binding.getHostPortSpec() : null;
            if (spec != null && spec.matches("\\d{1,5}")) {
                int port = Integer.parseInt(spec);
                if (port > 0 && port <= 65535) {
                    return port;
                }
            }
        }
        return null;
    }
}
