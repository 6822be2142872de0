package com.arenabox.sandbox;

import com.arenabox.core.error.ValidationException;
import com.arenabox.core.model.ChallengeDefinition;
import com.arenabox.core.model.EngineInfo;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.PortSpec;
import com.arenabox.transport.OrchestratorClient;
import com.arenabox.transport.OrchestratorResult;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Image;
import com.github.dockerjava.api.model.PortConfig;
import com.github.dockerjava.api.model.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only lookups against the orchestrator: image metadata, ports in use, available repositories
 * and engine details.
 */
@Component
public class OrchestratorInventory {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorInventory.class);

    private static final String UNTAGGED = "<none>:<none>";

    private final OrchestratorClient client;

    public OrchestratorInventory(OrchestratorClient client) {
        this.client = client;
    }

    /**
     * Ports the image itself declares.
     */
    public OrchestratorResult<List<PortSpec>> imagePorts(OrchestratorConfig config, String image) {
        return client.execute(config, "inspect-image", docker -> {
            var response = docker.inspectImageCmd(image).exec();
            var ports = new ArrayList<PortSpec>();
            if (response.getConfig() != null && response.getConfig().getExposedPorts() != null) {
                for (ExposedPort port : response.getConfig().getExposedPorts()) {
                    ports.add(new PortSpec(port.getPort(), port.getProtocol().name()));
                }
            }
            return ports;
        });
    }

    /**
     * Union of the challenge's declared ports and the image's own, deduplicated. An image that cannot be
     * inspected (for example one only pulled on swarm workers) contributes nothing.
     */
    public List<PortSpec> requiredPorts(OrchestratorConfig config, ChallengeDefinition challenge) {
        var required = new LinkedHashSet<PortSpec>(challenge.exposedPorts());
        OrchestratorResult<List<PortSpec>> fromImage = imagePorts(config, challenge.image());
        if (fromImage.isSuccess()) {
            required.addAll(fromImage.value());
        } else {
            log.warn("Could not read exposed ports of {}: {}", challenge.image(), fromImage.error());
        }
        if (required.isEmpty()) {
            throw new ValidationException("Challenge " + challenge.id() + " declares no exposed ports and image "
                    + challenge.image() + " exposes none");
        }
        return new ArrayList<>(required);
    }

    /**
     * Snapshot of every host port bound by a container or published by a service.
     */
    public Set<Integer> boundPorts(OrchestratorConfig config) {
        return client.execute(config, "list-bound-ports", docker -> {
            var bound = new HashSet<Integer>();
            List<Container> containers = docker.listContainersCmd().withShowAll(true).exec();
            if (containers != null) {
                for (Container container : containers) {
                    if (container.getPorts() == null) {
                        continue;
                    }
                    for (ContainerPort port : container.getPorts()) {
                        if (port.getPublicPort() != null && port.getPublicPort() > 0) {
                            bound.add(port.getPublicPort());
                        }
                    }
                }
            }
            bound.addAll(servicePorts(docker));
            return bound;
        }).orElseThrow("port snapshot");
    }

    /**
     * Image {@code repo:tag} names on the engine, filtered by the configured repository allowlist.
     */
    public OrchestratorResult<List<String>> repositories(OrchestratorConfig config) {
        return client.execute(config, "list-images", docker -> {
            var names = new TreeSet<String>();
            List<Image> images = docker.listImagesCmd().withShowAll(true).exec();
            if (images != null) {
                for (Image image : images) {
                    if (image.getRepoTags() == null) {
                        continue;
                    }
                    for (String tag : image.getRepoTags()) {
                        if (!UNTAGGED.equals(tag) && config.allowsImage(tag)) {
                            names.add(tag);
                        }
                    }
                }
            }
            return List.copyOf(names);
        });
    }

    public OrchestratorResult<EngineInfo> engineInfo(OrchestratorConfig config) {
        return client.execute(config, "engine-info", docker -> {
            var version = docker.versionCmd().exec();
            var info = docker.infoCmd().exec();
            boolean swarm = info.getSwarm() != null && Boolean.TRUE.equals(info.getSwarm().getControlAvailable());
            return new EngineInfo(version.getVersion(), version.getApiVersion(), swarm);
        });
    }

    private static Set<Integer> servicePorts(DockerClient docker) {
        var ports = new HashSet<Integer>();
        List<Service> services;
        try {
            services = docker.listServicesCmd().exec();
        } catch (DockerException e) {
            // plain engines answer service calls with an error
            log.debug("Service listing unavailable, assuming non-swarm engine: {}", e.getMessage());
            return ports;
        }
        if (services == null) {
            return ports;
        }
        for (Service service : services) {
            if (service.getEndpoint() == null || service.getEndpoint().getPorts() == null) {
                continue;
            }
            for (PortConfig port : service.getEndpoint().getPorts()) {
                if (port.getPublishedPort() > 0) {
                    ports.add(port.getPublishedPort());
                }
            }
        }
        return ports;
    }
}
