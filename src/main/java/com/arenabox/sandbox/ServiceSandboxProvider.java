package com.arenabox.sandbox;

import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.ResolvedSecret;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.transport.OrchestratorClient;
import com.arenabox.transport.OrchestratorResult;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.ContainerSpec;
import com.github.dockerjava.api.model.ContainerSpecFile;
import com.github.dockerjava.api.model.ContainerSpecSecret;
import com.github.dockerjava.api.model.EndpointResolutionMode;
import com.github.dockerjava.api.model.EndpointSpec;
import com.github.dockerjava.api.model.PortConfig;
import com.github.dockerjava.api.model.PortConfigProtocol;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Multi-part sandboxes run as swarm services. Ports are published through the ingress routing mesh
 * and resolved secrets are mounted under {@code /run/secrets/<name>}.
 */
public class ServiceSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(ServiceSandboxProvider.class);

    static final String SECRET_OWNER = "1";

    private final OrchestratorClient client;

    public ServiceSandboxProvider(OrchestratorClient client) {
        this.client = client;
    }

    @Override
    public SandboxKind kind() {
        return SandboxKind.MULTI_PART;
    }

    @Override
    public OrchestratorResult<ProvisionedSandbox> openSandbox(OrchestratorConfig config, SandboxRequest request) {
        ServiceSpec spec = buildSpec(request);
        return client.execute(config, "create-service", docker -> {
            String serviceId = docker.createServiceCmd(spec).exec().getId();
            log.info("Created service {} ({}) from {} with {} secret(s)",
                    request.name(), serviceId, request.image(), request.secrets().size());
            return new ProvisionedSandbox(serviceId, request.ports());
        });
    }

    @Override
    public OrchestratorResult<Boolean> teardownSandbox(OrchestratorConfig config, String handle) {
        return client.execute(config, "remove-service", docker -> {
            try {
                docker.removeServiceCmd(handle).exec();
                log.info("Service {} removed", handle);
            } catch (NotFoundException e) {
                log.info("Service {} already gone", handle);
            }
            return Boolean.TRUE;
        });
    }

    static ServiceSpec buildSpec(SandboxRequest request) {
        List<ContainerSpecSecret> secrets = request.secrets().stream()
                .map(ServiceSandboxProvider::toSpecSecret)
                .toList();

        List<PortConfig> ports = request.ports().stream()
                .map(ServiceSandboxProvider::toPortConfig)
                .toList();

        var containerSpec = new ContainerSpec()
                .withImage(request.image())
                .withSecrets(secrets);

        return new ServiceSpec()
                .withName(request.name())
                .withTaskTemplate(new TaskSpec().withContainerSpec(containerSpec))
                .withEndpointSpec(new EndpointSpec()
                        .withMode(EndpointResolutionMode.VIP)
                        .withPorts(ports));
    }

    private static ContainerSpecSecret toSpecSecret(ResolvedSecret secret) {
        return new ContainerSpecSecret()
                .withSecretId(secret.id())
                .withSecretName(secret.name())
                .withFile(new ContainerSpecFile()
                        .withName(secret.name())
                        .withUid(SECRET_OWNER)
                        .withGid(SECRET_OWNER)
                        .withMode(secret.fileMode()));
    }

    private static PortConfig toPortConfig(PortMapping mapping) {
        return new PortConfig()
                .withName("Exposed Port " + mapping.target().port())
                .withProtocol("udp".equals(mapping.target().protocol()) ? PortConfigProtocol.UDP : PortConfigProtocol.TCP)
                .withTargetPort(mapping.target().port())
                .withPublishedPort(mapping.publishedPort())
                .withPublishMode(PortConfig.PublishMode.ingress);
    }
}
