package com.arenabox.transport;

import com.arenabox.core.model.OrchestratorConfig;
import com.github.dockerjava.api.DockerClient;

import java.nio.file.Path;

/**
 * Builds a docker-java client for one call against the configured engine.
 */
@FunctionalInterface
public interface DockerClientFactory {

    /**
     * @param config  active orchestrator configuration
     * @param certDir directory holding {@code ca.pem}, {@code cert.pem}, {@code key.pem}, or {@code null} without TLS
     */
    DockerClient create(OrchestratorConfig config, Path certDir);
}
