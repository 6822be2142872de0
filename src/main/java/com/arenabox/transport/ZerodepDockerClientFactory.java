package com.arenabox.transport;

import com.arenabox.core.model.OrchestratorConfig;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;

import java.nio.file.Path;

/**
 * Creates docker-java clients on the zerodep HTTP transport with bounded connect and response timeouts.
 */
public class ZerodepDockerClientFactory implements DockerClientFactory {

    private final TransportProperties properties;

    public ZerodepDockerClientFactory(TransportProperties properties) {
        this.properties = properties;
    }

    @Override
    public DockerClient create(OrchestratorConfig config, Path certDir) {
        var builder = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost("tcp://" + config.hostname())
                .withDockerTlsVerify(certDir != null);
        if (certDir != null) {
            builder.withDockerCertPath(certDir.toString());
        }
        var clientConfig = builder.build();
        // The SSL context is built here, while the certificate directory still exists
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(clientConfig.getDockerHost())
                .sslConfig(clientConfig.getSSLConfig())
                .connectionTimeout(properties.getConnectTimeout())
                .responseTimeout(properties.getResponseTimeout())
                .build();
        return DockerClientImpl.getInstance(clientConfig, httpClient);
    }
}
