package com.arenabox.transport;

import com.arenabox.core.model.OrchestratorConfig;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.DockerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.function.Function;

/**
 * Stateless gateway to the orchestration endpoint.
 *
 * <p>Every call builds a client from the configuration passed in, so a configuration change applies
 * to the next call. With TLS enabled the key material is written to a private temporary directory
 * right before the call and removed afterwards on every exit path. Transport failures, including
 * timeouts, come back as a failed {@link OrchestratorResult} instead of an exception.
 */
@Component
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final DockerClientFactory clientFactory;

    public OrchestratorClient(DockerClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Runs one orchestrator operation.
     *
     * @param config    active configuration, read fresh by the caller
     * @param operation short label used in logs, e.g. {@code "create-container"}
     * @param call      the docker-java interaction; a {@code null} return counts as an unusable response
     */
    public <T> OrchestratorResult<T> execute(OrchestratorConfig config, String operation,
                                             Function<DockerClient, T> call) {
        if (config == null || !config.isConfigured()) {
            log.error("Orchestrator endpoint is not configured, skipping {}", operation);
            return OrchestratorResult.failure("orchestrator endpoint is not configured");
        }

        log.info("Orchestrator request {} -> {}://{}", operation, config.tlsEnabled() ? "https" : "http",
                config.hostname());

        try (CredentialMaterial material = config.tlsEnabled() ? CredentialMaterial.materialize(config) : null) {
            DockerClient client = clientFactory.create(config, material != null ? material.directory() : null);
            try {
                T value = call.apply(client);
                if (value == null) {
                    log.error("Orchestrator returned no usable data for {}", operation);
                    return OrchestratorResult.failure("empty response for " + operation);
                }
                return OrchestratorResult.success(value);
            } finally {
                closeClient(client, operation);
            }
        } catch (DockerException e) {
            String message = redact(e.getMessage());
            log.warn("Orchestrator rejected {} (HTTP {}): {}", operation, e.getHttpStatus(), message);
            return OrchestratorResult.failure(message, e.getHttpStatus());
        } catch (IOException e) {
            log.error("Could not prepare TLS material for {}: {}", operation, e.getMessage());
            return OrchestratorResult.failure("TLS material unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            // connection refused, timeouts and unparsable bodies all surface as runtime exceptions
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Orchestrator call {} failed: {}", operation, redact(message));
            return OrchestratorResult.failure(redact(message));
        }
    }

    private static void closeClient(DockerClient client, String operation) {
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (IOException e) {
            log.warn("Failed to close orchestrator client after {}: {}", operation, e.getMessage());
        }
    }

    /**
     * Error bodies for secret calls can echo the submitted payload.
     */
    static String redact(String message) {
        if (message == null) {
            return "unknown error";
        }
        if (message.contains("Data") || message.contains("base64")) {
            return "[REDACTED - contains secret data]";
        }
        return message;
    }
}
