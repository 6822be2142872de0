package com.arenabox.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * The single active description of the orchestration endpoint.
 *
 * @param hostname     {@code host:port} of the Docker engine API
 * @param tlsEnabled   true for mutually authenticated TLS
 * @param caCert       PEM text of the CA certificate
 * @param clientCert   PEM text of the client certificate
 * @param clientKey    PEM text of the client private key
 * @param repositories allowed image repositories, empty for no restriction
 */
public record OrchestratorConfig(
        String hostname,
        boolean tlsEnabled,
        String caCert,
        String clientCert,
        String clientKey,
        List<String> repositories
) {

    public OrchestratorConfig {
        repositories = repositories != null ? List.copyOf(repositories) : List.of();
    }

    public static List<String> parseRepositories(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public boolean isConfigured() {
        return hostname != null && !hostname.isBlank();
    }

    public boolean hasCredentialMaterial() {
        return notBlank(caCert) && notBlank(clientCert) && notBlank(clientKey);
    }

    /** Host name without the API port, which is where published sandbox ports are reachable. */
    public String publicHost() {
        if (hostname == null) {
            return "";
        }
        int idx = hostname.lastIndexOf(':');
        return idx > 0 ? hostname.substring(0, idx) : hostname;
    }

    /** Whether an image's repository passes the allowlist. */
    public boolean allowsImage(String image) {
        if (repositories.isEmpty()) {
            return true;
        }
        return repositories.contains(repositoryOf(image));
    }

    public static String repositoryOf(String image) {
        String withoutDigest = image.contains("@") ? image.substring(0, image.indexOf('@')) : image;
        int slash = withoutDigest.lastIndexOf('/');
        int colon = withoutDigest.lastIndexOf(':');
        return colon > slash ? withoutDigest.substring(0, colon) : withoutDigest;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    @Override
    public String toString() {
        return "OrchestratorConfig[hostname=" + hostname + ", tlsEnabled=" + tlsEnabled
                + ", repositories=" + repositories + "]";
    }
}
