package com.arenabox.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for PUT /api/v1/admin/config.
 *
 * @param hostname     {@code host:port} of the engine API
 * @param tlsEnabled   mutual TLS on the orchestrator connection
 * @param caCert       PEM text; blank keeps the stored value
 * @param clientCert   PEM text; blank keeps the stored value
 * @param clientKey    PEM text; blank keeps the stored value
 * @param repositories comma-separated allowlist, blank for none
 */
public record ConfigRequest(
        String hostname,
        @JsonProperty("tls_enabled") boolean tlsEnabled,
        @JsonProperty("ca_cert") String caCert,
        @JsonProperty("client_cert") String clientCert,
        @JsonProperty("client_key") String clientKey,
        String repositories
) {

    @Override
    public String toString() {
        return "ConfigRequest[hostname=" + hostname + ", tlsEnabled=" + tlsEnabled + "]";
    }
}
