package com.arenabox.dispatch.api;

import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and replaces the orchestrator configuration. Key material is never returned, only whether
 * it is present.
 */
@RestController
@RequestMapping("/api/v1/admin/config")
public class ConfigController {

    private static final Logger log = LoggerFactory.getLogger(ConfigController.class);

    private final OrchestratorConfigStore configStore;
    private final ParticipantResolver participantResolver;

    public ConfigController(OrchestratorConfigStore configStore, ParticipantResolver participantResolver) {
        this.configStore = configStore;
        this.participantResolver = participantResolver;
    }

    @GetMapping
    public ResponseEntity<?> get() {
        return configStore.get()
                .<ResponseEntity<?>>map(config -> ResponseEntity.ok(view(config)))
                .orElseGet(() -> ErrorResponses.of(HttpStatus.NOT_FOUND, "Orchestrator endpoint is not configured"));
    }

    @PutMapping
    public ResponseEntity<?> replace(@RequestBody ConfigRequest body, HttpServletRequest request) {
        if (body.hostname() == null || body.hostname().isBlank()) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "Hostname is required");
        }
        if (body.hostname().contains("://") || body.hostname().contains("/")) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "Hostname must be host:port without a scheme or path");
        }

        Optional<OrchestratorConfig> current = configStore.get();
        var config = new OrchestratorConfig(
                body.hostname().trim(),
                body.tlsEnabled(),
                keepIfBlank(body.caCert(), current.map(OrchestratorConfig::caCert)),
                keepIfBlank(body.clientCert(), current.map(OrchestratorConfig::clientCert)),
                keepIfBlank(body.clientKey(), current.map(OrchestratorConfig::clientKey)),
                OrchestratorConfig.parseRepositories(body.repositories())
        );
        if (config.tlsEnabled() && !config.hasCredentialMaterial()) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST,
                    "TLS requires a CA certificate, a client certificate and a client key");
        }

        OrchestratorConfig saved = configStore.save(config);
        log.info("Orchestrator configuration replaced by {}", participantResolver.admin(request));
        return ResponseEntity.ok(view(saved));
    }

    private static String keepIfBlank(String submitted, Optional<String> stored) {
        return submitted != null && !submitted.isBlank() ? submitted : stored.orElse(null);
    }

    private static Map<String, Object> view(OrchestratorConfig config) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("hostname", config.hostname());
        view.put("tls_enabled", config.tlsEnabled());
        view.put("ca_cert_present", config.caCert() != null && !config.caCert().isBlank());
        view.put("client_cert_present", config.clientCert() != null && !config.clientCert().isBlank());
        view.put("client_key_present", config.clientKey() != null && !config.clientKey().isBlank());
        view.put("repositories", config.repositories());
        return view;
    }
}
