package com.arenabox.dispatch.api;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.SecretInfo;
import com.arenabox.secrets.SecretVault;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative secret management. Creation is only accepted over TLS, see {@link SecretVault}.
 */
@RestController
@RequestMapping("/api/v1/admin/secrets")
public class SecretController {

    private final SecretVault secretVault;
    private final ParticipantResolver participantResolver;

    public SecretController(SecretVault secretVault, ParticipantResolver participantResolver) {
        this.secretVault = secretVault;
        this.participantResolver = participantResolver;
    }

    @GetMapping
    public ResponseEntity<?> list() {
        try {
            return ResponseEntity.ok(Map.of("success", true, "data", secretVault.list()));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody SecretRequest body, HttpServletRequest request) {
        try {
            SecretInfo created = secretVault.create(body.name(), body.value(), request.isSecure(),
                    participantResolver.admin(request));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("id", created.id());
            response.put("name", created.name());
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id, HttpServletRequest request) {
        try {
            secretVault.delete(id, participantResolver.admin(request));
            return ResponseEntity.ok(Map.of("success", true));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    @DeleteMapping
    public ResponseEntity<?> deleteAll(HttpServletRequest request) {
        try {
            return ResponseEntity.ok(secretVault.deleteAll(participantResolver.admin(request)));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }
}
