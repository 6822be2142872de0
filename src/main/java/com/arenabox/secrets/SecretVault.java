package com.arenabox.secrets;

import com.arenabox.core.error.ConflictException;
import com.arenabox.core.error.NotFoundException;
import com.arenabox.core.error.PolicyViolationException;
import com.arenabox.core.error.SandboxException;
import com.arenabox.core.error.TransportException;
import com.arenabox.core.error.ValidationException;
import com.arenabox.core.metrics.SandboxMetrics;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.ChallengeDefinition;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.ResolvedSecret;
import com.arenabox.core.model.SecretInfo;
import com.arenabox.core.model.SecretReference;
import com.arenabox.core.persistence.ChallengeStore;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import com.arenabox.core.validation.InputValidator;
import com.arenabox.transport.OrchestratorClient;
import com.arenabox.transport.OrchestratorResult;
import com.github.dockerjava.api.model.Secret;
import com.github.dockerjava.api.model.SecretSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Creates, lists and deletes the credential material that multi-part sandboxes mount.
 *
 * <p>The orchestrator holds the secrets; values are sent once on creation and never read back or
 * logged. Creation requires TLS on both the administrator's connection and the orchestrator connection.
 * Every change is written to the {@code arenabox.audit} logger with the acting administrator.
 */
@Service
public class SecretVault {

    private static final Logger log = LoggerFactory.getLogger(SecretVault.class);
    private static final Logger audit = LoggerFactory.getLogger("arenabox.audit");

    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_CONFLICT = 409;

    private final OrchestratorClient client;
    private final OrchestratorConfigStore configStore;
    private final ChallengeStore challengeStore;
    private final SandboxMetrics metrics;

    public SecretVault(OrchestratorClient client, OrchestratorConfigStore configStore,
                       ChallengeStore challengeStore, SandboxMetrics metrics) {
        this.client = client;
        this.configStore = configStore;
        this.challengeStore = challengeStore;
        this.metrics = metrics;
    }

    public List<SecretInfo> list() {
        return list(configStore.require());
    }

    public List<SecretInfo> list(OrchestratorConfig config) {
        return client.execute(config, "list-secrets", docker -> docker.listSecretsCmd().exec().stream()
                        .map(SecretVault::toInfo)
                        .toList())
                .orElseThrow("secret listing");
    }

    /**
     * Resolves a challenge's references against the secrets the orchestrator currently holds.
     *
     * @throws NotFoundException if any referenced secret no longer exists
     */
    public List<ResolvedSecret> resolve(OrchestratorConfig config, List<SecretReference> references) {
        if (references.isEmpty()) {
            return List.of();
        }
        Map<String, SecretInfo> byId = list(config).stream()
                .collect(Collectors.toMap(SecretInfo::id, s -> s, (a, b) -> a, LinkedHashMap::new));
        var resolved = new ArrayList<ResolvedSecret>(references.size());
        for (SecretReference reference : references) {
            SecretInfo info = byId.get(reference.id());
            if (info == null) {
                throw new NotFoundException("Secret " + reference.id() + " referenced by the challenge does not exist");
            }
            resolved.add(new ResolvedSecret(info.id(), info.name(), reference.protectedMode()));
        }
        return resolved;
    }

    /**
     * @param inboundSecure whether the administrator's own request arrived over TLS
     * @param actor         administrator identity for the audit trail
     */
    public SecretInfo create(String name, String value, boolean inboundSecure, String actor) {
        InputValidator.requireSecretName(name);
        if (value == null || value.isEmpty()) {
            throw new ValidationException("Secret value is required");
        }
        OrchestratorConfig config = configStore.require();
        if (!inboundSecure || !config.tlsEnabled()) {
            metrics.recordSecretOperation("create", false);
            audit.warn("Refused secret creation '{}' by {}: inboundTls={}, orchestratorTls={}",
                    name, actor, inboundSecure, config.tlsEnabled());
            throw new PolicyViolationException("Secrets can only be created when both the admin connection "
                    + "and the orchestrator connection use TLS");
        }
        if (list(config).stream().anyMatch(s -> name.equals(s.name()))) {
            metrics.recordSecretOperation("create", false);
            throw new ConflictException("Secret name '" + name + "' is already in use");
        }

        OrchestratorResult<String> result = client.execute(config, "create-secret",
                docker -> docker.createSecretCmd(new SecretSpec().withName(name).withData(value)).exec().getId());
        metrics.recordSecretOperation("create", result.isSuccess());
        if (!result.isSuccess()) {
            if (result.statusCode() == HTTP_CONFLICT) {
                throw new ConflictException("Secret name '" + name + "' is already in use");
            }
            throw new TransportException("Failed to create secret '" + name + "': " + result.error());
        }
        audit.info("Secret '{}' ({}) created by {}", name, result.value(), actor);
        return new SecretInfo(result.value(), name);
    }

    /**
     * @throws ConflictException while any multi-part challenge still references the secret
     */
    public void delete(String id, String actor) {
        InputValidator.requireSecretId(id);
        List<ChallengeDefinition> users = challengeStore.findReferencing(id);
        if (!users.isEmpty()) {
            metrics.recordSecretOperation("delete", false);
            String names = users.stream().map(c -> c.name() + " (" + c.id() + ")").collect(Collectors.joining(", "));
            throw new ConflictException("Secret " + id + " is in use by challenge(s): " + names);
        }

        OrchestratorConfig config = configStore.require();
        OrchestratorResult<Boolean> result = client.execute(config, "remove-secret", docker -> {
            docker.removeSecretCmd(id).exec();
            return Boolean.TRUE;
        });
        metrics.recordSecretOperation("delete", result.isSuccess());
        if (!result.isSuccess()) {
            if (result.statusCode() == HTTP_NOT_FOUND) {
                throw new NotFoundException("Secret " + id + " not found");
            }
            throw new TransportException("Failed to delete secret " + id + ": " + result.error());
        }
        audit.info("Secret {} deleted by {}", id, actor);
    }

    /**
     * Attempts every deletion independently.
     */
    public BulkResult deleteAll(String actor) {
        List<SecretInfo> secrets = list();
        int deleted = 0;
        var errors = new ArrayList<String>();
        for (SecretInfo secret : secrets) {
            try {
                delete(secret.id(), actor);
                deleted++;
            } catch (SandboxException e) {
                log.warn("Could not delete secret {} ({}): {}", secret.name(), secret.id(), e.getMessage());
                errors.add(secret.name() + ": " + e.getMessage());
            }
        }
        audit.info("Bulk secret deletion by {}: {} deleted, {} failed", actor, deleted, errors.size());
        return new BulkResult(deleted, errors.size(), errors);
    }

    private static SecretInfo toInfo(Secret secret) {
        String name = secret.getSpec() != null ? secret.getSpec().getName() : null;
        return new SecretInfo(secret.getId(), name);
    }
}
