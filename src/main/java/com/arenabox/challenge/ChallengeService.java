package com.arenabox.challenge;

import com.arenabox.core.error.NotFoundException;
import com.arenabox.core.error.TransportException;
import com.arenabox.core.error.ValidationException;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.ChallengeDefinition;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.core.model.SecretReference;
import com.arenabox.core.persistence.ChallengeStore;
import com.arenabox.core.validation.InputValidator;
import com.arenabox.sandbox.SandboxManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Administrative create, update and delete of challenge definitions.
 */
@Service
public class ChallengeService {

    private static final Logger log = LoggerFactory.getLogger(ChallengeService.class);

    private static final int MAX_NAME_LENGTH = 255;

    private final ChallengeStore store;
    private final SandboxManager sandboxManager;

    public ChallengeService(ChallengeStore store, SandboxManager sandboxManager) {
        this.store = store;
        this.sandboxManager = sandboxManager;
    }

    public ChallengeDefinition get(long id) {
        return store.findById(id).orElseThrow(() -> new NotFoundException("Challenge " + id + " not found"));
    }

    public ChallengeDefinition save(ChallengeDefinition challenge) {
        if (challenge.name() == null || challenge.name().isBlank()) {
            throw new ValidationException("Challenge name is required");
        }
        if (challenge.name().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Challenge name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        if (challenge.kind() == null) {
            throw new ValidationException("Challenge kind is required");
        }
        InputValidator.requireImageReference(challenge.image());
        if (challenge.exposedPorts().isEmpty()) {
            throw new ValidationException("At least one exposed port must be configured. "
                    + "Please add a port in the format: port/protocol (e.g., 80/tcp)");
        }
        if (challenge.kind() == SandboxKind.MULTI_PART) {
            for (SecretReference secret : challenge.secrets()) {
                InputValidator.requireSecretId(secret.id());
            }
        }
        return store.save(challenge);
    }

    /**
     * Tears down every running instance of the challenge, then removes the definition. The definition
     * stays if any teardown fails so the instances remain reachable for a retry.
     */
    public BulkResult delete(long id) {
        get(id);
        BulkResult teardown = sandboxManager.onChallengeDeleted(id);
        if (!teardown.success()) {
            throw new TransportException("Challenge " + id + " kept: " + teardown.failed()
                    + " instance(s) could not be removed");
        }
        store.delete(id);
        log.info("Challenge {} deleted after removing {} instance(s)", id, teardown.succeeded());
        return teardown;
    }
}
