package com.arenabox.dispatch.api;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.Participant;
import com.arenabox.sandbox.SandboxManager;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Participant-facing sandbox endpoints. The caller is identified by the forwarded identity headers.
 */
@RestController
@RequestMapping("/api/v1/instances")
public class InstanceController {

    private static final Logger log = LoggerFactory.getLogger(InstanceController.class);

    private final SandboxManager sandboxManager;
    private final ParticipantResolver participantResolver;

    public InstanceController(SandboxManager sandboxManager, ParticipantResolver participantResolver) {
        this.sandboxManager = sandboxManager;
        this.participantResolver = participantResolver;
    }

    /**
     * POST /api/v1/instances/{challengeId}: 201 when a sandbox was created, 200 when one already ran.
     */
    @PostMapping("/{challengeId}")
    public ResponseEntity<?> provision(@PathVariable long challengeId, HttpServletRequest request) {
        try {
            Participant participant = participantResolver.participant(request);
            var outcome = sandboxManager.provision(participant, challengeId);
            HttpStatus status = outcome.created() ? HttpStatus.CREATED : HttpStatus.OK;
            return ResponseEntity.status(status).body(InstanceResponse.from(outcome.instance()));
        } catch (SandboxException e) {
            log.warn("Provisioning challenge {} failed: {}", challengeId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    @GetMapping
    public ResponseEntity<?> list(HttpServletRequest request) {
        try {
            Participant participant = participantResolver.participant(request);
            List<InstanceResponse> instances = sandboxManager.list(participant).stream()
                    .map(InstanceResponse::from)
                    .toList();
            return ResponseEntity.ok(instances);
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/{challengeId}/revert")
    public ResponseEntity<?> revert(@PathVariable long challengeId, HttpServletRequest request) {
        try {
            Participant participant = participantResolver.participant(request);
            var outcome = sandboxManager.revert(participant, challengeId);
            return ResponseEntity.status(HttpStatus.CREATED).body(InstanceResponse.from(outcome.instance()));
        } catch (SandboxException e) {
            log.warn("Revert of challenge {} failed: {}", challengeId, e.getMessage());
            return ErrorResponses.of(e);
        }
    }
}
