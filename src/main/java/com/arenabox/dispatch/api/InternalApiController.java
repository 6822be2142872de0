package com.arenabox.dispatch.api;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.ParticipantKind;
import com.arenabox.sandbox.SandboxManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Internal endpoints called by the host platform's scoring side.
 */
@RestController
@RequestMapping("/api/internal")
public class InternalApiController {

    private static final Logger log = LoggerFactory.getLogger(InternalApiController.class);

    private final SandboxManager sandboxManager;

    public InternalApiController(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @PostMapping("/solves")
    public ResponseEntity<?> solved(@RequestBody SolveRequest request) {
        if (request.participantKind() == null || request.participantId() == null || request.challengeId() == null) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST,
                    "participant_kind, participant_id and challenge_id are required");
        }
        Participant participant;
        try {
            participant = new Participant(ParticipantKind.parse(request.participantKind()), request.participantId());
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        try {
            int removed = sandboxManager.onSolve(participant, request.challengeId());
            log.info("Solve hook for {} on challenge {}", participant.key(), request.challengeId());
            return ResponseEntity.ok(Map.of("success", true, "removed", removed));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }
}
