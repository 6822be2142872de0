package com.arenabox.dispatch.api;

import com.arenabox.challenge.ChallengeService;
import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.ChallengeDefinition;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.model.SandboxKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/challenges")
public class ChallengeController {

    private final ChallengeService challengeService;

    public ChallengeController(ChallengeService challengeService) {
        this.challengeService = challengeService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable long id) {
        try {
            return ResponseEntity.ok(view(challengeService.get(id)));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> save(@PathVariable long id, @RequestBody ChallengeRequest body) {
        SandboxKind kind;
        try {
            kind = body.kind() == null || body.kind().isBlank()
                    ? SandboxKind.SINGLE
                    : SandboxKind.valueOf(body.kind().trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "Unknown challenge kind: " + body.kind());
        }
        try {
            var challenge = new ChallengeDefinition(id, body.name(), body.image(),
                    PortSpec.parseList(body.exposedPorts()), kind, body.secrets());
            return ResponseEntity.ok(view(challengeService.save(challenge)));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * DELETE /api/v1/admin/challenges/{id}: removes the challenge after tearing down its instances.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable long id) {
        try {
            var teardown = challengeService.delete(id);
            return ResponseEntity.ok(Map.of("success", true, "instances_removed", teardown.succeeded()));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    private static Map<String, Object> view(ChallengeDefinition challenge) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", challenge.id());
        view.put("name", challenge.name());
        view.put("image", challenge.image());
        view.put("exposed_ports", PortSpec.join(challenge.exposedPorts()));
        view.put("kind", challenge.kind().name());
        view.put("secrets", challenge.secrets());
        return view;
    }
}
