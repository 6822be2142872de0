package com.arenabox.dispatch.api;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.BulkResult;
import com.arenabox.core.model.Instance;
import com.arenabox.sandbox.SandboxManager;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/instances")
public class AdminInstanceController {

    private static final Logger log = LoggerFactory.getLogger(AdminInstanceController.class);

    private final SandboxManager sandboxManager;
    private final ParticipantResolver participantResolver;

    public AdminInstanceController(SandboxManager sandboxManager, ParticipantResolver participantResolver) {
        this.sandboxManager = sandboxManager;
        this.participantResolver = participantResolver;
    }

    @DeleteMapping("/{handle}")
    public ResponseEntity<?> kill(@PathVariable String handle, HttpServletRequest request) {
        try {
            Instance killed = sandboxManager.forceKill(handle);
            log.info("Instance {} killed by {}", handle, participantResolver.admin(request));
            return ResponseEntity.ok(Map.of("success", true, "instance", InstanceResponse.from(killed)));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * DELETE /api/v1/admin/instances: kills every tracked instance.
     */
    @DeleteMapping
    public ResponseEntity<?> killAll(HttpServletRequest request) {
        try {
            BulkResult result = sandboxManager.forceKillAll();
            log.info("Bulk kill by {}: {} killed, {} failed",
                    participantResolver.admin(request), result.succeeded(), result.failed());
            return ResponseEntity.ok(result);
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }
}
