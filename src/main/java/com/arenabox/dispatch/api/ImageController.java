package com.arenabox.dispatch.api;

import com.arenabox.core.error.SandboxException;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import com.arenabox.core.validation.InputValidator;
import com.arenabox.sandbox.OrchestratorInventory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only orchestrator lookups for the admin pages.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class ImageController {

    private final OrchestratorConfigStore configStore;
    private final OrchestratorInventory inventory;

    public ImageController(OrchestratorConfigStore configStore, OrchestratorInventory inventory) {
        this.configStore = configStore;
        this.inventory = inventory;
    }

    @GetMapping("/images")
    public ResponseEntity<?> repositories() {
        try {
            OrchestratorConfig config = configStore.require();
            return ResponseEntity.ok(Map.of("success", true,
                    "data", inventory.repositories(config).orElseThrow("image listing")));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * GET /api/v1/admin/images/ports?image=nginx:alpine
     */
    @GetMapping("/images/ports")
    public ResponseEntity<?> imagePorts(@RequestParam String image) {
        try {
            InputValidator.requireImageReference(image);
            OrchestratorConfig config = configStore.require();
            var ports = inventory.imagePorts(config, image).orElseThrow("image inspection");
            return ResponseEntity.ok(Map.of("success", true,
                    "ports", ports.stream().map(PortSpec::toString).toList()));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/engine")
    public ResponseEntity<?> engine() {
        try {
            OrchestratorConfig config = configStore.require();
            return ResponseEntity.ok(inventory.engineInfo(config).orElseThrow("engine info"));
        } catch (SandboxException e) {
            return ErrorResponses.of(e);
        }
    }
}
