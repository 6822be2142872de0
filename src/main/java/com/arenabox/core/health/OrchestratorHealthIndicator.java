package com.arenabox.core.health;

import com.arenabox.core.model.EngineInfo;
import com.arenabox.core.model.OrchestratorConfig;
import com.arenabox.core.persistence.OrchestratorConfigStore;
import com.arenabox.sandbox.OrchestratorInventory;
import com.arenabox.transport.OrchestratorResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health indicator for the orchestration endpoint.
 * UNKNOWN until configured, UP with the engine version when it answers, DOWN otherwise.
 */
@Component("orchestratorHealthIndicator")
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final OrchestratorConfigStore configStore;
    private final OrchestratorInventory inventory;

    public OrchestratorHealthIndicator(OrchestratorConfigStore configStore, OrchestratorInventory inventory) {
        this.configStore = configStore;
        this.inventory = inventory;
    }

    @Override
    public Health health() {
        Optional<OrchestratorConfig> config = configStore.get().filter(OrchestratorConfig::isConfigured);
        if (config.isEmpty()) {
            return Health.unknown().withDetail("reason", "not configured").build();
        }

        OrchestratorResult<EngineInfo> info = inventory.engineInfo(config.get());
        if (!info.isSuccess()) {
            return Health.down()
                    .withDetail("hostname", config.get().hostname())
                    .withDetail("error", info.error())
                    .build();
        }
        return Health.up()
                .withDetail("hostname", config.get().hostname())
                .withDetail("tls", config.get().tlsEnabled())
                .withDetail("version", info.value().version())
                .withDetail("apiVersion", info.value().apiVersion())
                .withDetail("swarm", info.value().swarm())
                .build();
    }
}
